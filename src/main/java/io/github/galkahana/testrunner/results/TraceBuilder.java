package io.github.galkahana.testrunner.results;

import java.util.Map;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Builds a Chrome trace-event document from a run's results.
 * <p>
 * Every result becomes a complete ({@code "X"}) event on the thread of the worker that ran it.
 * Timestamps are microseconds since the start of the run.
 */
public class TraceBuilder {

    private static final double MICROS_PER_SECOND = 1_000_000.0;

    private final double runStartedTime;
    private final long pid;

    public TraceBuilder(double runStartedTime, long pid) {
        this.runStartedTime = runStartedTime;
        this.pid = pid;
    }

    public ObjectNode fromResults(ResultSet resultSet, Map<String, String> metadata) {
        ObjectNode trace = Json.object();
        ArrayNode events = trace.putArray("traceEvents");
        ObjectNode otherData = trace.putObject("otherData");
        metadata.forEach(otherData::put);

        for (Result result : resultSet.results()) {
            ObjectNode event = events.addObject();
            event.put("name", result.name());
            event.put("dur", micros(result.took()));
            event.put("ts", micros(result.started() - runStartedTime));
            event.put("ph", "X");
            event.put("pid", result.pid());
            event.put("tid", result.worker());

            ObjectNode args = event.putObject("args");
            ArrayNode expected = args.putArray("expected");
            result.expected().stream().map(ResultType::toString).sorted().forEach(expected::add);
            args.put("actual", result.actual().toString());
            args.put("out", result.out());
            args.put("err", result.err());
            args.put("code", result.code());
            args.put("unexpected", result.unexpected());
            args.put("flaky", result.flaky());
        }
        return trace;
    }

    /** Append a phase event spanning {@code start} to {@code end} on the orchestrator's thread. */
    public void addPhase(ObjectNode trace, String name, double start, double end) {
        ObjectNode event = ((ArrayNode) trace.get("traceEvents")).addObject();
        event.put("name", name);
        event.put("ts", micros(start - runStartedTime));
        event.put("dur", micros(end - start));
        event.put("ph", "X");
        event.put("pid", pid);
        event.put("tid", 0);
    }

    private static long micros(double seconds) {
        return (long) (seconds * MICROS_PER_SECOND);
    }
}
