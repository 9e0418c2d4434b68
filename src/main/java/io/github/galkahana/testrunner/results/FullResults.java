package io.github.galkahana.testrunner.results;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Builds the full-results document summarizing a whole run.
 * <p>
 * Tests are stored in a tree keyed by the dotted segments of their names. Each leaf lists the
 * actual outcome of every attempt in order, the outcomes expected on the final attempt and the
 * duration of each attempt.
 */
public final class FullResults {

    public static final int VERSION = 3;
    public static final String PATH_DELIMITER = ".";

    private FullResults() {
    }

    public static ObjectNode make(Map<String, String> metadata, long secondsSinceEpoch,
                                  List<String> allTestNames, ResultSet resultSet, boolean interrupted) {
        ObjectNode full = Json.object();
        full.put("version", VERSION);
        full.put("interrupted", interrupted);
        full.put("path_delimiter", PATH_DELIMITER);
        full.put("seconds_since_epoch", secondsSinceEpoch);

        ObjectNode meta = full.putObject("metadata");
        metadata.forEach(meta::put);

        int failed = 0;
        int passed = 0;
        int skipped = 0;
        for (Result latest : resultSet.latestByName().values()) {
            if (ResultSet.isUnexpectedFailure(latest)) {
                failed++;
            } else if (latest.actual() == ResultType.PASS) {
                passed++;
            } else if (latest.actual() == ResultType.SKIP) {
                skipped++;
            }
        }
        ObjectNode byType = full.putObject("num_failures_by_type");
        byType.put(ResultType.FAILURE.toString(), failed);
        byType.put(ResultType.PASS.toString(), passed);
        byType.put(ResultType.SKIP.toString(), skipped);

        ObjectNode tests = full.putObject("tests");
        for (String name : allTestNames) {
            List<Result> attempts = resultSet.resultsFor(name);
            if (attempts.isEmpty()) continue;
            addToTrie(tests, name, leafFor(attempts));
        }
        return full;
    }

    /** Number of tests whose final outcome was an unexpected failure. */
    public static int numFailures(JsonNode fullResults) {
        return fullResults.path("num_failures_by_type").path(ResultType.FAILURE.toString()).asInt(0);
    }

    public static int exitCode(JsonNode fullResults) {
        return numFailures(fullResults) > 0 ? 1 : 0;
    }

    private static ObjectNode leafFor(List<Result> attempts) {
        Result last = attempts.get(attempts.size() - 1);
        ObjectNode leaf = Json.object();
        leaf.put("actual", attempts.stream()
                .map(r -> r.actual().toString())
                .collect(Collectors.joining(" ")));
        leaf.put("expected", last.expected().stream()
                .map(ResultType::toString)
                .sorted()
                .collect(Collectors.joining(" ")));
        ArrayNode times = leaf.putArray("times");
        attempts.forEach(r -> times.add(r.took()));
        if (last.unexpected()) {
            leaf.put("is_unexpected", true);
        }
        boolean sawFailure = attempts.stream().anyMatch(r -> r.actual() == ResultType.FAILURE);
        boolean sawPass = attempts.stream().anyMatch(r -> r.actual() == ResultType.PASS);
        if (sawFailure && sawPass) {
            leaf.put("is_flaky", true);
        }
        return leaf;
    }

    private static void addToTrie(ObjectNode trie, String name, ObjectNode leaf) {
        String[] segments = name.split("\\.");
        ObjectNode node = trie;
        for (int i = 0; i < segments.length - 1; i++) {
            JsonNode child = node.get(segments[i]);
            node = child instanceof ObjectNode ? (ObjectNode) child : node.putObject(segments[i]);
        }
        node.set(segments[segments.length - 1], leaf);
    }
}
