package io.github.galkahana.testrunner.results;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Append-only, ordered collection of {@link Result}s.
 * <p>
 * Not thread-safe: only the thread draining the worker pool appends to it.
 * When a name has several results, the most recent one decides its final status.
 */
public class ResultSet {

    private final List<Result> results = new ArrayList<>();

    public void add(Result result) {
        results.add(result);
    }

    public void addAll(ResultSet other) {
        results.addAll(other.results);
    }

    /** All results, in the order they were added. */
    public List<Result> results() {
        return Collections.unmodifiableList(results);
    }

    public int size() {
        return results.size();
    }

    public List<Result> resultsFor(String name) {
        List<Result> matching = new ArrayList<>();
        for (Result result : results) {
            if (result.name().equals(name)) matching.add(result);
        }
        return matching;
    }

    /** Most recent result per name, ordered by first appearance. */
    public Map<String, Result> latestByName() {
        Map<String, Result> latest = new LinkedHashMap<>();
        for (Result result : results) {
            latest.put(result.name(), result);
        }
        return latest;
    }

    /** Names whose most recent result is an unexpected failure. */
    public SortedSet<String> failedTestNames() {
        SortedSet<String> failed = new TreeSet<>();
        for (Result result : latestByName().values()) {
            if (isUnexpectedFailure(result)) failed.add(result.name());
        }
        return failed;
    }

    public int numFailures() {
        return failedTestNames().size();
    }

    static boolean isUnexpectedFailure(Result result) {
        return result.actual() == ResultType.FAILURE && result.unexpected();
    }
}
