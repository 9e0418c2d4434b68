package io.github.galkahana.testrunner.results;

import java.util.Objects;
import java.util.Set;

/**
 * Immutable record of one executed (or skipped) test.
 * <p>
 * Created exactly once per execution; a retry produces a new {@code Result} for the same name.
 *
 * @param name test id
 * @param actual what happened
 * @param started wall-clock start, seconds since the epoch
 * @param took duration in seconds
 * @param worker ordinal of the worker that produced the result, 0 when no worker was involved
 * @param expected outcomes that would not have been a surprise
 * @param unexpected whether {@code actual} is outside {@code expected}
 * @param flaky whether the outcome is known to be unstable
 * @param code 0 for success, nonzero for failure
 * @param out captured standard output
 * @param err captured standard error plus any failure detail
 * @param pid id of the process that ran the test
 */
public record Result(String name, ResultType actual, double started, double took, int worker,
                     Set<ResultType> expected, boolean unexpected, boolean flaky, int code,
                     String out, String err, long pid) {

    public Result {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(actual, "actual");
        expected = Set.copyOf(expected);
        out = out == null ? "" : out;
        err = err == null ? "" : err;
    }

    /** A test that never reached a worker because it was skipped up front. */
    public static Result skipped(String name, String message, double started, double took, long pid) {
        return new Result(name, ResultType.SKIP, started, took, 0, Set.of(ResultType.SKIP),
                false, false, 0, message, "", pid);
    }

    /** A test that could not be loaded or whose execution broke down outside its own body. */
    public static Result failure(String name, double started, double took, int worker, String err, long pid) {
        return new Result(name, ResultType.FAILURE, started, took, worker, Set.of(ResultType.PASS),
                true, false, 1, "", err, pid);
    }
}
