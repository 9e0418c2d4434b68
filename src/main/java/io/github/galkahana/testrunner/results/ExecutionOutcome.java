package io.github.galkahana.testrunner.results;

/**
 * What a single test body reported, before it is turned into a {@link Result}.
 *
 * @param failure an assertion failed
 * @param error the body threw something other than an assertion failure
 * @param skip the body asked to be skipped
 * @param expectedFailure the body failed and was expected to
 * @param unexpectedSuccess the body passed but was expected to fail
 * @param detail failure trace or skip reason, empty when there is none
 */
public record ExecutionOutcome(boolean failure, boolean error, boolean skip,
                               boolean expectedFailure, boolean unexpectedSuccess, String detail) {

    public ExecutionOutcome {
        detail = detail == null ? "" : detail;
    }

    public static ExecutionOutcome passed() {
        return new ExecutionOutcome(false, false, false, false, false, "");
    }

    public static ExecutionOutcome failed(String detail) {
        return new ExecutionOutcome(true, false, false, false, false, detail);
    }

    public static ExecutionOutcome errored(String detail) {
        return new ExecutionOutcome(false, true, false, false, false, detail);
    }

    public static ExecutionOutcome skipped(String reason) {
        return new ExecutionOutcome(false, false, true, false, false, reason);
    }

    public static ExecutionOutcome failedAsExpected(String detail) {
        return new ExecutionOutcome(false, false, false, true, false, detail);
    }

    public static ExecutionOutcome unexpectedlyPassed() {
        return new ExecutionOutcome(false, false, false, false, true, "");
    }
}
