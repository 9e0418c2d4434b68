package io.github.galkahana.testrunner.results;

import java.util.Set;
import java.util.function.Predicate;

/**
 * Maps an {@link ExecutionOutcome} to result fields. Rules are tried in declaration order and
 * the first one that applies wins.
 */
public enum OutcomeRule {
    FAILURE(ExecutionOutcome::failure, ResultType.FAILURE, Set.of(ResultType.PASS), true, 1, true),
    ERROR(ExecutionOutcome::error, ResultType.FAILURE, Set.of(ResultType.PASS), true, 1, true),
    SKIP(ExecutionOutcome::skip, ResultType.SKIP, Set.of(ResultType.SKIP), false, 0, true),
    EXPECTED_FAILURE(ExecutionOutcome::expectedFailure, ResultType.FAILURE, Set.of(ResultType.FAILURE), false, 1, true),
    UNEXPECTED_SUCCESS(ExecutionOutcome::unexpectedSuccess, ResultType.PASS, Set.of(ResultType.FAILURE), true, 0, false),
    PASS(outcome -> true, ResultType.PASS, Set.of(ResultType.PASS), false, 0, false);

    private final Predicate<ExecutionOutcome> applies;
    private final ResultType actual;
    private final Set<ResultType> expected;
    private final boolean unexpected;
    private final int code;
    private final boolean keepsDetail;

    OutcomeRule(Predicate<ExecutionOutcome> applies, ResultType actual, Set<ResultType> expected,
                boolean unexpected, int code, boolean keepsDetail) {
        this.applies = applies;
        this.actual = actual;
        this.expected = expected;
        this.unexpected = unexpected;
        this.code = code;
        this.keepsDetail = keepsDetail;
    }

    public static OutcomeRule of(ExecutionOutcome outcome) {
        for (OutcomeRule rule : values()) {
            if (rule.applies.test(outcome)) return rule;
        }
        throw new IllegalStateException("PASS applies to every outcome");
    }

    /**
     * Build the result for a test whose body produced {@code outcome}. The outcome detail is
     * appended to the captured stderr.
     */
    public static Result toResult(ExecutionOutcome outcome, String name, double started, double took,
                                  String out, String err, int worker, long pid) {
        OutcomeRule rule = of(outcome);
        String fullErr = rule.keepsDetail ? err + outcome.detail() : err;
        return new Result(name, rule.actual, started, took, worker, rule.expected,
                rule.unexpected, false, rule.code, out, fullErr, pid);
    }

    public ResultType actual() {
        return actual;
    }

    public Set<ResultType> expected() {
        return expected;
    }

    public boolean unexpected() {
        return unexpected;
    }

    public int code() {
        return code;
    }
}
