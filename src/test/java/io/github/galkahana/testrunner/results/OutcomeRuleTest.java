package io.github.galkahana.testrunner.results;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class OutcomeRuleTest {

    @Test
    public void testEachOutcomeMapsToItsRule() {
        assertEquals(OutcomeRule.FAILURE, OutcomeRule.of(ExecutionOutcome.failed("trace")));
        assertEquals(OutcomeRule.ERROR, OutcomeRule.of(ExecutionOutcome.errored("trace")));
        assertEquals(OutcomeRule.SKIP, OutcomeRule.of(ExecutionOutcome.skipped("later")));
        assertEquals(OutcomeRule.EXPECTED_FAILURE, OutcomeRule.of(ExecutionOutcome.failedAsExpected("trace")));
        assertEquals(OutcomeRule.UNEXPECTED_SUCCESS, OutcomeRule.of(ExecutionOutcome.unexpectedlyPassed()));
        assertEquals(OutcomeRule.PASS, OutcomeRule.of(ExecutionOutcome.passed()));
    }

    @Test
    public void testFirstApplicableRuleWins() {
        ExecutionOutcome failedAndSkipped = new ExecutionOutcome(true, false, true, false, false, "x");
        ExecutionOutcome erroredAndExpected = new ExecutionOutcome(false, true, false, true, false, "x");

        assertEquals(OutcomeRule.FAILURE, OutcomeRule.of(failedAndSkipped));
        assertEquals(OutcomeRule.ERROR, OutcomeRule.of(erroredAndExpected));
    }

    @Test
    public void testFailure_AppendsDetailToErr() {
        Result result = OutcomeRule.toResult(ExecutionOutcome.failed("Traceback"), "pkg.T.a", 10.0, 0.5,
                "out", "err:", 2, 77);

        assertEquals(ResultType.FAILURE, result.actual());
        assertEquals(Set.of(ResultType.PASS), result.expected());
        assertTrue(result.unexpected());
        assertEquals(1, result.code());
        assertEquals("out", result.out());
        assertEquals("err:Traceback", result.err());
        assertEquals(2, result.worker());
        assertEquals(77, result.pid());
    }

    @Test
    public void testExpectedFailure_IsNotUnexpected() {
        Result result = OutcomeRule.toResult(ExecutionOutcome.failedAsExpected("boom"), "t", 0, 0, "", "", 1, 1);

        assertEquals(ResultType.FAILURE, result.actual());
        assertEquals(Set.of(ResultType.FAILURE), result.expected());
        assertFalse(result.unexpected());
        assertEquals(1, result.code());
    }

    @Test
    public void testUnexpectedSuccess_PassesButIsUnexpected() {
        Result result = OutcomeRule.toResult(ExecutionOutcome.unexpectedlyPassed(), "t", 0, 0, "", "", 1, 1);

        assertEquals(ResultType.PASS, result.actual());
        assertEquals(Set.of(ResultType.FAILURE), result.expected());
        assertTrue(result.unexpected());
        assertEquals(0, result.code());
    }

    @Test
    public void testSkipAndPass() {
        Result skipped = OutcomeRule.toResult(ExecutionOutcome.skipped("not today"), "t", 0, 0, "", "", 1, 1);
        Result passed = OutcomeRule.toResult(ExecutionOutcome.passed(), "t", 0, 0, "", "", 1, 1);

        assertEquals(ResultType.SKIP, skipped.actual());
        assertEquals("not today", skipped.err());
        assertEquals(0, skipped.code());
        assertEquals(ResultType.PASS, passed.actual());
        assertFalse(passed.unexpected());
    }
}
