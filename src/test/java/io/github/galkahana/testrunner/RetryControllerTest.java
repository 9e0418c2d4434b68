package io.github.galkahana.testrunner;

import io.github.galkahana.testrunner.results.Result;
import io.github.galkahana.testrunner.results.ResultSet;
import io.github.galkahana.testrunner.results.ResultType;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class RetryControllerTest {

    private static Result pass(String name) {
        return new Result(name, ResultType.PASS, 0, 0, 1, Set.of(ResultType.PASS), false, false, 0, "", "", 1);
    }

    private static Result fail(String name) {
        return Result.failure(name, 0, 0, 1, "broken", 1);
    }

    @Test
    public void testNoFailures_NoRetries() throws Exception {
        ResultSet results = new ResultSet();
        results.add(pass("a"));
        RetryController retries = new RetryController(3);
        AtomicInteger banners = new AtomicInteger();

        SortedSet<String> stillFailing = retries.run(results, (attempt, failed) -> {
            throw new AssertionError("should not retry");
        }, banners::incrementAndGet);

        assertTrue(stillFailing.isEmpty());
        assertEquals(0, retries.getAttemptsRun());
        assertEquals(0, banners.get());
    }

    @Test
    public void testRetriesOnlyPreviousFailures_UntilTheyPass() throws Exception {
        // Arrange - a fails twice more, b passes on the first retry
        ResultSet results = new ResultSet();
        results.add(fail("a"));
        results.add(fail("b"));
        results.add(pass("c"));
        List<SortedSet<String>> retried = new ArrayList<>();
        AtomicInteger beforeFirst = new AtomicInteger();

        // Act
        SortedSet<String> stillFailing = new RetryController(5).run(results, (attempt, failed) -> {
            retried.add(failed);
            ResultSet attemptResults = new ResultSet();
            for (String name : failed) {
                attemptResults.add(name.equals("a") && attempt < 3 ? fail(name) : pass(name));
            }
            return attemptResults;
        }, beforeFirst::incrementAndGet);

        // Assert
        assertTrue(stillFailing.isEmpty());
        assertEquals(List.of(Set.of("a", "b"), Set.of("a"), Set.of("a")), retried);
        assertEquals(1, beforeFirst.get());
        assertEquals(3 + 3 + 1, results.size());
        assertTrue(results.failedTestNames().isEmpty());
    }

    @Test
    public void testRetryLimit_IsRespected() throws Exception {
        ResultSet results = new ResultSet();
        results.add(fail("a"));
        RetryController retries = new RetryController(2);

        SortedSet<String> stillFailing = retries.run(results, (attempt, failed) -> {
            ResultSet attemptResults = new ResultSet();
            failed.forEach(name -> attemptResults.add(fail(name)));
            return attemptResults;
        }, () -> { });

        assertEquals(Set.of("a"), stillFailing);
        assertEquals(2, retries.getAttemptsRun());
        assertEquals(3, results.resultsFor("a").size());
    }

    @Test
    public void testZeroLimit_NeverRetries() throws Exception {
        ResultSet results = new ResultSet();
        results.add(fail("a"));

        SortedSet<String> stillFailing = new RetryController(0).run(results, (attempt, failed) -> {
            throw new AssertionError("should not retry");
        }, () -> { });

        assertEquals(Set.of("a"), stillFailing);
    }

    @Test
    public void testNegativeLimit_Throws() {
        assertThrows(IllegalArgumentException.class, () -> new RetryController(-1));
    }
}
