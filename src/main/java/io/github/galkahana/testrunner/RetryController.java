package io.github.galkahana.testrunner;

import java.util.SortedSet;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import io.github.galkahana.testrunner.results.ResultSet;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;

/**
 * Re-runs failed tests until they pass or the retry limit is used up.
 * <p>
 * The first attempt is the pass that has already run; each further attempt runs exactly the
 * tests that failed in the attempt before it. Results of every attempt are appended to the
 * run's result set, so the most recent result for a name is its final status.
 */
@Slf4j
public class RetryController {

    /** One retry attempt over the given failed tests. */
    @FunctionalInterface
    public interface RetryPass {
        ResultSet run(int attempt, SortedSet<String> failedNames) throws InterruptedException;
    }

    private final int retryLimit;
    private final Retry retry;
    private int attemptsRun = 0;

    /**
     * @param retryLimit Maximum number of retry attempts after the initial pass
     */
    public RetryController(int retryLimit) {
        if (retryLimit < 0) throw new IllegalArgumentException("retryLimit must not be negative, got " + retryLimit);
        this.retryLimit = retryLimit;

        RetryConfig config = RetryConfig.<SortedSet<String>>custom()
                .maxAttempts(retryLimit + 1)
                .intervalFunction(attempt -> 0L)
                .retryOnResult(failed -> !failed.isEmpty())
                .retryOnException(e -> false)
                .build();
        this.retry = Retry.of("failed-tests", config);
        this.retry.getEventPublisher()
                .onRetry(event -> log.info("Retrying failed tests, attempt #{} of {}", event.getNumberOfRetryAttempts(), retryLimit));
    }

    /**
     * Retry the failures recorded in {@code results}.
     *
     * @param results Results of the initial pass; retry results are appended to it
     * @param pass Runs one retry attempt
     * @param beforeFirstRetry Called once, just before the first retry attempt
     * @return Names still failing after the last attempt
     */
    public SortedSet<String> run(ResultSet results, RetryPass pass, Runnable beforeFirstRetry) throws InterruptedException {
        AtomicInteger attempt = new AtomicInteger(0);
        AtomicReference<SortedSet<String>> failed = new AtomicReference<>(results.failedTestNames());

        try {
            return retry.executeCallable(() -> {
                int current = attempt.getAndIncrement();
                if (current == 0) return failed.get();
                if (current == 1) beforeFirstRetry.run();

                ResultSet retryResults = pass.run(current, failed.get());
                results.addAll(retryResults);
                failed.set(retryResults.failedTestNames());
                attemptsRun = current;
                log.debug("Retry attempt #{} left {} failures", current, failed.get().size());
                return failed.get();
            });
        } catch (InterruptedException | RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Unexpected failure while retrying tests", e);
        }
    }

    /** Number of retry attempts made by the last {@link #run}, not counting the initial pass. */
    public int getAttemptsRun() {
        return attemptsRun;
    }

    public int getRetryLimit() {
        return retryLimit;
    }
}
