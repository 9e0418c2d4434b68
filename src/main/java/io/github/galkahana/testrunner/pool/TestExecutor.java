package io.github.galkahana.testrunner.pool;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import io.github.galkahana.testrunner.TestInput;
import io.github.galkahana.testrunner.host.CapturedOutput;
import io.github.galkahana.testrunner.host.Host;
import io.github.galkahana.testrunner.loader.LoadException;
import io.github.galkahana.testrunner.loader.Loader;
import io.github.galkahana.testrunner.loader.SkipTestException;
import io.github.galkahana.testrunner.loader.TestCase;
import io.github.galkahana.testrunner.loader.TestGroup;
import io.github.galkahana.testrunner.results.ExecutionOutcome;
import io.github.galkahana.testrunner.results.OutcomeRule;
import io.github.galkahana.testrunner.results.Result;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs a single test on a worker: capture output, resolve the test by name, run it and turn
 * what happened into a {@link Result}.
 * <p>
 * If the loader cannot resolve the name directly, the worker walks the name from its longest
 * dotted prefix to its shortest, looking for a group with a member whose id is exactly the name.
 * The first match wins. Resolving to anything other than exactly one test is a failure.
 */
@Slf4j
public class TestExecutor implements WorkerFunction {

    @Override
    public Result apply(WorkerContext worker, TestInput input) {
        Host host = worker.getHost();
        WorkerSpec spec = worker.getSpec();
        long pid = host.getPid();
        String name = input.name();

        double start = host.time();
        // Capture before loading so nothing the loader prints escapes.
        host.captureOutput(!spec.isPassthrough());

        List<TestCase> tests;
        String loadError = null;
        ExecutionOutcome outcome = null;
        CapturedOutput captured;
        try {
            try {
                tests = spec.getLoader().loadTestsFromName(name);
            } catch (LoadException | RuntimeException e) {
                loadError = e.getMessage();
                tests = loadViaGroups(worker, name);
            }
            if (tests.size() == 1) {
                outcome = spec.isDryRun() ? ExecutionOutcome.passed() : execute(tests.get(0), worker);
            } else if (loadError == null || !tests.isEmpty()) {
                loadError = "expected exactly one test, found " + tests.size();
            }
        } catch (RuntimeException e) {
            loadError = String.valueOf(e);
        } finally {
            captured = host.restoreOutput();
        }
        double took = host.time() - start;

        if (outcome == null) {
            log.debug("Worker {} could not load {}: {}", worker.getWorkerNum(), name, loadError);
            return Result.failure(name, start, took, worker.getWorkerNum(), "failed to load " + name + ": " + loadError, pid);
        }
        return OutcomeRule.toResult(outcome, name, start, took, captured.out(), captured.err(),
                worker.getWorkerNum(), pid);
    }

    static ExecutionOutcome execute(TestCase test, WorkerContext worker) {
        try {
            test.run(worker);
            return test.expectedToFail() ? ExecutionOutcome.unexpectedlyPassed() : ExecutionOutcome.passed();
        } catch (SkipTestException e) {
            return ExecutionOutcome.skipped(e.getMessage());
        } catch (AssertionError e) {
            String detail = stackTrace(e);
            return test.expectedToFail() ? ExecutionOutcome.failedAsExpected(detail) : ExecutionOutcome.failed(detail);
        } catch (OutOfMemoryError e) {
            throw e;
        } catch (Throwable e) {
            if (e instanceof InterruptedException) Thread.currentThread().interrupt();
            String detail = stackTrace(e);
            return test.expectedToFail() ? ExecutionOutcome.failedAsExpected(detail) : ExecutionOutcome.errored(detail);
        }
    }

    static List<TestCase> loadViaGroups(WorkerContext worker, String name) {
        Loader loader = worker.getSpec().getLoader();
        String[] comps = name.split("\\.");
        for (int len = comps.length; len > 0; len--) {
            String prefix = String.join(".", Arrays.copyOf(comps, len));
            Optional<TestGroup> group = worker.getLoadedGroups().computeIfAbsent(prefix, loader::loadGroup);
            if (group.isEmpty()) continue;
            for (TestCase test : group.get().tests()) {
                if (test.id().equals(name)) return List.of(test);
            }
        }
        return List.of();
    }

    private static String stackTrace(Throwable e) {
        StringWriter trace = new StringWriter();
        e.printStackTrace(new PrintWriter(trace));
        return trace.toString();
    }
}
