package io.github.galkahana.testrunner.pool;

import io.github.galkahana.testrunner.TestInput;
import io.github.galkahana.testrunner.results.Result;

/**
 * Runs one test on a worker and reports its result.
 */
@FunctionalInterface
public interface WorkerFunction {
    Result apply(WorkerContext worker, TestInput input) throws Exception;
}
