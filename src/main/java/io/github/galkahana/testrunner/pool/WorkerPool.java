package io.github.galkahana.testrunner.pool;

import java.util.List;

import io.github.galkahana.testrunner.TestInput;
import io.github.galkahana.testrunner.results.Result;

/**
 * A set of workers that run tests sent to them and hand back results.
 * <p>
 * The caller and the workers only exchange values: tests go in through {@link #send}, results
 * come out through {@link #get} in completion order. Typical use:
 * <pre>{@code
 * WorkerPool pool = WorkerPools.make(host, jobs, spec, new TestExecutor());
 * try {
 *     pool.send(input);
 *     Result result = pool.get();
 *     pool.close();
 * } finally {
 *     pool.join();
 * }
 * }</pre>
 */
public interface WorkerPool {

    void send(TestInput input) throws InterruptedException;

    /** Block until the next result is available. */
    Result get() throws InterruptedException;

    /** No more tests will be sent; workers tear down once the queue is empty. */
    void close();

    /**
     * Wait for every worker to tear down. If the pool was not closed first, pending tests are
     * dropped and workers are interrupted.
     *
     * @return ordinals of the workers that tore down, sorted
     */
    List<Integer> join() throws InterruptedException;

    PoolStats getStats();
}
