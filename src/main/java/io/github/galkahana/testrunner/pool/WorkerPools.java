package io.github.galkahana.testrunner.pool;

import io.github.galkahana.testrunner.host.Host;

/**
 * Creates the pool that fits a concurrency level.
 */
public final class WorkerPools {

    private WorkerPools() {
    }

    /**
     * @return an {@link InlineWorkerPool} for one job, otherwise a started {@link ThreadedWorkerPool}
     */
    public static WorkerPool make(Host host, int jobs, WorkerSpec spec, WorkerFunction function) {
        if (jobs < 1) throw new IllegalArgumentException("jobs must be at least 1, got " + jobs);
        if (jobs == 1) return new InlineWorkerPool(host, spec, function);
        ThreadedWorkerPool pool = new ThreadedWorkerPool(host, jobs, spec, function);
        pool.start();
        return pool;
    }
}
