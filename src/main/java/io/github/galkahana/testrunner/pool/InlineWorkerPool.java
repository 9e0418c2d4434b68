package io.github.galkahana.testrunner.pool;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import io.github.galkahana.testrunner.TestInput;
import io.github.galkahana.testrunner.host.Host;
import io.github.galkahana.testrunner.results.Result;

/**
 * Single worker that runs each test on the caller's thread as it is sent.
 * <p>
 * Used when only one job is allowed, so strictly serial execution needs no threads and
 * passthrough output reaches the console directly.
 */
public class InlineWorkerPool implements WorkerPool {

    private final WorkerLifecycle lifecycle;
    private final Deque<Result> results = new ArrayDeque<>();
    private int submitted = 0;
    private int completed = 0;
    private boolean closed = false;

    public InlineWorkerPool(Host host, WorkerSpec spec, WorkerFunction function) {
        this.lifecycle = new WorkerLifecycle(host, 1, spec, function);
        lifecycle.setUp();
    }

    @Override
    public void send(TestInput input) {
        if (closed) throw new IllegalStateException("Pool is closed");
        submitted++;
        results.add(lifecycle.run(input));
    }

    @Override
    public Result get() {
        Result result = results.poll();
        if (result == null) throw new IllegalStateException("No test has been sent whose result is pending");
        completed++;
        return result;
    }

    @Override
    public void close() {
        closed = true;
    }

    @Override
    public List<Integer> join() {
        closed = true;
        results.clear();
        return List.of(lifecycle.tearDown());
    }

    @Override
    public PoolStats getStats() {
        return new PoolStats(submitted, completed, 0, submitted - completed);
    }
}
