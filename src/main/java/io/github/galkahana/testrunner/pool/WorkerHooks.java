package io.github.galkahana.testrunner.pool;

/**
 * Caller-supplied setup and teardown run once per worker, not once per test.
 * <p>
 * {@link #setUp} derives the worker's private context from the shared run context; the same
 * derived value is handed to every test the worker runs and finally to {@link #tearDown}.
 */
public interface WorkerHooks {

    WorkerHooks NONE = new WorkerHooks() {
    };

    default Object setUp(WorkerContext worker, Object context) throws Exception {
        return context;
    }

    default void tearDown(WorkerContext worker, Object contextAfterSetup) throws Exception {
    }
}
