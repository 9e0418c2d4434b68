package io.github.galkahana.testrunner.pool;

import java.io.IOException;

import io.github.galkahana.testrunner.TestInput;
import io.github.galkahana.testrunner.coverage.CoverageCollector;
import io.github.galkahana.testrunner.coverage.CoverageSupport;
import io.github.galkahana.testrunner.host.Host;
import io.github.galkahana.testrunner.results.Result;
import lombok.extern.slf4j.Slf4j;

/**
 * Drives one worker through its lifetime: setup once, any number of tests, teardown once.
 * <p>
 * Failures never escape: a test that throws out of the {@link WorkerFunction} becomes a failure
 * result, and a worker whose setup failed reports every test it is given as a failure.
 * Used by a single thread only.
 */
@Slf4j
public class WorkerLifecycle {

    public enum State { CREATED, READY, ACTIVE, DRAINING, TERMINATED }

    private final WorkerContext worker;
    private final WorkerFunction function;

    private State state = State.CREATED;
    private Exception setUpFailure;

    public WorkerLifecycle(Host host, int workerNum, WorkerSpec spec, WorkerFunction function) {
        this.worker = new WorkerContext(host, workerNum, spec);
        this.function = function;
    }

    public void setUp() {
        requireState(State.CREATED);
        WorkerSpec spec = worker.getSpec();
        try {
            CoverageSupport coverage = spec.getCoverage();
            if (coverage != null) {
                CoverageCollector collector = coverage.newCollector(spec.getCoverageSources());
                worker.setCoverageCollector(collector);
                collector.start();
            }
            worker.setContextAfterSetup(spec.getHooks().setUp(worker, spec.getContext()));
            log.debug("Worker {} set up", worker.getWorkerNum());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            setUpFailure = e;
        } catch (Exception e) {
            log.error("Worker {} setup failed", worker.getWorkerNum(), e);
            setUpFailure = e;
        }
        state = State.READY;
    }

    public Result run(TestInput input) {
        requireState(State.READY);
        state = State.ACTIVE;
        Host host = worker.getHost();
        try {
            if (setUpFailure != null) {
                return Result.failure(input.name(), host.time(), 0, worker.getWorkerNum(),
                        "worker " + worker.getWorkerNum() + " setup failed: " + setUpFailure, host.getPid());
            }
            return function.apply(worker, input);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Result.failure(input.name(), host.time(), 0, worker.getWorkerNum(),
                    "interrupted while running " + input.name(), host.getPid());
        } catch (OutOfMemoryError e) {
            throw e;
        } catch (Throwable e) {
            log.warn("Worker {} failed running {}", worker.getWorkerNum(), input.name(), e);
            return Result.failure(input.name(), host.time(), 0, worker.getWorkerNum(),
                    "failed to run " + input.name() + ": " + e, host.getPid());
        } finally {
            state = State.READY;
        }
    }

    /**
     * Run the teardown hook and flush coverage.
     *
     * @return the worker's ordinal
     */
    public int tearDown() {
        if (state == State.TERMINATED) return worker.getWorkerNum();
        state = State.DRAINING;
        try {
            if (setUpFailure == null) {
                worker.getSpec().getHooks().tearDown(worker, worker.getContextAfterSetup());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            log.error("Worker {} teardown failed", worker.getWorkerNum(), e);
        } finally {
            CoverageCollector collector = worker.getCoverageCollector();
            if (collector != null) {
                collector.stop();
                try {
                    collector.save();
                } catch (IOException e) {
                    log.error("Worker {} could not save coverage data", worker.getWorkerNum(), e);
                }
                worker.setCoverageCollector(null);
            }
            state = State.TERMINATED;
        }
        log.debug("Worker {} torn down", worker.getWorkerNum());
        return worker.getWorkerNum();
    }

    public State getState() {
        return state;
    }

    public int getWorkerNum() {
        return worker.getWorkerNum();
    }

    private void requireState(State expected) {
        if (state != expected) {
            throw new IllegalStateException("Worker " + worker.getWorkerNum() + " is " + state + ", expected " + expected);
        }
    }
}
