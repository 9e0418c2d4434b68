package io.github.galkahana.testrunner.pool;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import io.github.galkahana.testrunner.TestInput;
import io.github.galkahana.testrunner.host.Host;
import io.github.galkahana.testrunner.results.Result;
import lombok.extern.slf4j.Slf4j;

/**
 * Worker pool backed by a fixed thread pool, one long-running worker loop per thread.
 * <p>
 * Each loop owns a {@link WorkerLifecycle}: it sets up once, takes tests from a shared task
 * queue until told to stop, and tears down once. Results travel back on a reply queue; nothing
 * else is shared with the caller. A worker loop that dies is noticed through its future, and
 * its cause is rethrown from {@link #get()}.
 */
@Slf4j
public class ThreadedWorkerPool implements WorkerPool {

    private static final long POLL_MILLIS = 50;

    private final Host host;
    private final int numWorkers;
    private final WorkerSpec spec;
    private final WorkerFunction function;

    private final BlockingQueue<TestInput> tasks = new LinkedBlockingQueue<>();
    private final BlockingQueue<Result> replies = new LinkedBlockingQueue<>();
    private final Map<Future<Integer>, Integer> workerFutures = new IdentityHashMap<>();
    private final List<Integer> finishedWorkers = new ArrayList<>();

    private ThreadPoolExecutor executor;
    private ExecutorCompletionService<Integer> workerCompletion;

    private final AtomicInteger tasksSubmitted = new AtomicInteger(0);
    private volatile int tasksCompleted = 0;
    private volatile boolean running = false;
    private volatile boolean closed = false;

    // Sentinel telling one worker loop to tear down.
    private static final TestInput CLOSE = TestInput.of("");

    /**
     * @param host Host handed to every worker
     * @param numWorkers Number of worker threads
     * @param spec Settings every worker starts from
     * @param function Runs one test on a worker
     */
    public ThreadedWorkerPool(Host host, int numWorkers, WorkerSpec spec, WorkerFunction function) {
        if (numWorkers < 1) throw new IllegalArgumentException("numWorkers must be at least 1, got " + numWorkers);
        this.host = host;
        this.numWorkers = numWorkers;
        this.spec = spec;
        this.function = function;
    }

    /**
     * Start the executor and one worker loop per thread. Call this before sending any tests.
     */
    public synchronized void start() {
        if (running) throw new IllegalStateException("Already running");
        running = true;

        AtomicInteger threadNum = new AtomicInteger(0);
        executor = new ThreadPoolExecutor(numWorkers, numWorkers, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(), runnable -> {
                    Thread thread = new Thread(runnable, "TestWorker-" + threadNum.incrementAndGet());
                    thread.setDaemon(true);
                    return thread;
                });
        workerCompletion = new ExecutorCompletionService<>(executor);
        for (int i = 1; i <= numWorkers; i++) {
            int workerNum = i;
            workerFutures.put(workerCompletion.submit(() -> workerLoop(workerNum)), workerNum);
        }
        log.info("Started worker pool with {} workers", numWorkers);
    }

    @Override
    public void send(TestInput input) {
        if (!running || closed) throw new IllegalStateException("Pool is not accepting tests. Call start() first, and do not send after close().");
        tasks.add(input);
        tasksSubmitted.incrementAndGet();
    }

    /**
     * {@inheritDoc}
     *
     * @throws IllegalStateException If a worker loop died, with its cause, or if every worker has stopped
     */
    @Override
    @SuppressWarnings("NonAtomicOperationOnVolatileField") // Only the caller's thread mutates tasksCompleted
    public Result get() throws InterruptedException {
        while (true) {
            Result result = replies.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
            if (result != null) {
                tasksCompleted++;
                return result;
            }
            Future<Integer> done = workerCompletion.poll();
            if (done != null) collectWorker(done, true);
            if (finishedWorkers.size() == numWorkers && replies.isEmpty()) {
                throw new IllegalStateException("All workers have stopped; no result will arrive");
            }
        }
    }

    @Override
    public synchronized void close() {
        if (closed) return;
        closed = true;
        for (int i = 0; i < numWorkers; i++) {
            tasks.add(CLOSE);
        }
    }

    @Override
    public synchronized List<Integer> join() throws InterruptedException {
        if (!closed) {
            closed = true;
            int discarded = tasks.size();
            tasks.clear();
            if (discarded > 0) log.info("Discarded {} pending tests", discarded);
            executor.shutdownNow();
        } else {
            executor.shutdown();
        }
        if (!executor.awaitTermination(Long.MAX_VALUE, TimeUnit.MILLISECONDS)) {
            log.warn("Workers did not terminate in time");
        }
        Future<Integer> done;
        while ((done = workerCompletion.poll()) != null) {
            collectWorker(done, false);
        }
        int dropped = replies.size();
        replies.clear();
        if (dropped > 0) log.debug("Dropping {} uncollected results", dropped);
        running = false;

        log.info("All workers stopped. Stats: submitted={}, completed={}", tasksSubmitted.get(), tasksCompleted);
        List<Integer> stopped = new ArrayList<>(finishedWorkers);
        Collections.sort(stopped);
        return stopped;
    }

    @Override
    public PoolStats getStats() {
        int submitted = tasksSubmitted.get();
        int pendingWork = (int) tasks.stream().filter(task -> task != CLOSE).count();
        return new PoolStats(submitted, tasksCompleted, pendingWork,
                Math.max(0, submitted - tasksCompleted - pendingWork));
    }

    private void collectWorker(Future<Integer> done, boolean rethrow) throws InterruptedException {
        int workerNum = workerFutures.get(done);
        try {
            finishedWorkers.add(done.get());
        } catch (ExecutionException e) {
            log.error("Worker {} died", workerNum, e.getCause());
            finishedWorkers.add(workerNum);
            if (rethrow) throw new IllegalStateException("Worker " + workerNum + " died", e.getCause());
        }
    }

    private int workerLoop(int workerNum) {
        WorkerLifecycle lifecycle = new WorkerLifecycle(host, workerNum, spec, function);
        lifecycle.setUp();
        try {
            while (true) {
                TestInput input = tasks.take();
                if (input == CLOSE) break;
                log.debug("Worker {} running {}", workerNum, input.name());
                replies.add(lifecycle.run(input));
            }
        } catch (InterruptedException e) {
            log.debug("Worker {} interrupted", workerNum);
        } finally {
            lifecycle.tearDown();
        }
        return workerNum;
    }
}
