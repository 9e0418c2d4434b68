package io.github.galkahana.testrunner.pool;

/**
 * Type definition for worker pool statistics.
 *
 * @param submitted Tests sent to the pool
 * @param completed Results handed back to the caller
 * @param pendingWork Tests waiting for a free worker
 * @param inFlight Tests being run or whose results are waiting to be collected
 */
public record PoolStats(int submitted, int completed, int pendingWork, int inFlight) {
}
