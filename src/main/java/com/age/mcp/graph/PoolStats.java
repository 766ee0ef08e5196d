package com.age.mcp.graph;

/**
 * Point-in-time statistics for a {@link GraphEngine} pool.
 *
 * @param totalConnections  open connections (active + idle)
 * @param activeConnections connections currently handed out
 * @param idleConnections   connections waiting in the pool
 * @param pendingThreads    threads blocked waiting for a connection
 * @param maxConnections    configured upper bound on open connections
 */
public record PoolStats(
        int totalConnections,
        int activeConnections,
        int idleConnections,
        int pendingThreads,
        int maxConnections
) {

    /**
     * Stats of a pool that has not opened a connection yet.
     */
    public static PoolStats empty(int maxConnections) {
        return new PoolStats(0, 0, 0, 0, maxConnections);
    }

    /**
     * Fraction of {@code maxConnections} in use, between 0 and 1.
     */
    public double utilization() {
        return maxConnections <= 0 ? 0.0 : (double) activeConnections / maxConnections;
    }
}
