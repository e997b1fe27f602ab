package com.entity.reconciliation.sql;

/**
 * Point-in-time counters of a {@link SqlConnectionPool}.
 *
 * @param totalConnections  active plus idle
 * @param activeConnections currently borrowed
 * @param idleConnections   ready to be borrowed
 * @param totalBorrowed     borrows since the pool was created
 * @param totalReleased     releases since the pool was created
 * @param totalCreated      JDBC connections opened since the pool was created
 */
public record PoolStats(
        int totalConnections,
        int activeConnections,
        int idleConnections,
        long totalBorrowed,
        long totalReleased,
        long totalCreated
) {

    /**
     * Fraction of the pool capacity currently borrowed.
     */
    public double utilization(int maxTotal) {
        return maxTotal == 0 ? 0.0 : (double) activeConnections / maxTotal;
    }
}
