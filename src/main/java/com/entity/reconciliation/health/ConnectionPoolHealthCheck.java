package com.entity.reconciliation.health;

import com.entity.reconciliation.sql.PoolStats;
import com.entity.reconciliation.sql.SqlConnectionPool;

/**
 * Reports pool utilization against its capacity: DEGRADED from 80%, DOWN when every
 * connection is borrowed.
 */
public class ConnectionPoolHealthCheck implements HealthCheck {

    private static final double DOWN_THRESHOLD = 1.0;
    private static final double DEGRADED_THRESHOLD = 0.80;

    private final SqlConnectionPool pool;

    public ConnectionPoolHealthCheck(SqlConnectionPool pool) {
        this.pool = pool;
    }

    @Override
    public String getName() {
        return "connectionPool";
    }

    @Override
    public HealthStatus check() {
        try {
            PoolStats stats = pool.getStats();
            int maxTotal = pool.getConfig().getMaxTotal();
            double utilization = stats.utilization(maxTotal);

            HealthStatus base;
            if (utilization >= DOWN_THRESHOLD) {
                base = HealthStatus.down("Connection pool exhausted: all connections active");
            } else if (utilization >= DEGRADED_THRESHOLD) {
                base = HealthStatus.degraded("Connection pool usage high: "
                        + String.format("%.0f%%", utilization * 100));
            } else {
                base = HealthStatus.up();
            }

            return base
                    .withDetail("maxConnections", maxTotal)
                    .withDetail("activeConnections", stats.activeConnections())
                    .withDetail("idleConnections", stats.idleConnections())
                    .withDetail("totalBorrowed", stats.totalBorrowed())
                    .withDetail("totalCreated", stats.totalCreated());
        } catch (RuntimeException e) {
            return HealthStatus.down("Connection pool check failed: " + e.getMessage());
        }
    }
}
