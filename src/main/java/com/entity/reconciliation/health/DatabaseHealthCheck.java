package com.entity.reconciliation.health;

import com.entity.reconciliation.sql.SqlConnection;
import com.entity.reconciliation.sql.SqlQueryExecutor;

/**
 * Runs a trivial query against the database and reports its latency.
 */
public class DatabaseHealthCheck implements HealthCheck {

    private final SqlConnection connection;
    private final SqlQueryExecutor executor;

    public DatabaseHealthCheck(SqlConnection connection) {
        this.connection = connection;
        this.executor = new SqlQueryExecutor(connection);
    }

    @Override
    public String getName() {
        return "database";
    }

    @Override
    public HealthStatus check() {
        try {
            long startMs = System.currentTimeMillis();
            boolean ok = executor.ping();
            long latencyMs = System.currentTimeMillis() - startMs;

            HealthStatus base = ok ? HealthStatus.up() : HealthStatus.down("Ping returned no row");
            return base
                    .withDetail("latencyMs", latencyMs)
                    .withDetail("database", connection.getDatabaseName());
        } catch (RuntimeException e) {
            return HealthStatus.down("Database connection failed: " + e.getMessage())
                    .withDetail("error", e.getClass().getSimpleName());
        }
    }
}
