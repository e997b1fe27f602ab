package com.entity.reconciliation.health;

import com.entity.reconciliation.sql.PooledSqlConnection;
import com.entity.reconciliation.sql.RelationalEntityStore;
import com.entity.reconciliation.store.EntityStore;
import com.entity.reconciliation.store.InstrumentedEntityStore;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs a set of health checks and reports the worst status among them,
 * with each check's own result as a detail.
 */
public class HealthCheckRegistry {

    private final List<HealthCheck> checks = new ArrayList<>();

    /**
     * Builds the checks that apply to a store: the store itself and, for the relational
     * backend, its database and connection pool.
     */
    public static HealthCheckRegistry forStore(EntityStore store) {
        HealthCheckRegistry registry = new HealthCheckRegistry();
        registry.register(new StoreHealthCheck(store));

        EntityStore backend = store instanceof InstrumentedEntityStore instrumented
                ? instrumented.getDelegate() : store;
        if (backend instanceof RelationalEntityStore relational) {
            registry.register(new DatabaseHealthCheck(relational.getConnection()));
            if (relational.getConnection() instanceof PooledSqlConnection pooled) {
                registry.register(new ConnectionPoolHealthCheck(pooled.getPool()));
            }
        }
        return registry;
    }

    public void register(HealthCheck check) {
        if (check != null) {
            checks.add(check);
        }
    }

    public HealthStatus checkAll() {
        if (checks.isEmpty()) {
            return HealthStatus.up("No health checks registered");
        }

        Map<String, Object> results = new LinkedHashMap<>();
        HealthStatus.Status worst = HealthStatus.Status.UP;
        String worstMessage = "OK";

        for (HealthCheck check : checks) {
            HealthStatus result = check.check();
            results.put(check.getName(), Map.of(
                    "status", result.status().name(),
                    "message", result.message(),
                    "details", result.details()
            ));
            if (result.status().ordinal() > worst.ordinal()) {
                worst = result.status();
                worstMessage = check.getName() + ": " + result.message();
            }
        }

        return new HealthStatus(worst, worstMessage, results);
    }

    public int size() {
        return checks.size();
    }
}
