package com.entity.reconciliation.health;

import com.entity.reconciliation.store.EntityStore;

/**
 * Reports the store as UP when its catalog can be read, DEGRADED when it declares no types.
 */
public class StoreHealthCheck implements HealthCheck {

    private final EntityStore store;

    public StoreHealthCheck(EntityStore store) {
        this.store = store;
    }

    @Override
    public String getName() {
        return "store";
    }

    @Override
    public HealthStatus check() {
        try {
            int typeCount = store.types().size();
            HealthStatus base = typeCount == 0
                    ? HealthStatus.degraded("Store declares no types")
                    : HealthStatus.up();
            return base
                    .withDetail("name", store.name())
                    .withDetail("types", typeCount);
        } catch (RuntimeException e) {
            return HealthStatus.down("Store check failed: " + e.getMessage())
                    .withDetail("error", e.getClass().getSimpleName());
        }
    }
}
