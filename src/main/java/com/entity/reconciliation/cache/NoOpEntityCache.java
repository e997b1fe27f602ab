package com.entity.reconciliation.cache;

import com.entity.reconciliation.core.model.Entity;

import java.util.Optional;

/**
 * Cache that never holds anything. Used when caching is disabled.
 */
public class NoOpEntityCache implements EntityCache {

    @Override
    public Optional<Entity> get(String id) {
        return Optional.empty();
    }

    @Override
    public void put(String id, Entity entity) {
        // no-op
    }

    @Override
    public void invalidateAll() {
        // no-op
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
