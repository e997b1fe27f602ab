package com.entity.reconciliation.cache;

import com.entity.reconciliation.core.model.Entity;

import java.util.Optional;

/**
 * Cache of fully loaded entities (properties attached), keyed by the composite id
 * they were requested with. Stores never change after construction, so entries are
 * only dropped for size or age.
 */
public interface EntityCache {

    /**
     * @param id composite entity id
     * @return the cached entity, or empty if not cached
     */
    Optional<Entity> get(String id);

    void put(String id, Entity entity);

    void invalidateAll();

    CacheStats getStats();

    /**
     * Builds the cache matching a configuration.
     */
    static EntityCache create(CacheConfig config) {
        return config.enabled() ? new CaffeineEntityCache(config) : new NoOpEntityCache();
    }
}
