package com.entity.reconciliation.cache;

import com.entity.reconciliation.core.model.Entity;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * Caffeine-backed {@link EntityCache}.
 */
public class CaffeineEntityCache implements EntityCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineEntityCache.class);

    private final Cache<String, Entity> cache;

    public CaffeineEntityCache(CacheConfig config) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .recordStats()
                .build();
        log.info("CaffeineEntityCache initialized: maxSize={}, ttl={}s", config.maxSize(), config.ttlSeconds());
    }

    @Override
    public Optional<Entity> get(String id) {
        return Optional.ofNullable(cache.getIfPresent(id));
    }

    @Override
    public void put(String id, Entity entity) {
        cache.put(id, entity);
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        log.debug("Invalidated all cache entries");
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.stats();
        return new CacheStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                caffeineStats.evictionCount(),
                cache.estimatedSize()
        );
    }
}
