package com.entity.reconciliation.cache;

/**
 * Configuration of the entity lookup cache.
 *
 * @param maxSize    maximum number of cached entities
 * @param ttlSeconds time-to-live of an entry after it is written
 * @param enabled    whether lookups are cached at all
 */
public record CacheConfig(int maxSize, int ttlSeconds, boolean enabled) {

    public CacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be > 0");
        }
    }

    /**
     * 5,000 entries for 10 minutes.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(5_000, 600, true);
    }

    public static CacheConfig disabled() {
        return new CacheConfig(1, 1, false);
    }
}
