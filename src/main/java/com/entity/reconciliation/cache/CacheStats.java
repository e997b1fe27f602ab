package com.entity.reconciliation.cache;

/**
 * Cache counters.
 *
 * @param hitCount      lookups answered from the cache
 * @param missCount     lookups that went to the database
 * @param evictionCount entries dropped for size or age
 * @param size          current number of entries
 */
public record CacheStats(long hitCount, long missCount, long evictionCount, long size) {

    /**
     * Returns the hit rate (0.0 to 1.0).
     */
    public double hitRate() {
        long total = hitCount + missCount;
        return total == 0 ? 0.0 : (double) hitCount / total;
    }

    public static CacheStats empty() {
        return new CacheStats(0, 0, 0, 0);
    }
}
