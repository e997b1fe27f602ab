package com.entity.reconciliation.loader;

import com.entity.reconciliation.cache.CacheConfig;
import com.entity.reconciliation.metrics.MetricsService;
import com.entity.reconciliation.metrics.NoOpMetricsService;
import com.entity.reconciliation.tracing.NoOpTracingService;
import com.entity.reconciliation.tracing.TracingService;

/**
 * Settings used by {@link EntityStores} when opening a store.
 */
public class StoreOptions {

    private final int maxConnections;
    private final long maxWaitMillis;
    private final CacheConfig cacheConfig;
    private final MetricsService metricsService;
    private final TracingService tracingService;

    private StoreOptions(Builder builder) {
        this.maxConnections = builder.maxConnections;
        this.maxWaitMillis = builder.maxWaitMillis;
        this.cacheConfig = builder.cacheConfig;
        this.metricsService = builder.metricsService;
        this.tracingService = builder.tracingService;
    }

    public int getMaxConnections() { return maxConnections; }
    public long getMaxWaitMillis() { return maxWaitMillis; }
    public CacheConfig getCacheConfig() { return cacheConfig; }
    public MetricsService getMetricsService() { return metricsService; }
    public TracingService getTracingService() { return tracingService; }

    public static StoreOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int maxConnections = 8;
        private long maxWaitMillis = 5000;
        private CacheConfig cacheConfig = CacheConfig.defaults();
        private MetricsService metricsService = new NoOpMetricsService();
        private TracingService tracingService = new NoOpTracingService();

        public Builder maxConnections(int maxConnections) {
            if (maxConnections <= 0) throw new IllegalArgumentException("maxConnections must be > 0");
            this.maxConnections = maxConnections;
            return this;
        }

        public Builder maxWaitMillis(long maxWaitMillis) {
            if (maxWaitMillis <= 0) throw new IllegalArgumentException("maxWaitMillis must be > 0");
            this.maxWaitMillis = maxWaitMillis;
            return this;
        }

        public Builder cacheConfig(CacheConfig cacheConfig) {
            this.cacheConfig = cacheConfig;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        public StoreOptions build() {
            if (cacheConfig == null || metricsService == null || tracingService == null) {
                throw new IllegalArgumentException("cacheConfig, metricsService and tracingService are required");
            }
            return new StoreOptions(this);
        }
    }
}
