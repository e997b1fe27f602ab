package com.entity.reconciliation.metrics;

import java.time.Duration;

/**
 * Records store activity. The {@link NoOpMetricsService} default keeps stores usable
 * without a metrics registry.
 */
public interface MetricsService {

    /**
     * @param backend   store backend, {@code memory} or {@code sqlite}
     * @param operation {@code query}, {@code prefix} or {@code lookup}
     * @param duration  wall time of the call
     */
    void recordOperationDuration(String backend, String operation, Duration duration);

    void recordCandidateCount(String backend, int count);

    /**
     * Counts queries whose best candidate is a confident match.
     */
    void incrementConfidentMatch(String backend);

    /**
     * @param reason simple name of the exception class
     */
    void incrementFailure(String backend, String operation, String reason);

    void recordCacheHit();

    void recordCacheMiss();
}
