package com.entity.reconciliation.metrics;

import java.time.Duration;

/**
 * {@link MetricsService} that records nothing.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordOperationDuration(String backend, String operation, Duration duration) {
    }

    @Override
    public void recordCandidateCount(String backend, int count) {
    }

    @Override
    public void incrementConfidentMatch(String backend) {
    }

    @Override
    public void incrementFailure(String backend, String operation, String reason) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }
}
