package com.entity.reconciliation.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code reconciliation.operation.duration}: Timer (tags: backend, operation)</li>
 *   <li>{@code reconciliation.candidates}: DistributionSummary (tag: backend)</li>
 *   <li>{@code reconciliation.match.confident}: Counter (tag: backend)</li>
 *   <li>{@code reconciliation.failures}: Counter (tags: backend, operation, reason)</li>
 *   <li>{@code reconciliation.cache.hit} and {@code reconciliation.cache.miss}: Counters</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Map<String, DistributionSummary> summaryCache = new ConcurrentHashMap<>();
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.cacheHitCounter = Counter.builder("reconciliation.cache.hit")
                .description("Entity lookups answered from the cache")
                .register(registry);
        this.cacheMissCounter = Counter.builder("reconciliation.cache.miss")
                .description("Entity lookups that went to the database")
                .register(registry);
    }

    @Override
    public void recordOperationDuration(String backend, String operation, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(backend + ":" + operation, k ->
                Timer.builder("reconciliation.operation.duration")
                        .description("Duration of store operations")
                        .tag("backend", backend)
                        .tag("operation", operation)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordCandidateCount(String backend, int count) {
        summaryCache.computeIfAbsent(backend, k ->
                DistributionSummary.builder("reconciliation.candidates")
                        .description("Candidates returned per query")
                        .tag("backend", backend)
                        .register(registry))
                .record(count);
    }

    @Override
    public void incrementConfidentMatch(String backend) {
        counterCache.computeIfAbsent("match:" + backend, k ->
                Counter.builder("reconciliation.match.confident")
                        .description("Queries whose best candidate is a confident match")
                        .tag("backend", backend)
                        .register(registry))
                .increment();
    }

    @Override
    public void incrementFailure(String backend, String operation, String reason) {
        counterCache.computeIfAbsent("failure:" + backend + ":" + operation + ":" + reason, k ->
                Counter.builder("reconciliation.failures")
                        .description("Store operations that failed")
                        .tag("backend", backend)
                        .tag("operation", operation)
                        .tag("reason", reason)
                        .register(registry))
                .increment();
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }
}
