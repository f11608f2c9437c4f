package com.entity.research.metrics;

import io.micrometer.core.instrument.Counter;
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
 *   <li>{@code research.job.finalized} Counter (tag: status)</li>
 *   <li>{@code research.job.duration} Timer (tag: status)</li>
 *   <li>{@code research.strategy.attempt} Timer (tags: strategy, status)</li>
 *   <li>{@code research.retry} Counter (tag: failureKind)</li>
 *   <li>{@code research.ratelimit.wait} Timer (tag: target)</li>
 *   <li>{@code research.cache.hit} / {@code research.cache.miss} Counters</li>
 *   <li>{@code research.match.ambiguous} Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;
    private final Counter ambiguousCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.cacheHitCounter = Counter.builder("research.cache.hit")
                .description("Response cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("research.cache.miss")
                .description("Response cache misses")
                .register(registry);
        this.ambiguousCounter = Counter.builder("research.match.ambiguous")
                .description("Candidate records matched through a tie-break or identifier conflict")
                .register(registry);
    }

    @Override
    public void recordJobFinalized(String status, Duration duration) {
        counterCache.computeIfAbsent("job:" + status, k ->
                Counter.builder("research.job.finalized")
                        .description("Jobs reaching a terminal status")
                        .tag("status", status)
                        .register(registry)).increment();
        timerCache.computeIfAbsent("job:" + status, k ->
                Timer.builder("research.job.duration")
                        .description("Wall time of research jobs")
                        .tag("status", status)
                        .register(registry)).record(duration);
    }

    @Override
    public void recordStrategyAttempt(String strategyId, String status, Duration duration) {
        timerCache.computeIfAbsent("attempt:" + strategyId + ":" + status, k ->
                Timer.builder("research.strategy.attempt")
                        .description("Duration of strategy attempts")
                        .tag("strategy", strategyId)
                        .tag("status", status)
                        .register(registry)).record(duration);
    }

    @Override
    public void incrementRetry(String failureKind) {
        counterCache.computeIfAbsent("retry:" + failureKind, k ->
                Counter.builder("research.retry")
                        .description("Retried operations by failure classification")
                        .tag("failureKind", failureKind)
                        .register(registry)).increment();
    }

    @Override
    public void recordRateLimitWait(String targetKey, Duration waited) {
        timerCache.computeIfAbsent("wait:" + targetKey, k ->
                Timer.builder("research.ratelimit.wait")
                        .description("Time spent waiting for a rate limiter permit")
                        .tag("target", targetKey)
                        .register(registry)).record(waited);
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }

    @Override
    public void incrementAmbiguousMatch() {
        ambiguousCounter.increment();
    }
}
