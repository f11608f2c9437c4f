package com.entity.research.metrics;

import java.time.Duration;

/**
 * Metrics sink that discards everything.
 */
public class NoOpMetricsService implements MetricsService {

    public static final NoOpMetricsService INSTANCE = new NoOpMetricsService();

    @Override
    public void recordJobFinalized(String status, Duration duration) {
    }

    @Override
    public void recordStrategyAttempt(String strategyId, String status, Duration duration) {
    }

    @Override
    public void incrementRetry(String failureKind) {
    }

    @Override
    public void recordRateLimitWait(String targetKey, Duration waited) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }

    @Override
    public void incrementAmbiguousMatch() {
    }
}
