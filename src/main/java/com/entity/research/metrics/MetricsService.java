package com.entity.research.metrics;

import java.time.Duration;

/**
 * Records research engine metrics.
 * The default {@link NoOpMetricsService} does nothing, so the engine runs without
 * a metrics backend; {@link MicrometerMetricsService} publishes to a Micrometer registry.
 */
public interface MetricsService {

    void recordJobFinalized(String status, Duration duration);

    void recordStrategyAttempt(String strategyId, String status, Duration duration);

    void incrementRetry(String failureKind);

    void recordRateLimitWait(String targetKey, Duration waited);

    void recordCacheHit();

    void recordCacheMiss();

    void incrementAmbiguousMatch();
}
