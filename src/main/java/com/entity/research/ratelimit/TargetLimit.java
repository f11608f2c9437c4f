package com.entity.research.ratelimit;

import java.time.Duration;

/**
 * Throttling limits for one target key.
 *
 * @param maxConcurrent     permits that may be outstanding at once
 * @param requestsPerSecond maximum grant rate; consecutive grants are spaced by its inverse
 */
public record TargetLimit(int maxConcurrent, double requestsPerSecond) {

    public TargetLimit {
        if (maxConcurrent < 1) {
            throw new IllegalArgumentException("maxConcurrent must be at least 1");
        }
        if (!(requestsPerSecond > 0.0) || Double.isInfinite(requestsPerSecond)) {
            throw new IllegalArgumentException("requestsPerSecond must be positive and finite");
        }
    }

    public Duration minInterval() {
        return Duration.ofNanos(Math.round(1_000_000_000L / requestsPerSecond));
    }
}
