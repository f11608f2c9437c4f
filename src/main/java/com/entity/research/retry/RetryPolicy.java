package com.entity.research.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Backoff settings. Delay before retry {@code n} (1-based) is
 * {@code min(baseDelay * multiplier^(n-1), maxDelay)}, scaled by a random factor in
 * {@code [1 - jitter, 1 + jitter]}.
 *
 * @param requestTimeout per-attempt timeout, or null for none
 */
public record RetryPolicy(
        int maxAttempts,
        Duration baseDelay,
        double multiplier,
        Duration maxDelay,
        double jitter,
        Duration requestTimeout
) {
    public static final double DEFAULT_JITTER = 0.25;

    public RetryPolicy {
        Objects.requireNonNull(baseDelay, "baseDelay is required");
        Objects.requireNonNull(maxDelay, "maxDelay is required");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (baseDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("Delays must not be negative");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be at least 1.0");
        }
        if (jitter < 0.0 || jitter >= 1.0) {
            throw new IllegalArgumentException("jitter must be in [0.0, 1.0)");
        }
        if (requestTimeout != null && (requestTimeout.isNegative() || requestTimeout.isZero())) {
            requestTimeout = null;
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(3, Duration.ofSeconds(1), 2.0, Duration.ofSeconds(60), DEFAULT_JITTER,
                Duration.ofSeconds(30));
    }

    public RetryPolicy withAttempts(int attempts, Duration base) {
        return new RetryPolicy(attempts, base, multiplier, maxDelay, jitter, requestTimeout);
    }

    /**
     * Delay before retrying after the given failed attempt, before jitter.
     */
    public Duration backoff(int failedAttempt) {
        double nanos = baseDelay.toNanos() * Math.pow(multiplier, failedAttempt - 1);
        return Duration.ofNanos((long) Math.min(nanos, maxDelay.toNanos()));
    }
}
