package com.entity.research.retry;

import java.time.Duration;
import java.util.Optional;

/**
 * The target rejected the request because of its own rate limit (HTTP 429 and the like).
 */
public class RateLimitedException extends CollectionException {

    private final Duration retryAfter;

    public RateLimitedException(String message) {
        this(message, null);
    }

    public RateLimitedException(String message, Duration retryAfter) {
        super(FailureKind.RATE_LIMITED, message);
        this.retryAfter = retryAfter;
    }

    public Optional<Duration> getRetryAfter() {
        return Optional.ofNullable(retryAfter);
    }
}
