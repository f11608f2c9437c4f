package com.entity.research.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * One failed attempt inside a retried operation.
 *
 * @param attempt    1-based attempt number
 * @param kind       classification of the failure
 * @param errorType  simple class name of the exception
 * @param message    exception message
 * @param nextDelay  backoff scheduled after this attempt, zero if none
 */
public record AttemptFailure(int attempt, FailureKind kind, String errorType, String message, Duration nextDelay) {

    public AttemptFailure {
        Objects.requireNonNull(kind, "kind is required");
        nextDelay = nextDelay != null ? nextDelay : Duration.ZERO;
    }
}
