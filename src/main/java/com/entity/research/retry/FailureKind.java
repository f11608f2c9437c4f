package com.entity.research.retry;

/**
 * Retry classification of a failed operation.
 */
public enum FailureKind {
    /**
     * The target asked us to slow down. Retried, honoring a retry-after hint when given.
     */
    RATE_LIMITED,

    /**
     * Network hiccup or server-side error. Retried with exponential backoff.
     */
    TRANSIENT,

    /**
     * The request itself is wrong or the target refuses it. Never retried.
     */
    PERMANENT;

    public boolean isRetryable() {
        return this != PERMANENT;
    }
}
