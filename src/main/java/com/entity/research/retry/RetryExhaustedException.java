package com.entity.research.retry;

import java.util.List;

/**
 * All attempts of a retried operation failed. Carries the per-attempt history.
 */
public class RetryExhaustedException extends CollectionException {

    private final String targetKey;
    private final List<AttemptFailure> attempts;

    public RetryExhaustedException(String targetKey, List<AttemptFailure> attempts, Throwable lastCause) {
        super(attempts.isEmpty() ? FailureKind.TRANSIENT : attempts.get(attempts.size() - 1).kind(),
                "Gave up on " + targetKey + " after " + attempts.size() + " attempt(s)", lastCause);
        this.targetKey = targetKey;
        this.attempts = List.copyOf(attempts);
    }

    public String getTargetKey() {
        return targetKey;
    }

    public List<AttemptFailure> getAttempts() {
        return attempts;
    }
}
