package com.entity.research.retry;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.TimeoutException;

/**
 * Maps arbitrary exceptions onto {@link FailureKind}.
 * Collection exceptions keep their own kind; I/O problems and timeouts are transient;
 * anything else is treated as permanent.
 */
public final class FailureClassifier {

    private FailureClassifier() {
    }

    public static FailureKind classify(Throwable error) {
        if (error instanceof CollectionException ce) {
            return ce.getKind();
        }
        if (error instanceof IOException
                || error instanceof UncheckedIOException
                || error instanceof TimeoutException) {
            return FailureKind.TRANSIENT;
        }
        return FailureKind.PERMANENT;
    }

    /**
     * Classification for an HTTP status code: 429 is rate limited, 408 and 5xx are
     * transient, other 4xx are permanent.
     */
    public static FailureKind classifyStatus(int status) {
        if (status == 429) {
            return FailureKind.RATE_LIMITED;
        }
        if (status == 408 || status >= 500) {
            return FailureKind.TRANSIENT;
        }
        return FailureKind.PERMANENT;
    }
}
