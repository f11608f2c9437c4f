package com.entity.research.retry;

/**
 * Base class for failures while collecting data from an external source.
 */
public class CollectionException extends RuntimeException {

    private final FailureKind kind;

    public CollectionException(FailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public CollectionException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public FailureKind getKind() {
        return kind;
    }
}
