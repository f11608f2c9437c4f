package com.entity.research.retry;

public class TransientNetworkException extends CollectionException {

    public TransientNetworkException(String message) {
        super(FailureKind.TRANSIENT, message);
    }

    public TransientNetworkException(String message, Throwable cause) {
        super(FailureKind.TRANSIENT, message, cause);
    }
}
