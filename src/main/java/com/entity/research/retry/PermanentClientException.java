package com.entity.research.retry;

/**
 * A failure that will not go away on retry, e.g. a malformed request or a 404.
 */
public class PermanentClientException extends CollectionException {

    public PermanentClientException(String message) {
        super(FailureKind.PERMANENT, message);
    }

    public PermanentClientException(String message, Throwable cause) {
        super(FailureKind.PERMANENT, message, cause);
    }
}
