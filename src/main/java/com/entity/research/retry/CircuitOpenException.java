package com.entity.research.retry;

/**
 * Raised without calling the target because its circuit is open.
 */
public class CircuitOpenException extends CollectionException {

    private final String targetKey;

    public CircuitOpenException(String targetKey) {
        super(FailureKind.PERMANENT, "Circuit open for target " + targetKey);
        this.targetKey = targetKey;
    }

    public String getTargetKey() {
        return targetKey;
    }
}
