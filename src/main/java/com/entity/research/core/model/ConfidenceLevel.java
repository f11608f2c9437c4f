package com.entity.research.core.model;

/**
 * Confidence a strategy assigns to one of its own records.
 */
public enum ConfidenceLevel {
    LOW,
    MEDIUM,
    HIGH;

    public boolean isHigherThan(ConfidenceLevel other) {
        return other == null || this.ordinal() > other.ordinal();
    }
}
