package com.entity.research.core.model;

import java.util.Objects;

/**
 * Records which candidate record supplied the accepted value of one field,
 * and the source rank that won it.
 */
public record ProvenanceEntry(
        String field,
        Object value,
        String recordId,
        SourceType sourceType,
        int sourceRank,
        ConfidenceLevel confidence,
        String sourceUrl
) {
    public ProvenanceEntry {
        Objects.requireNonNull(field, "field is required");
        Objects.requireNonNull(value, "value is required");
        Objects.requireNonNull(recordId, "recordId is required");
        Objects.requireNonNull(sourceType, "sourceType is required");
        Objects.requireNonNull(confidence, "confidence is required");
    }
}
