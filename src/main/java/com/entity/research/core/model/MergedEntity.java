package com.entity.research.core.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The reconciled record for one identity group.
 * Every attribute value has a matching {@link ProvenanceEntry} under the same field name.
 */
public record MergedEntity(
        String normalizedKey,
        EntityType entityType,
        Map<String, Object> attributes,
        Map<String, ProvenanceEntry> provenance,
        int completenessScore,
        double confidenceScore,
        int sourceCount,
        List<CandidateRecord> contributingRecords
) {
    public MergedEntity {
        Objects.requireNonNull(normalizedKey, "normalizedKey is required");
        attributes = attributes != null ? Map.copyOf(attributes) : Map.of();
        provenance = provenance != null ? Map.copyOf(provenance) : Map.of();
        contributingRecords = contributingRecords != null ? List.copyOf(contributingRecords) : List.of();
        if (completenessScore < 0 || completenessScore > 100) {
            throw new IllegalArgumentException("Completeness must be between 0 and 100");
        }
        if (confidenceScore < 0.0 || confidenceScore > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0");
        }
        for (String field : attributes.keySet()) {
            if (!provenance.containsKey(field)) {
                throw new IllegalArgumentException("Missing provenance for field: " + field);
            }
        }
    }

    public Optional<Object> attribute(String field) {
        return Optional.ofNullable(attributes.get(field));
    }

    public Optional<String> name() {
        return attribute(EntityFields.NAME).map(Object::toString);
    }

    public boolean hasRecord(String recordId) {
        return contributingRecords.stream().anyMatch(r -> r.id().equals(recordId));
    }

    public int recordCount() {
        return contributingRecords.size();
    }

    /**
     * Identifier attributes (CIK, LEI, ...) carried by this entity.
     */
    public Map<String, String> identifiers() {
        return IdentifierSupport.extract(attributes);
    }
}
