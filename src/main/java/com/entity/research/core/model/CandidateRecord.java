package com.entity.research.core.model;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * One fact bundle reported by one strategy. Immutable once recorded.
 * The id is derived from the record's content (everything except the
 * collection timestamp and the normalized key), so re-collecting the
 * same fact yields the same id.
 */
public record CandidateRecord(
        String id,
        String normalizedKey,
        String rawName,
        EntityType entityType,
        Map<String, Object> attributes,
        SourceType sourceType,
        String sourceUrl,
        ConfidenceLevel confidence,
        Instant collectedAt,
        String strategyId
) {
    public CandidateRecord {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(rawName, "rawName is required");
        Objects.requireNonNull(sourceType, "sourceType is required");
        Objects.requireNonNull(confidence, "confidence is required");
        Objects.requireNonNull(collectedAt, "collectedAt is required");
        attributes = attributes != null ? Map.copyOf(attributes) : Map.of();
    }

    /**
     * All mergeable fields of this record: the attributes plus the raw name
     * under {@link EntityFields#NAME}.
     */
    public Map<String, Object> fields() {
        Map<String, Object> fields = new TreeMap<>(attributes);
        if (!rawName.isBlank()) {
            fields.put(EntityFields.NAME, rawName);
        }
        return fields;
    }

    public CandidateRecord withNormalizedKey(String key) {
        return new CandidateRecord(id, key, rawName, entityType, attributes, sourceType,
                sourceUrl, confidence, collectedAt, strategyId);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String normalizedKey;
        private String rawName;
        private EntityType entityType;
        private final Map<String, Object> attributes = new LinkedHashMap<>();
        private SourceType sourceType;
        private String sourceUrl;
        private ConfidenceLevel confidence = ConfidenceLevel.MEDIUM;
        private Instant collectedAt = Instant.now();
        private String strategyId;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder normalizedKey(String normalizedKey) {
            this.normalizedKey = normalizedKey;
            return this;
        }

        public Builder rawName(String rawName) {
            this.rawName = rawName;
            return this;
        }

        public Builder entityType(EntityType entityType) {
            this.entityType = entityType;
            return this;
        }

        public Builder attribute(String name, Object value) {
            if (value != null) {
                this.attributes.put(name, value);
            }
            return this;
        }

        public Builder attributes(Map<String, ?> attributes) {
            if (attributes != null) {
                attributes.forEach(this::attribute);
            }
            return this;
        }

        public Builder sourceType(SourceType sourceType) {
            this.sourceType = sourceType;
            return this;
        }

        public Builder sourceUrl(String sourceUrl) {
            this.sourceUrl = sourceUrl;
            return this;
        }

        public Builder confidence(ConfidenceLevel confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder collectedAt(Instant collectedAt) {
            this.collectedAt = collectedAt;
            return this;
        }

        public Builder strategyId(String strategyId) {
            this.strategyId = strategyId;
            return this;
        }

        public CandidateRecord build() {
            String name = rawName != null ? rawName : "";
            String recordId = id != null ? id : fingerprint(name);
            return new CandidateRecord(recordId, normalizedKey, name, entityType, attributes,
                    sourceType, sourceUrl, confidence, collectedAt, strategyId);
        }

        private String fingerprint(String name) {
            Map<String, Object> content = new TreeMap<>();
            content.put("rawName", name);
            content.put("entityType", entityType != null ? entityType.name() : null);
            content.put("attributes", new TreeMap<>(attributes));
            content.put("sourceType", sourceType != null ? sourceType.name() : null);
            content.put("sourceUrl", sourceUrl);
            content.put("confidence", confidence != null ? confidence.name() : null);
            content.put("strategyId", strategyId);
            return Fingerprints.of(content);
        }
    }
}
