package com.entity.research.merge;

import com.entity.research.core.model.EntityFields;
import com.entity.research.core.model.EntityType;

import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Completeness and confidence scoring for merged entities.
 *
 * <p>Confidence = 0.4 * min(distinctSourceTypes, 3) / 3
 * + 0.2 * (top-tier source present ? 1 : 0)
 * + 0.4 * completeness / 100, clamped to [0, 1].</p>
 */
public class ScoringPolicy {

    static final double SOURCE_WEIGHT = 0.4;
    static final double TOP_TIER_WEIGHT = 0.2;
    static final double COMPLETENESS_WEIGHT = 0.4;
    static final int SOURCE_CAP = 3;

    private static final List<String> FALLBACK_REQUIRED = List.of(EntityFields.NAME, EntityFields.WEBSITE);

    private final Map<EntityType, List<String>> requiredFields;

    public ScoringPolicy(Map<EntityType, List<String>> requiredFields) {
        this.requiredFields = new EnumMap<>(EntityType.class);
        requiredFields.forEach((type, fields) -> {
            if (fields.isEmpty()) {
                throw new IllegalArgumentException("Required fields for " + type + " must not be empty");
            }
            this.requiredFields.put(type, List.copyOf(fields));
        });
    }

    public static ScoringPolicy defaults() {
        return new ScoringPolicy(Map.of(
                EntityType.INVESTOR, List.of(EntityFields.NAME, EntityFields.WEBSITE, EntityFields.AUM),
                EntityType.COMPANY, List.of(EntityFields.NAME, EntityFields.WEBSITE,
                        EntityFields.INDUSTRY, EntityFields.HEADQUARTERS),
                EntityType.FAMILY_OFFICE, List.of(EntityFields.NAME, EntityFields.WEBSITE,
                        EntityFields.HEADQUARTERS)
        ));
    }

    public List<String> requiredFields(EntityType type) {
        return type == null ? FALLBACK_REQUIRED : requiredFields.getOrDefault(type, FALLBACK_REQUIRED);
    }

    /**
     * Populated required fields over total required fields, as a rounded percentage.
     */
    public int completeness(EntityType type, Map<String, Object> attributes) {
        List<String> required = requiredFields(type);
        long populated = required.stream().filter(attributes::containsKey).count();
        return (int) Math.round(populated * 100.0 / required.size());
    }

    public double confidence(Collection<?> distinctSourceTypes, boolean topTierPresent, int completeness) {
        if (distinctSourceTypes.isEmpty()) {
            return 0.0;
        }
        double sources = Math.min(distinctSourceTypes.size(), SOURCE_CAP) / (double) SOURCE_CAP;
        double score = SOURCE_WEIGHT * sources
                + (topTierPresent ? TOP_TIER_WEIGHT : 0.0)
                + COMPLETENESS_WEIGHT * (completeness / 100.0);
        return Math.max(0.0, Math.min(1.0, score));
    }
}
