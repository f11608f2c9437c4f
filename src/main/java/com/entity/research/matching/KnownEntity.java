package com.entity.research.matching;

import com.entity.research.core.model.MergedEntity;

import java.util.Map;
import java.util.Objects;

/**
 * What the matcher needs to know about an existing identity group.
 *
 * @param normalizedKey the group's key
 * @param identifiers   normalized identifier values by field
 * @param recordCount   number of records already contributing to the group
 */
public record KnownEntity(String normalizedKey, Map<String, String> identifiers, int recordCount) {

    public KnownEntity {
        Objects.requireNonNull(normalizedKey, "normalizedKey is required");
        identifiers = identifiers != null ? Map.copyOf(identifiers) : Map.of();
    }

    public static KnownEntity of(MergedEntity entity) {
        return new KnownEntity(entity.normalizedKey(), entity.identifiers(), entity.recordCount());
    }
}
