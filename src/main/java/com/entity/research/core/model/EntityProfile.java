package com.entity.research.core.model;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * What is known about a research target before any strategy runs.
 * Planning rules inspect it; strategies use it to build their queries.
 */
public record EntityProfile(
        String targetIdentity,
        EntityType entityType,
        Map<String, Object> attributes
) {
    public EntityProfile {
        Objects.requireNonNull(targetIdentity, "targetIdentity is required");
        Objects.requireNonNull(entityType, "entityType is required");
        if (targetIdentity.isBlank()) {
            throw new IllegalArgumentException("targetIdentity must not be blank");
        }
        attributes = attributes != null ? Map.copyOf(attributes) : Map.of();
    }

    public static EntityProfile of(String targetIdentity, EntityType entityType) {
        return new EntityProfile(targetIdentity, entityType, Map.of());
    }

    public Optional<Object> attribute(String name) {
        return Optional.ofNullable(attributes.get(name));
    }

    public Optional<String> text(String name) {
        return attribute(name)
                .map(Object::toString)
                .map(String::trim)
                .filter(s -> !s.isEmpty());
    }

    /**
     * Reads a numeric attribute, accepting numbers or numeric strings.
     */
    public Optional<Double> number(String name) {
        Object value = attributes.get(name);
        if (value instanceof Number n) {
            return Optional.of(n.doubleValue());
        }
        if (value instanceof String s && !s.isBlank()) {
            try {
                return Optional.of(Double.parseDouble(s.trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    public boolean has(String name) {
        return text(name).isPresent();
    }
}
