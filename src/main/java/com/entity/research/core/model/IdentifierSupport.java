package com.entity.research.core.model;

import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Extracts identifier attributes in a comparable form.
 */
public final class IdentifierSupport {

    private IdentifierSupport() {
    }

    public static Map<String, String> extract(Map<String, Object> attributes) {
        Map<String, String> ids = new TreeMap<>();
        for (String field : EntityFields.IDENTIFIERS) {
            Object value = attributes.get(field);
            if (value != null) {
                String normalized = normalize(value.toString());
                if (!normalized.isEmpty()) {
                    ids.put(field, normalized);
                }
            }
        }
        return ids;
    }

    /**
     * Strips separators and leading zeros so "0001234" and "1234" compare equal.
     */
    static String normalize(String value) {
        String cleaned = value.trim().toUpperCase(Locale.ROOT).replaceAll("[\\s\\-./]", "");
        String stripped = cleaned.replaceFirst("^0+(?=.)", "");
        return stripped;
    }
}
