package com.entity.research.core.model;

import java.util.Locale;

/**
 * Categories of external sources a candidate record can originate from.
 * The declaration order is the default reliability order, most reliable first.
 */
public enum SourceType {
    REGULATORY_FILING("regulatory_filing"),
    OFFICIAL_PRIMARY("official_primary"),
    STRUCTURED_REGISTRY("structured_registry"),
    FIRST_PARTY_CONTENT("first_party_content"),
    PRESS_NEWS("press_news"),
    INFERRED_SIGNAL("inferred_signal");

    private final String code;

    SourceType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * Resolves a source type from its code or enum name, ignoring case and dashes.
     */
    public static SourceType fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Source type code is required");
        }
        String cleaned = code.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (SourceType type : values()) {
            if (type.code.equals(cleaned)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown source type: " + code);
    }
}
