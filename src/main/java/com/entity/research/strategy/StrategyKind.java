package com.entity.research.strategy;

import java.util.Locale;

/**
 * The closed set of collection strategies the planner can propose.
 */
public enum StrategyKind {
    SEC_13F("sec_13f"),
    ANNUAL_REPORT("annual_report"),
    WEBSITE("website"),
    NEWS("news"),
    REVERSE_SEARCH("reverse_search"),
    REGISTRY_LOOKUP("registry_lookup");

    private final String id;

    StrategyKind(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    public static StrategyKind fromId(String id) {
        if (id == null) {
            throw new IllegalArgumentException("Strategy id is required");
        }
        String cleaned = id.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (StrategyKind kind : values()) {
            if (kind.id.equals(cleaned)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown strategy: " + id);
    }
}
