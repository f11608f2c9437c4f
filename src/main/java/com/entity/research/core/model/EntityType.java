package com.entity.research.core.model;

/**
 * Kinds of real-world entities a research job can target.
 */
public enum EntityType {
    COMPANY("Company"),
    INVESTOR("Investor"),
    FAMILY_OFFICE("FamilyOffice");

    private final String label;

    EntityType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
