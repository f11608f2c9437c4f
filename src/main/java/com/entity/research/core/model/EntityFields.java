package com.entity.research.core.model;

import java.util.Set;

/**
 * Well-known attribute names shared by strategies, the planner and the synthesizer.
 */
public final class EntityFields {

    public static final String NAME = "name";
    public static final String WEBSITE = "website";
    public static final String AUM = "aum";
    public static final String INDUSTRY = "industry";
    public static final String HEADQUARTERS = "headquarters";
    public static final String LP_TYPE = "lp_type";
    public static final String CIK = "cik";
    public static final String CRD_NUMBER = "crd_number";
    public static final String REGISTRATION_NUMBER = "registration_number";
    public static final String LEI = "lei";

    /**
     * Attributes that identify an entity on their own. Equal values on two records
     * force a match regardless of name similarity.
     */
    public static final Set<String> IDENTIFIERS = Set.of(CIK, CRD_NUMBER, REGISTRATION_NUMBER, LEI);

    private EntityFields() {
        // Constants
    }

    public static boolean isIdentifier(String field) {
        return IDENTIFIERS.contains(field);
    }
}
