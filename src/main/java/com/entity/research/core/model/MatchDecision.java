package com.entity.research.core.model;

/**
 * How a candidate record was assigned to an identity group.
 */
public enum MatchDecision {
    /**
     * A structured identifier (CIK, LEI, ...) is equal on both sides.
     */
    IDENTIFIER,

    /**
     * Normalized names are identical.
     */
    EXACT,

    /**
     * Normalized names are similar at or above the fuzzy threshold.
     */
    FUZZY,

    /**
     * No existing group qualified; the candidate starts a new one.
     */
    NEW
}
