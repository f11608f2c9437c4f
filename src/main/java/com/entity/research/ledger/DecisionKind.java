package com.entity.research.ledger;

/**
 * Kinds of entries in a job's reasoning log.
 */
public enum DecisionKind {
    PLAN,
    DISPATCH,
    ATTEMPT_COMPLETED,
    ATTEMPT_FAILED,
    SYNTHESIZE,
    MATCH_AMBIGUOUS,
    CONTINUE,
    STOP,
    CANCEL,
    FINALIZE
}
