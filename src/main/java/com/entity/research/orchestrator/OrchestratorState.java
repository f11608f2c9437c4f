package com.entity.research.orchestrator;

/**
 * Control-flow states of one job run.
 * PLANNED, then EXECUTING, then CONTINUING (back to EXECUTING) or STOPPING, then FINALIZED.
 */
public enum OrchestratorState {
    PLANNED,
    EXECUTING,
    CONTINUING,
    STOPPING,
    FINALIZED
}
