package com.entity.research.orchestrator;

public enum StopReason {
    SUFFICIENT_COVERAGE("Stop: sufficient coverage"),
    BUDGET_EXHAUSTED("Stop: budget exhausted"),
    TIME_EXCEEDED("Stop: time exceeded"),
    NO_DATA_FOUND("Stop: no data found"),
    PLAN_EXHAUSTED("Stop: plan exhausted"),
    CANCELLED("Stop: cancelled"),
    NO_APPLICABLE_STRATEGIES("Stop: no applicable strategies");

    private final String label;

    StopReason(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
