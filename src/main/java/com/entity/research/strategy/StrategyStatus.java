package com.entity.research.strategy;

public enum StrategyStatus {
    SUCCESS,
    PARTIAL,
    FAILED
}
