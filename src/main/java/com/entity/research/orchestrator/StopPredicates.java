package com.entity.research.orchestrator;

import java.util.Optional;

/**
 * The stop rules, evaluated in order after every completed attempt; the first one that
 * fires decides. Pure functions of the progress snapshot and the options.
 */
public final class StopPredicates {

    private StopPredicates() {
    }

    public static StopDecision evaluate(ProgressSnapshot progress, ResearchOptions options) {
        return sufficientCoverage(progress, options)
                .or(() -> budgetExhausted(progress, options))
                .or(() -> timeExceeded(progress, options))
                .or(() -> noDataFound(progress, options))
                .orElseGet(() -> StopDecision.proceed(String.format(
                        "coverage %d%% < %d%% or source types %d < %d; tried %d of %d strategies",
                        progress.coverage(), options.getCoverageThreshold(),
                        progress.distinctSourceTypes(), options.getMinSourceTypes(),
                        progress.strategiesTried(), options.getMaxStrategiesPerJob())));
    }

    static Optional<StopDecision> sufficientCoverage(ProgressSnapshot progress, ResearchOptions options) {
        if (progress.coverage() >= options.getCoverageThreshold()
                && progress.distinctSourceTypes() >= options.getMinSourceTypes()) {
            return Optional.of(StopDecision.stop(StopReason.SUFFICIENT_COVERAGE, String.format(
                    "coverage %d%% >= %d%% with %d source types consulted",
                    progress.coverage(), options.getCoverageThreshold(), progress.distinctSourceTypes())));
        }
        return Optional.empty();
    }

    static Optional<StopDecision> budgetExhausted(ProgressSnapshot progress, ResearchOptions options) {
        if (progress.strategiesTried() >= options.getMaxStrategiesPerJob()) {
            return Optional.of(StopDecision.stop(StopReason.BUDGET_EXHAUSTED, String.format(
                    "strategies tried %d >= max %d", progress.strategiesTried(), options.getMaxStrategiesPerJob())));
        }
        return Optional.empty();
    }

    static Optional<StopDecision> timeExceeded(ProgressSnapshot progress, ResearchOptions options) {
        if (progress.elapsed().compareTo(options.getMaxJobDuration()) >= 0) {
            return Optional.of(StopDecision.stop(StopReason.TIME_EXCEEDED, String.format(
                    "elapsed %ds >= max %ds", progress.elapsed().toSeconds(),
                    options.getMaxJobDuration().toSeconds())));
        }
        return Optional.empty();
    }

    static Optional<StopDecision> noDataFound(ProgressSnapshot progress, ResearchOptions options) {
        if (progress.totalRecords() == 0 && progress.strategiesTried() >= options.getNoDataStrategyFloor()) {
            return Optional.of(StopDecision.stop(StopReason.NO_DATA_FOUND, String.format(
                    "zero records after %d strategies", progress.strategiesTried())));
        }
        return Optional.empty();
    }
}
