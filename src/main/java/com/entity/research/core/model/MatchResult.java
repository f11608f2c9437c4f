package com.entity.research.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of matching a candidate record against the known identity groups.
 *
 * @param normalizedKey the key the candidate belongs to (existing or new)
 * @param score         name similarity for the chosen key, 1.0 for exact and identifier matches
 * @param decision      how the key was chosen
 * @param ambiguous     true when a tie-break or an identifier conflict was involved
 * @param consideredKeys keys that competed for the candidate when ambiguous
 * @param reasoning     human-readable explanation
 */
public record MatchResult(
        String normalizedKey,
        double score,
        MatchDecision decision,
        boolean ambiguous,
        List<String> consideredKeys,
        String reasoning
) {
    public MatchResult {
        Objects.requireNonNull(normalizedKey, "normalizedKey is required");
        Objects.requireNonNull(decision, "decision is required");
        if (score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("Score must be between 0.0 and 1.0");
        }
        consideredKeys = consideredKeys != null ? List.copyOf(consideredKeys) : List.of();
    }

    public static MatchResult newKey(String normalizedKey) {
        return new MatchResult(normalizedKey, 0.0, MatchDecision.NEW, false, List.of(),
                "No existing entity matched");
    }

    public boolean isNew() {
        return decision == MatchDecision.NEW;
    }
}
