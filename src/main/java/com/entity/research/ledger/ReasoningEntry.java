package com.entity.research.ledger;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One typed decision in a job's reasoning log.
 *
 * @param sequence  position in the log, starting at 1
 * @param timestamp when the decision was taken
 * @param kind      what was decided
 * @param inputs    the values the decision was based on, in insertion order
 * @param outcome   the decision itself, in words
 */
public record ReasoningEntry(
        int sequence,
        Instant timestamp,
        DecisionKind kind,
        Map<String, Object> inputs,
        String outcome
) {
    public ReasoningEntry {
        Objects.requireNonNull(timestamp, "timestamp is required");
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(outcome, "outcome is required");
        Map<String, Object> copy = new LinkedHashMap<>();
        if (inputs != null) {
            inputs.forEach((k, v) -> {
                if (v != null) {
                    copy.put(k, v);
                }
            });
        }
        inputs = Collections.unmodifiableMap(copy);
    }
}
