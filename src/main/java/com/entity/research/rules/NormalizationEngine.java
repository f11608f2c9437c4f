package com.entity.research.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Turns raw organization names into normalized keys.
 * Rules are applied in priority order (lower priority number = higher precedence),
 * followed by lowercasing, trimming and whitespace collapsing.
 */
public class NormalizationEngine {
    private static final Logger log = LoggerFactory.getLogger(NormalizationEngine.class);

    private final List<NormalizationRule> rules;

    public NormalizationEngine() {
        this.rules = new CopyOnWriteArrayList<>();
    }

    public NormalizationEngine(List<NormalizationRule> rules) {
        this.rules = new CopyOnWriteArrayList<>(sorted(rules));
    }

    /**
     * Adds multiple rules to the engine.
     */
    public synchronized void addRules(List<NormalizationRule> newRules) {
        List<NormalizationRule> merged = new ArrayList<>(rules);
        merged.addAll(newRules);
        rules.clear();
        rules.addAll(sorted(merged));
    }

    public boolean removeRule(String ruleName) {
        return rules.removeIf(r -> r.getName().equals(ruleName));
    }

    public List<NormalizationRule> getRules() {
        return List.copyOf(rules);
    }

    /**
     * Normalizes the given name. Blank or null input yields the empty string.
     */
    public String normalize(String name) {
        if (name == null || name.isBlank()) {
            return "";
        }

        String result = name.trim();
        for (NormalizationRule rule : rules) {
            String before = result;
            result = rule.apply(result).trim();
            if (!before.equals(result)) {
                log.debug("Rule '{}' transformed '{}' -> '{}'", rule.getName(), before, result);
            }
        }

        return result.toLowerCase(Locale.ROOT)
                .trim()
                .replaceAll("\\s+", " ");
    }

    /**
     * Checks if two names are equivalent after normalization.
     */
    public boolean areEquivalent(String name1, String name2) {
        return normalize(name1).equals(normalize(name2));
    }

    private static List<NormalizationRule> sorted(List<NormalizationRule> input) {
        List<NormalizationRule> copy = new ArrayList<>(input);
        copy.sort(Comparator.comparingInt(NormalizationRule::getPriority));
        return copy;
    }
}
