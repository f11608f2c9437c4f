package com.entity.research.rules;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A rule for normalizing organization names using regex pattern matching.
 * Rules are ordered by priority; lower numbers run first.
 */
public class NormalizationRule {
    private final String name;
    private final Pattern pattern;
    private final String replacement;
    private final int priority;
    private final boolean repeatable;

    private NormalizationRule(Builder builder) {
        this.name = builder.name;
        this.pattern = Pattern.compile(builder.pattern, Pattern.CASE_INSENSITIVE);
        this.replacement = builder.replacement;
        this.priority = builder.priority;
        this.repeatable = builder.repeatable;
    }

    public String getName() {
        return name;
    }

    public Pattern getPattern() {
        return pattern;
    }

    public String getReplacement() {
        return replacement;
    }

    public int getPriority() {
        return priority;
    }

    /**
     * Whether the rule is re-applied until the input stops changing,
     * e.g. to strip stacked suffixes such as "Holdings, L.P., Inc.".
     */
    public boolean isRepeatable() {
        return repeatable;
    }

    /**
     * Applies this rule to the given input string.
     */
    public String apply(String input) {
        if (input == null) {
            return null;
        }
        String result = pattern.matcher(input).replaceAll(replacement);
        if (!repeatable) {
            return result;
        }
        String previous = input;
        int guard = 0;
        while (!result.equals(previous) && guard++ < 8) {
            previous = result;
            result = pattern.matcher(result).replaceAll(replacement);
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NormalizationRule that = (NormalizationRule) o;
        return Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name);
    }

    @Override
    public String toString() {
        return "NormalizationRule{" +
                "name='" + name + '\'' +
                ", pattern=" + pattern.pattern() +
                ", priority=" + priority +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private String pattern;
        private String replacement;
        private int priority = 100;
        private boolean repeatable;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder pattern(String pattern) {
            this.pattern = pattern;
            return this;
        }

        public Builder replacement(String replacement) {
            this.replacement = replacement;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder repeatable(boolean repeatable) {
            this.repeatable = repeatable;
            return this;
        }

        public NormalizationRule build() {
            Objects.requireNonNull(name, "name is required");
            Objects.requireNonNull(pattern, "pattern is required");
            Objects.requireNonNull(replacement, "replacement is required");
            return new NormalizationRule(this);
        }
    }
}
