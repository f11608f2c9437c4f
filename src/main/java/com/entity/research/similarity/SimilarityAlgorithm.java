package com.entity.research.similarity;

/**
 * Scores how alike two normalized names are.
 * Implementations return 0.0 for unrelated input and 1.0 for identical input.
 */
public interface SimilarityAlgorithm {

    double compute(String s1, String s2);

    String getName();

    /**
     * Whether the two names are similar at or above the given threshold.
     */
    default boolean isMatch(String s1, String s2, double threshold) {
        return compute(s1, s2) >= threshold;
    }
}
