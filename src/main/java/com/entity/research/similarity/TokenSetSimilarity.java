package com.entity.research.similarity;

import java.util.Arrays;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Word-order insensitive similarity. Both names are reduced to their sorted set of
 * distinct tokens before the edit-distance ratio is taken, so "capital acme" and
 * "acme capital" score 1.0.
 */
public class TokenSetSimilarity implements SimilarityAlgorithm {

    private final LevenshteinSimilarity levenshtein = new LevenshteinSimilarity();

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        return levenshtein.compute(canonical(s1), canonical(s2));
    }

    @Override
    public String getName() {
        return "TokenSet";
    }

    static String canonical(String value) {
        return Arrays.stream(value.trim().split("\\s+"))
                .filter(token -> !token.isEmpty())
                .collect(Collectors.toCollection(TreeSet::new))
                .stream()
                .collect(Collectors.joining(" "));
    }
}
