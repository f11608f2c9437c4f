package com.entity.research.similarity;

/**
 * Edit-distance ratio: {@code 1 - distance / max(len1, len2)}.
 */
public class LevenshteinSimilarity implements SimilarityAlgorithm {

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }
        if (s1.isEmpty() || s2.isEmpty()) {
            return 0.0;
        }
        int maxLength = Math.max(s1.length(), s2.length());
        return 1.0 - ((double) distance(s1, s2) / maxLength);
    }

    @Override
    public String getName() {
        return "Levenshtein";
    }

    /**
     * Minimum number of single-character insertions, deletions or substitutions
     * turning one string into the other. Two rows of the DP table are kept,
     * sized by the shorter string.
     */
    static int distance(String a, String b) {
        String shorter = a.length() <= b.length() ? a : b;
        String longer = shorter == a ? b : a;

        int[] prev = new int[shorter.length() + 1];
        int[] curr = new int[shorter.length() + 1];
        for (int i = 0; i < prev.length; i++) {
            prev[i] = i;
        }

        for (int j = 1; j <= longer.length(); j++) {
            curr[0] = j;
            char c = longer.charAt(j - 1);
            for (int i = 1; i <= shorter.length(); i++) {
                int substitution = prev[i - 1] + (shorter.charAt(i - 1) == c ? 0 : 1);
                curr[i] = Math.min(substitution, Math.min(prev[i], curr[i - 1]) + 1);
            }
            int[] swap = prev;
            prev = curr;
            curr = swap;
        }
        return prev[shorter.length()];
    }
}
