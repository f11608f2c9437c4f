package com.entity.research.similarity;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Name similarity used by the entity matcher: the better of the plain edit-distance
 * ratio and the token-set ratio.
 */
public class NameSimilarityScorer implements SimilarityAlgorithm {
    private static final Logger log = LoggerFactory.getLogger(NameSimilarityScorer.class);

    private final LevenshteinSimilarity levenshtein;
    private final TokenSetSimilarity tokenSet;

    public NameSimilarityScorer() {
        this.levenshtein = new LevenshteinSimilarity();
        this.tokenSet = new TokenSetSimilarity();
    }

    @Override
    public double compute(String s1, String s2) {
        return computeWithBreakdown(s1, s2).score();
    }

    @Override
    public String getName() {
        return "NameSimilarity";
    }

    public SimilarityBreakdown computeWithBreakdown(String s1, String s2) {
        double levScore = levenshtein.compute(s1, s2);
        double tokenScore = tokenSet.compute(s1, s2);
        double score = Math.max(levScore, tokenScore);
        log.debug("Similarity '{}' vs '{}': levenshtein={}, tokenSet={}, score={}",
                s1, s2, levScore, tokenScore, score);
        return new SimilarityBreakdown(levScore, tokenScore, score);
    }

    public record SimilarityBreakdown(double levenshteinScore, double tokenSetScore, double score) {
        @Override
        public String toString() {
            return String.format("SimilarityBreakdown{levenshtein=%.4f, tokenSet=%.4f, score=%.4f}",
                    levenshteinScore, tokenSetScore, score);
        }
    }
}
