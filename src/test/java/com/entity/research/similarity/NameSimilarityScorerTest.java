package com.entity.research.similarity;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class NameSimilarityScorerTest {

    @Nested
    class Levenshtein {

        private final LevenshteinSimilarity levenshtein = new LevenshteinSimilarity();

        @ParameterizedTest
        @CsvSource({
                "kitten, sitting, 3",
                "acme, acme, 0",
                "'', abc, 3",
                "flaw, lawn, 2"
        })
        void distance(String a, String b, int expected) {
            assertEquals(expected, LevenshteinSimilarity.distance(a, b));
            assertEquals(expected, LevenshteinSimilarity.distance(b, a));
        }

        @Test
        void scoreIsOneMinusDistanceOverLongestLength() {
            assertEquals(1.0 - 3.0 / 7.0, levenshtein.compute("kitten", "sitting"), 1e-9);
            assertEquals(1.0, levenshtein.compute("acme", "acme"));
            assertEquals(0.0, levenshtein.compute("", "acme"));
            assertEquals(0.0, levenshtein.compute(null, "acme"));
        }
    }

    @Nested
    class TokenSet {

        private final TokenSetSimilarity tokenSet = new TokenSetSimilarity();

        @Test
        void wordOrderDoesNotMatter() {
            assertEquals(1.0, tokenSet.compute("capital acme", "acme capital"));
        }

        @Test
        void duplicateTokensCollapse() {
            assertEquals("acme capital", TokenSetSimilarity.canonical("capital acme  capital"));
        }
    }

    @Test
    void scorerTakesTheBetterOfBothAlgorithms() {
        NameSimilarityScorer scorer = new NameSimilarityScorer();

        NameSimilarityScorer.SimilarityBreakdown breakdown =
                scorer.computeWithBreakdown("partners acme", "acme partners");

        assertEquals(1.0, breakdown.tokenSetScore());
        assertTrue(breakdown.levenshteinScore() < 1.0);
        assertEquals(1.0, breakdown.score());
        assertEquals(breakdown.score(), scorer.compute("partners acme", "acme partners"));
    }

    @Test
    void isMatchUsesThreshold() {
        NameSimilarityScorer scorer = new NameSimilarityScorer();
        assertTrue(scorer.isMatch("acme capital", "acme capitol", 0.85));
        assertFalse(scorer.isMatch("acme capital", "zenith ventures", 0.85));
    }
}
