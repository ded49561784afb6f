package com.dataset.matching.similarity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Similarity algorithm Tests")
class SimilarityAlgorithmsTest {

    @Nested
    @DisplayName("Jaro-Winkler")
    class JaroWinklerTests {

        private final JaroWinklerSimilarity jaroWinkler = new JaroWinklerSimilarity();

        @ParameterizedTest
        @CsvSource({
                "martha, marhta, 0.9611",
                "dwayne, duane, 0.84",
                "dixon, dicksonx, 0.8133"
        })
        void knownValues(String s1, String s2, double expected) {
            assertEquals(expected, jaroWinkler.compute(s1, s2), 0.001);
        }

        @Test
        void edgeCases() {
            assertEquals(1.0, jaroWinkler.compute("nudt", "nudt"));
            assertEquals(1.0, jaroWinkler.compute("", ""));
            assertEquals(0.0, jaroWinkler.compute("", "nudt"));
            assertEquals(0.0, jaroWinkler.compute(null, "nudt"));
            assertEquals(0.0, jaroWinkler.compute("abc", "xyz"));
        }

        @Test
        @DisplayName("Prefix bonus is withheld below the boost threshold")
        void noBoostBelowThreshold() {
            // jaro("abcxyz", "abcdef") = (3/6 + 3/6 + 1) / 3 = 0.6667, under 0.7
            assertEquals(2.0 / 3.0, jaroWinkler.compute("abcxyz", "abcdef"), 1e-9);
        }

        @Test
        void scalingFactorValidated() {
            assertThrows(IllegalArgumentException.class, () -> new JaroWinklerSimilarity(0.3));
        }
    }

    @Nested
    @DisplayName("Levenshtein")
    class LevenshteinTests {

        private final LevenshteinSimilarity levenshtein = new LevenshteinSimilarity();

        @ParameterizedTest
        @CsvSource({
                "kitten, sitting, 3",
                "flaw, lawn, 2",
                "nudt, nudt, 0",
                "'', abc, 3"
        })
        void editDistance(String s1, String s2, int expected) {
            assertEquals(expected, LevenshteinSimilarity.distance(s1, s2));
        }

        @Test
        void normalizedByLongerLength() {
            assertEquals(1.0 - 3.0 / 7.0, levenshtein.compute("kitten", "sitting"), 1e-9);
            assertEquals(0.0, levenshtein.compute("", "abc"));
            assertEquals(1.0, levenshtein.compute("same", "same"));
        }
    }

    @Nested
    @DisplayName("Bigram Jaccard")
    class NGramTests {

        private final NGramJaccardSimilarity bigrams = new NGramJaccardSimilarity();

        @Test
        void jaccardOverBigramSets() {
            // night: ni ig gh ht; nacht: na ac ch ht -> 1 shared of 7
            assertEquals(1.0 / 7.0, bigrams.compute("night", "nacht"), 1e-9);
            assertEquals(1.0, bigrams.compute("acme", "acme"));
        }

        @Test
        void tooShortForBigrams() {
            assertEquals(0.0, bigrams.compute("a", "b"));
            assertThrows(IllegalArgumentException.class, () -> new NGramJaccardSimilarity(0));
        }
    }

    @Nested
    @DisplayName("Text ratios")
    class TextRatioTests {

        @Test
        void containmentRequiresSubstring() {
            assertEquals(4.0 / 8.0, TextRatios.containment("acme", "acme ltd"), 1e-9);
            assertEquals(4.0 / 8.0, TextRatios.containment("acme ltd", "acme"), 1e-9);
            assertEquals(0.0, TextRatios.containment("acme", "apex"));
            assertEquals(0.0, TextRatios.containment("", "apex"));
        }

        @Test
        void lengthAndWordCountRatios() {
            assertEquals(0.5, TextRatios.lengthRatio("ab", "abcd"), 1e-9);
            assertEquals(0.5, TextRatios.wordCountRatio("acme", "acme ltd"), 1e-9);
            assertEquals(0.0, TextRatios.wordCountRatio(" ", "acme"));
        }
    }
}
