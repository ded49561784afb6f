package com.dataset.matching.similarity;

/**
 * The three similarity signals between two normalized names.
 */
public record SimilarityProfile(double jaroWinkler, double levenshtein, double nGram) {

    public double max() {
        return Math.max(jaroWinkler, Math.max(levenshtein, nGram));
    }
}
