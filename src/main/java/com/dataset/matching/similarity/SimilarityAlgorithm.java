package com.dataset.matching.similarity;

/**
 * A string similarity measure scoring from 0.0 (nothing in common) to 1.0 (identical).
 * Implementations are stateless and thread-safe; callers pass normalized names.
 */
public interface SimilarityAlgorithm {

    double compute(String s1, String s2);

    String getName();
}
