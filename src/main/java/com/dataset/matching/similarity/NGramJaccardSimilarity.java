package com.dataset.matching.similarity;

import java.util.HashSet;
import java.util.Set;

/**
 * Jaccard similarity of character n-gram sets (bigrams by default).
 */
public class NGramJaccardSimilarity implements SimilarityAlgorithm {

    private final int n;

    public NGramJaccardSimilarity() {
        this(2);
    }

    public NGramJaccardSimilarity(int n) {
        if (n < 1) {
            throw new IllegalArgumentException("n must be >= 1");
        }
        this.n = n;
    }

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }
        Set<String> grams1 = grams(s1);
        Set<String> grams2 = grams(s2);
        if (grams1.isEmpty() || grams2.isEmpty()) {
            return 0.0;
        }

        int intersection = 0;
        for (String gram : grams1) {
            if (grams2.contains(gram)) {
                intersection++;
            }
        }
        return (double) intersection / (grams1.size() + grams2.size() - intersection);
    }

    @Override
    public String getName() {
        return n + "-gram-jaccard";
    }

    private Set<String> grams(String s) {
        Set<String> result = new HashSet<>();
        for (int i = 0; i + n <= s.length(); i++) {
            result.add(s.substring(i, i + n));
        }
        return result;
    }
}
