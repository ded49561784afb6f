package com.dataset.matching.similarity;

/**
 * Normalized Levenshtein similarity: {@code 1 - editDistance / max(len1, len2)}.
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
        return 1.0 - (double) distance(s1, s2) / Math.max(s1.length(), s2.length());
    }

    @Override
    public String getName() {
        return "levenshtein";
    }

    /**
     * Edit distance with unit costs, keeping two rows sized to the shorter string.
     */
    static int distance(String a, String b) {
        String shorter = a.length() <= b.length() ? a : b;
        String longer = shorter == a ? b : a;

        int[] previous = new int[shorter.length() + 1];
        int[] current = new int[shorter.length() + 1];
        for (int i = 0; i < previous.length; i++) {
            previous[i] = i;
        }

        for (int j = 1; j <= longer.length(); j++) {
            current[0] = j;
            char c = longer.charAt(j - 1);
            for (int i = 1; i <= shorter.length(); i++) {
                int substitution = previous[i - 1] + (shorter.charAt(i - 1) == c ? 0 : 1);
                current[i] = Math.min(substitution, Math.min(previous[i], current[i - 1]) + 1);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[shorter.length()];
    }
}
