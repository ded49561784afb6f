package com.dataset.matching.similarity;

/**
 * Jaro-Winkler similarity. The common-prefix bonus (at most four characters) is only
 * granted once the plain Jaro score reaches the boost threshold.
 */
public class JaroWinklerSimilarity implements SimilarityAlgorithm {

    private static final double DEFAULT_SCALING_FACTOR = 0.1;
    private static final double BOOST_THRESHOLD = 0.7;
    private static final int MAX_PREFIX_LENGTH = 4;

    private final double scalingFactor;

    public JaroWinklerSimilarity() {
        this(DEFAULT_SCALING_FACTOR);
    }

    public JaroWinklerSimilarity(double scalingFactor) {
        if (scalingFactor < 0 || scalingFactor > 0.25) {
            throw new IllegalArgumentException("Scaling factor must be between 0 and 0.25");
        }
        this.scalingFactor = scalingFactor;
    }

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

        double jaro = jaro(s1, s2);
        if (jaro < BOOST_THRESHOLD) {
            return jaro;
        }

        int limit = Math.min(MAX_PREFIX_LENGTH, Math.min(s1.length(), s2.length()));
        int prefix = 0;
        while (prefix < limit && s1.charAt(prefix) == s2.charAt(prefix)) {
            prefix++;
        }
        return Math.min(1.0, jaro + prefix * scalingFactor * (1.0 - jaro));
    }

    @Override
    public String getName() {
        return "jaro-winkler";
    }

    private static double jaro(String s1, String s2) {
        int len1 = s1.length();
        int len2 = s2.length();
        int window = Math.max(0, Math.max(len1, len2) / 2 - 1);

        boolean[] matched1 = new boolean[len1];
        boolean[] matched2 = new boolean[len2];
        int matches = 0;

        for (int i = 0; i < len1; i++) {
            int from = Math.max(0, i - window);
            int to = Math.min(i + window + 1, len2);
            for (int j = from; j < to; j++) {
                if (!matched2[j] && s1.charAt(i) == s2.charAt(j)) {
                    matched1[i] = true;
                    matched2[j] = true;
                    matches++;
                    break;
                }
            }
        }
        if (matches == 0) {
            return 0.0;
        }

        int halfTranspositions = 0;
        int k = 0;
        for (int i = 0; i < len1; i++) {
            if (!matched1[i]) {
                continue;
            }
            while (!matched2[k]) {
                k++;
            }
            if (s1.charAt(i) != s2.charAt(k)) {
                halfTranspositions++;
            }
            k++;
        }

        double m = matches;
        return (m / len1 + m / len2 + (m - halfTranspositions / 2.0) / m) / 3.0;
    }
}
