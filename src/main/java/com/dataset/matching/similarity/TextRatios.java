package com.dataset.matching.similarity;

import java.util.regex.Pattern;

/**
 * Size ratios between two names. Containment feeds classification; the length and
 * word-count ratios are advisory and only reach the quality metrics.
 */
public final class TextRatios {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TextRatios() {
    }

    /**
     * {@code shorter.length / longer.length} when the longer string contains the shorter one, else 0.
     */
    public static double containment(String s1, String s2) {
        if (s1 == null || s2 == null || s1.isEmpty() || s2.isEmpty()) {
            return 0.0;
        }
        String longer = s1.length() > s2.length() ? s1 : s2;
        String shorter = longer == s1 ? s2 : s1;
        return longer.contains(shorter) ? (double) shorter.length() / longer.length() : 0.0;
    }

    public static double lengthRatio(String s1, String s2) {
        if (s1 == null || s2 == null || s1.isEmpty() || s2.isEmpty()) {
            return 0.0;
        }
        return (double) Math.min(s1.length(), s2.length()) / Math.max(s1.length(), s2.length());
    }

    public static double wordCountRatio(String s1, String s2) {
        if (s1 == null || s2 == null || s1.isBlank() || s2.isBlank()) {
            return 0.0;
        }
        int words1 = WHITESPACE.split(s1.trim()).length;
        int words2 = WHITESPACE.split(s2.trim()).length;
        return (double) Math.min(words1, words2) / Math.max(words1, words2);
    }
}
