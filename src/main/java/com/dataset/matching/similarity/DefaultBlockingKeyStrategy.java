package com.dataset.matching.similarity;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Default blocking keys:
 * <ul>
 *   <li>{@code pfx:} first three characters of the name</li>
 *   <li>{@code tok:} every word of at least three characters that is not a connector</li>
 *   <li>{@code acr:} initials of multi-word names, and single words short enough to be an
 *   acronym, so "nudt" meets "national university of defense technology"</li>
 * </ul>
 */
public class DefaultBlockingKeyStrategy implements BlockingKeyStrategy {

    private static final Set<String> CONNECTORS = Set.of("the", "of", "and", "for", "de", "la", "du", "des");
    private static final int MAX_ACRONYM_LENGTH = 8;

    @Override
    public Set<String> generateKeys(String normalizedName) {
        Set<String> keys = new LinkedHashSet<>();
        if (normalizedName == null || normalizedName.isBlank()) {
            return keys;
        }
        String cleaned = normalizedName.trim();
        keys.add("pfx:" + cleaned.substring(0, Math.min(3, cleaned.length())));

        String[] words = cleaned.split("\\s+");
        StringBuilder initials = new StringBuilder();
        for (String word : words) {
            if (CONNECTORS.contains(word)) {
                continue;
            }
            initials.append(word.charAt(0));
            if (word.length() >= 3) {
                keys.add("tok:" + word);
            }
        }

        if (words.length == 1 && cleaned.length() >= 2 && cleaned.length() <= MAX_ACRONYM_LENGTH) {
            keys.add("acr:" + cleaned);
        } else if (initials.length() >= 2) {
            keys.add("acr:" + initials);
        }
        return keys;
    }
}
