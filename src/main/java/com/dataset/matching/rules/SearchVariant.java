package com.dataset.matching.rules;

import java.util.Objects;

/**
 * One independent form under which a query is searched and classified.
 *
 * @param text       the variant as typed (trimmed, brackets removed)
 * @param normalized normalized form of {@code text}
 * @param core       core form of {@code text}
 * @param kind       where the variant came from
 */
public record SearchVariant(String text, String normalized, String core, Kind kind) {

    public enum Kind { ORIGINAL, BASE_NAME, ACRONYM, ALIAS }

    public SearchVariant {
        Objects.requireNonNull(text, "text is required");
        Objects.requireNonNull(normalized, "normalized is required");
        Objects.requireNonNull(core, "core is required");
        Objects.requireNonNull(kind, "kind is required");
    }
}
