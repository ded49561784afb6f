package com.dataset.matching.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * How a reference entity matched a query. Declaration order is the classification
 * precedence: the first type whose rule holds wins.
 */
public enum MatchType {
    EXACT("exact"),
    ALIAS("alias"),
    ALIAS_PARTIAL("alias_partial"),
    CORE_MATCH("core_match"),
    FUZZY("fuzzy"),
    PARTIAL("partial");

    private final String wireName;

    MatchType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Resolves a wire name (case-insensitive) to a match type.
     *
     * @throws IllegalArgumentException if the name is unknown
     */
    public static MatchType fromWireName(String name) {
        return findByWireName(name)
                .orElseThrow(() -> new IllegalArgumentException("Unknown match type: " + name));
    }

    public static Optional<MatchType> findByWireName(String name) {
        if (name != null) {
            for (MatchType type : values()) {
                if (type.wireName.equalsIgnoreCase(name.trim())) {
                    return Optional.of(type);
                }
            }
        }
        return Optional.empty();
    }
}
