package com.dataset.matching.core.model;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * An entry of a reference dataset. Read-only from the matcher's point of view.
 *
 * <p>Aliases keep their original order; case-insensitive duplicates collapse to the
 * first occurrence and blank aliases are dropped.</p>
 */
public record ReferenceEntity(String organizationName,
                              List<String> aliases,
                              String category,
                              Set<String> countries,
                              String datasetId) {

    public ReferenceEntity {
        if (organizationName == null || organizationName.isBlank()) {
            throw new IllegalArgumentException("organizationName must not be blank");
        }
        Objects.requireNonNull(datasetId, "datasetId is required");
        organizationName = organizationName.trim();
        aliases = dedupeAliases(aliases);
        countries = countries != null ? Set.copyOf(new LinkedHashSet<>(countries)) : Set.of();
    }

    /**
     * Deduplication key: the same organization may not appear twice for one dataset.
     */
    public String dedupKey() {
        return datasetId + ":" + organizationName;
    }

    private static List<String> dedupeAliases(List<String> aliases) {
        if (aliases == null || aliases.isEmpty()) {
            return List.of();
        }
        Set<String> seen = new HashSet<>();
        List<String> result = new ArrayList<>();
        for (String alias : aliases) {
            if (alias == null || alias.isBlank()) {
                continue;
            }
            String trimmed = alias.trim();
            if (seen.add(trimmed.toLowerCase(Locale.ROOT))) {
                result.add(trimmed);
            }
        }
        return List.copyOf(result);
    }
}
