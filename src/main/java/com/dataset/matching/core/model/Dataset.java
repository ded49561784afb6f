package com.dataset.matching.core.model;

import java.util.Objects;

/**
 * A named reference dataset. Only entities of active datasets take part in matching.
 *
 * @param id         dataset identifier
 * @param name       display name reported on matches
 * @param active     whether the dataset is currently searchable
 * @param entryCount number of reference entities, informational
 */
public record Dataset(String id, String name, boolean active, long entryCount) {

    public Dataset {
        Objects.requireNonNull(id, "id is required");
        if (name == null || name.isBlank()) {
            name = id;
        }
        if (entryCount < 0) {
            throw new IllegalArgumentException("entryCount must be >= 0");
        }
    }
}
