package com.dataset.matching.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Whether a match came from the queried entity itself or from one of its affiliated companies.
 */
public enum RelationshipSource {
    DIRECT("direct"),
    AFFILIATED_COMPANY("affiliated_company");

    private final String wireName;

    RelationshipSource(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
