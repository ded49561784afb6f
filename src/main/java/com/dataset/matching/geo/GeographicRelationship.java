package com.dataset.matching.geo;

/**
 * Relation between a search location and the countries of a reference entity.
 */
public enum GeographicRelationship {
    SAME_COUNTRY,
    SAME_REGION,
    DIFFERENT_REGION,
    /** Location unresolvable, or the entity lists no country. */
    UNKNOWN
}
