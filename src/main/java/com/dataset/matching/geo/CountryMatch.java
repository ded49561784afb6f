package com.dataset.matching.geo;

/**
 * A free-text country resolved to its canonical name.
 *
 * @param canonical  canonical country name, as listed in the country table
 * @param confidence 1.0 for the canonical name, lower for codes, aliases and near misses
 * @param kind       how the input was recognized
 */
public record CountryMatch(String canonical, double confidence, Kind kind) {

    public enum Kind { EXACT, ISO_CODE, ALIAS, FUZZY }
}
