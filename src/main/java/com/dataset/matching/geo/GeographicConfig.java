package com.dataset.matching.geo;

/**
 * Confidence factors applied when a query carries a search location.
 *
 * @param enabled         whether the location adjusts confidence at all
 * @param sameCountry     factor when the entity is listed in the searched country
 * @param sameRegion      factor when it is listed in another country of the same region
 * @param differentRegion factor when every listed country lies outside the region
 */
public record GeographicConfig(boolean enabled, double sameCountry, double sameRegion, double differentRegion) {

    public GeographicConfig {
        requirePositive("sameCountry", sameCountry);
        requirePositive("sameRegion", sameRegion);
        requirePositive("differentRegion", differentRegion);
    }

    /**
     * 1.2 same country, 1.1 same region, 0.9 elsewhere.
     */
    public static GeographicConfig defaults() {
        return new GeographicConfig(true, 1.2, 1.1, 0.9);
    }

    public static GeographicConfig disabled() {
        return new GeographicConfig(false, 1.0, 1.0, 1.0);
    }

    public double factor(GeographicRelationship relationship) {
        if (!enabled) {
            return 1.0;
        }
        return switch (relationship) {
            case SAME_COUNTRY -> sameCountry;
            case SAME_REGION -> sameRegion;
            case DIFFERENT_REGION -> differentRegion;
            case UNKNOWN -> 1.0;
        };
    }

    private static void requirePositive(String name, double value) {
        if (!Double.isFinite(value) || value <= 0.0) {
            throw new IllegalArgumentException(name + " must be a positive number");
        }
    }
}
