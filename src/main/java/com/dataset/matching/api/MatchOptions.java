package com.dataset.matching.api;

import com.dataset.matching.core.model.MatchType;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Per-query matching options.
 *
 * <p>Out-of-range values are clamped rather than rejected: confidence into [0, 1] and
 * result count into [1, 100]. The affiliated boost is clamped into
 * [1.0, {@value #MAX_AFFILIATED_BOOST}], so it never lowers a confidence; a NaN or infinite
 * boost falls back to {@value #DEFAULT_AFFILIATED_BOOST}.</p>
 */
public class MatchOptions {

    public static final double DEFAULT_MIN_CONFIDENCE = 0.3;
    public static final int DEFAULT_MAX_RESULTS = 20;
    public static final int MAX_RESULTS_CAP = 100;
    public static final double DEFAULT_AFFILIATED_BOOST = 1.15;
    public static final double MAX_AFFILIATED_BOOST = 2.0;

    private final double minConfidence;
    private final int maxResults;
    private final boolean forceRefresh;
    private final double affiliatedBoost;
    private final Set<MatchType> matchTypes;

    private MatchOptions(Builder builder) {
        this.minConfidence = builder.minConfidence;
        this.maxResults = builder.maxResults;
        this.forceRefresh = builder.forceRefresh;
        this.affiliatedBoost = builder.affiliatedBoost;
        this.matchTypes = builder.matchTypes.isEmpty() ? Set.of() : Set.copyOf(builder.matchTypes);
    }

    public double getMinConfidence() {
        return minConfidence;
    }

    public int getMaxResults() {
        return maxResults;
    }

    public boolean isForceRefresh() {
        return forceRefresh;
    }

    public double getAffiliatedBoost() {
        return affiliatedBoost;
    }

    /**
     * Match types to keep; empty keeps all.
     */
    public Set<MatchType> getMatchTypes() {
        return matchTypes;
    }

    public static MatchOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder()
                .minConfidence(minConfidence)
                .maxResults(maxResults)
                .forceRefresh(forceRefresh)
                .affiliatedBoost(affiliatedBoost);
        builder.matchTypes.addAll(matchTypes);
        return builder;
    }

    public static class Builder {
        private double minConfidence = DEFAULT_MIN_CONFIDENCE;
        private int maxResults = DEFAULT_MAX_RESULTS;
        private boolean forceRefresh = false;
        private double affiliatedBoost = DEFAULT_AFFILIATED_BOOST;
        private final Set<MatchType> matchTypes = EnumSet.noneOf(MatchType.class);

        public Builder minConfidence(double minConfidence) {
            this.minConfidence = Double.isNaN(minConfidence)
                    ? DEFAULT_MIN_CONFIDENCE
                    : Math.max(0.0, Math.min(1.0, minConfidence));
            return this;
        }

        public Builder maxResults(int maxResults) {
            this.maxResults = Math.max(1, Math.min(MAX_RESULTS_CAP, maxResults));
            return this;
        }

        public Builder forceRefresh(boolean forceRefresh) {
            this.forceRefresh = forceRefresh;
            return this;
        }

        public Builder affiliatedBoost(double affiliatedBoost) {
            this.affiliatedBoost = Double.isFinite(affiliatedBoost)
                    ? Math.max(1.0, Math.min(MAX_AFFILIATED_BOOST, affiliatedBoost))
                    : DEFAULT_AFFILIATED_BOOST;
            return this;
        }

        public Builder matchTypes(Set<MatchType> types) {
            this.matchTypes.clear();
            if (types != null) {
                types.stream().filter(Objects::nonNull).forEach(this.matchTypes::add);
            }
            return this;
        }

        public Builder matchTypes(MatchType... types) {
            return matchTypes(Set.of(types));
        }

        public MatchOptions build() {
            return new MatchOptions(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MatchOptions that = (MatchOptions) o;
        return Double.compare(that.minConfidence, minConfidence) == 0
                && maxResults == that.maxResults
                && forceRefresh == that.forceRefresh
                && Double.compare(that.affiliatedBoost, affiliatedBoost) == 0
                && matchTypes.equals(that.matchTypes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(minConfidence, maxResults, forceRefresh, affiliatedBoost, matchTypes);
    }

    @Override
    public String toString() {
        return "MatchOptions{" +
                "minConfidence=" + minConfidence +
                ", maxResults=" + maxResults +
                ", forceRefresh=" + forceRefresh +
                ", affiliatedBoost=" + affiliatedBoost +
                ", matchTypes=" + matchTypes +
                '}';
    }
}
