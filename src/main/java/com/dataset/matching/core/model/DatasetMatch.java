package com.dataset.matching.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * A ranked candidate returned for a query.
 * Instances are immutable; {@link #toAffiliated(double, String, double)} derives a boosted copy.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"dataset_name", "organization_name", "match_type", "confidence_score", "coverage",
        "category", "relationship_source", "source_risk_keyword", "boost_applied"})
public final class DatasetMatch {

    private final String datasetId;
    private final String datasetName;
    private final String organizationName;
    private final MatchType matchType;
    private final double confidenceScore;
    private final double coverage;
    private final String category;
    private final RelationshipSource relationshipSource;
    private final String sourceRiskKeyword;
    private final Double boostApplied;
    private final String matchedVariant;
    private final QualityMetrics qualityMetrics;
    private final Double geographicBoost;

    private DatasetMatch(Builder builder) {
        this.datasetId = builder.datasetId;
        this.datasetName = builder.datasetName;
        this.organizationName = builder.organizationName;
        this.matchType = builder.matchType;
        this.confidenceScore = builder.confidenceScore;
        this.coverage = builder.coverage;
        this.category = builder.category;
        this.relationshipSource = builder.relationshipSource;
        this.sourceRiskKeyword = builder.sourceRiskKeyword;
        this.boostApplied = builder.boostApplied;
        this.matchedVariant = builder.matchedVariant;
        this.qualityMetrics = builder.qualityMetrics;
        this.geographicBoost = builder.geographicBoost;
    }

    @JsonProperty("dataset_id")
    public String getDatasetId() {
        return datasetId;
    }

    @JsonProperty("dataset_name")
    public String getDatasetName() {
        return datasetName;
    }

    @JsonProperty("organization_name")
    public String getOrganizationName() {
        return organizationName;
    }

    @JsonProperty("match_type")
    public MatchType getMatchType() {
        return matchType;
    }

    @JsonProperty("confidence_score")
    public double getConfidenceScore() {
        return confidenceScore;
    }

    @JsonProperty("coverage")
    public double getCoverage() {
        return coverage;
    }

    @JsonProperty("category")
    public String getCategory() {
        return category;
    }

    @JsonProperty("relationship_source")
    public RelationshipSource getRelationshipSource() {
        return relationshipSource;
    }

    @JsonProperty("source_risk_keyword")
    public String getSourceRiskKeyword() {
        return sourceRiskKeyword;
    }

    @JsonProperty("boost_applied")
    public Double getBoostApplied() {
        return boostApplied;
    }

    @JsonProperty("matched_variant")
    public String getMatchedVariant() {
        return matchedVariant;
    }

    @JsonProperty("quality_metrics")
    public QualityMetrics getQualityMetrics() {
        return qualityMetrics;
    }

    /**
     * Location factor applied to the confidence, or null when the query carried no resolvable location.
     */
    @JsonProperty("geographic_boost")
    public Double getGeographicBoost() {
        return geographicBoost;
    }

    /**
     * Copy of this match re-tagged as coming from an affiliated company.
     *
     * @param boostedConfidence confidence after the boost, already capped
     * @param riskKeyword       risk keyword of the affiliated company
     * @param boost             boost multiplier that was applied
     */
    public DatasetMatch toAffiliated(double boostedConfidence, String riskKeyword, double boost) {
        return toBuilder()
                .confidenceScore(boostedConfidence)
                .relationshipSource(RelationshipSource.AFFILIATED_COMPANY)
                .sourceRiskKeyword(riskKeyword)
                .boostApplied(boost)
                .build();
    }

    public Builder toBuilder() {
        return new Builder()
                .datasetId(datasetId)
                .datasetName(datasetName)
                .organizationName(organizationName)
                .matchType(matchType)
                .confidenceScore(confidenceScore)
                .coverage(coverage)
                .category(category)
                .relationshipSource(relationshipSource)
                .sourceRiskKeyword(sourceRiskKeyword)
                .boostApplied(boostApplied)
                .matchedVariant(matchedVariant)
                .qualityMetrics(qualityMetrics)
                .geographicBoost(geographicBoost);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DatasetMatch that = (DatasetMatch) o;
        return Double.compare(that.confidenceScore, confidenceScore) == 0
                && Double.compare(that.coverage, coverage) == 0
                && Objects.equals(datasetId, that.datasetId)
                && Objects.equals(organizationName, that.organizationName)
                && matchType == that.matchType
                && relationshipSource == that.relationshipSource
                && Objects.equals(sourceRiskKeyword, that.sourceRiskKeyword);
    }

    @Override
    public int hashCode() {
        return Objects.hash(datasetId, organizationName, matchType, confidenceScore, coverage,
                relationshipSource, sourceRiskKeyword);
    }

    @Override
    public String toString() {
        return "DatasetMatch{" +
                "dataset='" + datasetName + '\'' +
                ", organization='" + organizationName + '\'' +
                ", type=" + matchType +
                ", confidence=" + confidenceScore +
                ", coverage=" + coverage +
                ", source=" + relationshipSource +
                '}';
    }

    public static class Builder {
        private String datasetId;
        private String datasetName;
        private String organizationName;
        private MatchType matchType;
        private double confidenceScore;
        private double coverage;
        private String category;
        private RelationshipSource relationshipSource = RelationshipSource.DIRECT;
        private String sourceRiskKeyword;
        private Double boostApplied;
        private String matchedVariant;
        private QualityMetrics qualityMetrics;
        private Double geographicBoost;

        public Builder datasetId(String datasetId) {
            this.datasetId = datasetId;
            return this;
        }

        public Builder datasetName(String datasetName) {
            this.datasetName = datasetName;
            return this;
        }

        public Builder organizationName(String organizationName) {
            this.organizationName = organizationName;
            return this;
        }

        public Builder matchType(MatchType matchType) {
            this.matchType = matchType;
            return this;
        }

        public Builder confidenceScore(double confidenceScore) {
            this.confidenceScore = confidenceScore;
            return this;
        }

        public Builder coverage(double coverage) {
            this.coverage = coverage;
            return this;
        }

        public Builder category(String category) {
            this.category = category;
            return this;
        }

        public Builder relationshipSource(RelationshipSource relationshipSource) {
            this.relationshipSource = relationshipSource;
            return this;
        }

        public Builder sourceRiskKeyword(String sourceRiskKeyword) {
            this.sourceRiskKeyword = sourceRiskKeyword;
            return this;
        }

        public Builder boostApplied(Double boostApplied) {
            this.boostApplied = boostApplied;
            return this;
        }

        public Builder matchedVariant(String matchedVariant) {
            this.matchedVariant = matchedVariant;
            return this;
        }

        public Builder qualityMetrics(QualityMetrics qualityMetrics) {
            this.qualityMetrics = qualityMetrics;
            return this;
        }

        public Builder geographicBoost(Double geographicBoost) {
            this.geographicBoost = geographicBoost;
            return this;
        }

        public DatasetMatch build() {
            Objects.requireNonNull(organizationName, "organizationName is required");
            Objects.requireNonNull(matchType, "matchType is required");
            Objects.requireNonNull(relationshipSource, "relationshipSource is required");
            if (confidenceScore < 0.0 || confidenceScore > 1.0) {
                throw new IllegalArgumentException("confidenceScore must be between 0.0 and 1.0");
            }
            if (coverage < 0.0 || coverage > 1.0) {
                throw new IllegalArgumentException("coverage must be between 0.0 and 1.0");
            }
            return new DatasetMatch(this);
        }
    }
}
