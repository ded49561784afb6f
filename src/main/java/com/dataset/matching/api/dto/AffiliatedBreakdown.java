package com.dataset.matching.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-company summary of the affiliated matching run.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AffiliatedBreakdown(
        @JsonProperty("company_name") String companyName,
        @JsonProperty("risk_keyword") String riskKeyword,
        @JsonProperty("relationship_type") String relationshipType,
        @JsonProperty("match_count") int matchCount,
        @JsonProperty("has_matches") boolean hasMatches,
        @JsonProperty("top_confidence") double topConfidence
) {
}
