package com.dataset.matching.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Aggregate counts over the direct and affiliated matches of one response.
 * {@code highConfidenceMatches} and {@code averageConfidence} cover both groups.
 */
public record MatchSummary(
        @JsonProperty("total_affiliated_entities") int totalAffiliatedEntities,
        @JsonProperty("matched_affiliated_entities") int matchedAffiliatedEntities,
        @JsonProperty("total_direct_matches") int totalDirectMatches,
        @JsonProperty("total_affiliated_matches") int totalAffiliatedMatches,
        @JsonProperty("high_confidence_matches") int highConfidenceMatches,
        @JsonProperty("average_confidence") double averageConfidence
) {
    public static MatchSummary empty() {
        return new MatchSummary(0, 0, 0, 0, 0, 0.0);
    }
}
