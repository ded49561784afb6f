package com.dataset.matching.api.dto;

import com.dataset.matching.core.model.DatasetMatch;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Response DTO for a match request.
 *
 * <p>{@code success=false} is reserved for structurally invalid requests; a request that
 * found nothing, or ran against an unavailable store, is still successful.</p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"success", "direct_matches", "affiliated_matches", "affiliated_breakdown",
        "match_summary", "metadata", "error"})
public record MatchResponse(
        @JsonProperty("success") boolean success,
        @JsonProperty("direct_matches") List<DatasetMatch> directMatches,
        @JsonProperty("affiliated_matches") Map<String, List<DatasetMatch>> affiliatedMatches,
        @JsonProperty("affiliated_breakdown") List<AffiliatedBreakdown> affiliatedBreakdown,
        @JsonProperty("match_summary") MatchSummary matchSummary,
        @JsonProperty("metadata") ResponseMetadata metadata,
        @JsonProperty("error") ErrorInfo error
) {
    public MatchResponse {
        directMatches = directMatches != null ? List.copyOf(directMatches) : List.of();
        affiliatedMatches = affiliatedMatches != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(affiliatedMatches))
                : Map.of();
        affiliatedBreakdown = affiliatedBreakdown != null ? List.copyOf(affiliatedBreakdown) : List.of();
    }

    public static MatchResponse failure(String code, String message, long processingTimeMs) {
        return new MatchResponse(false, List.of(), Map.of(), List.of(), MatchSummary.empty(),
                ResponseMetadata.of(processingTimeMs), new ErrorInfo(code, message));
    }
}
