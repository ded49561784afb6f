package com.dataset.matching.api;

import com.dataset.matching.api.dto.AffiliatedBreakdown;
import com.dataset.matching.core.model.DatasetMatch;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Boosted matches of the affiliated companies, keyed by company name in request order.
 *
 * @param matches               matches per company; companies without matches map to an empty list
 * @param breakdown             one entry per company considered
 * @param entitiesConsidered    distinct companies run through the pipeline
 * @param entitiesMatched       companies with at least one match
 * @param totalMatches          sum of all affiliated matches
 * @param highConfidenceMatches affiliated matches at or above the high-confidence threshold
 * @param averageConfidence     mean boosted confidence over all affiliated matches, 0 when none
 */
public record AffiliatedOutcome(Map<String, List<DatasetMatch>> matches,
                                List<AffiliatedBreakdown> breakdown,
                                int entitiesConsidered,
                                int entitiesMatched,
                                int totalMatches,
                                int highConfidenceMatches,
                                double averageConfidence) {

    public AffiliatedOutcome {
        matches = Collections.unmodifiableMap(new LinkedHashMap<>(matches));
        breakdown = List.copyOf(breakdown);
    }

    public static AffiliatedOutcome empty() {
        return new AffiliatedOutcome(Map.of(), List.of(), 0, 0, 0, 0, 0.0);
    }

    public List<DatasetMatch> allMatches() {
        return matches.values().stream().flatMap(List::stream).toList();
    }
}
