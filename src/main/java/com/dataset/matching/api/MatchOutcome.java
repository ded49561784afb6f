package com.dataset.matching.api;

import com.dataset.matching.core.model.DatasetMatch;

import java.util.List;

/**
 * Result of running one query through the pipeline.
 *
 * @param matches          ranked matches, possibly empty
 * @param cacheHit         whether the matches came from the cache
 * @param degraded         whether the store was unavailable and the result is empty for that reason
 * @param diagnostics      human-readable notes on skipped rows, store failures or skipped queries
 * @param storeQueries     store calls issued for this query
 * @param processingTimeMs wall time spent in the pipeline
 */
public record MatchOutcome(List<DatasetMatch> matches,
                           boolean cacheHit,
                           boolean degraded,
                           List<String> diagnostics,
                           int storeQueries,
                           long processingTimeMs) {

    public MatchOutcome {
        matches = List.copyOf(matches);
        diagnostics = diagnostics != null ? List.copyOf(diagnostics) : List.of();
    }

    public boolean hasMatches() {
        return !matches.isEmpty();
    }
}
