package com.dataset.matching.cache;

import com.dataset.matching.core.model.MatchType;

import java.util.List;
import java.util.Set;

/**
 * Identity of a cached query: the normalized entity, its sorted normalized aliases, the
 * options that change the result and the canonical country of the search location
 * ({@code null} when none was given or it could not be resolved). {@code forceRefresh} and
 * the affiliated boost are not part of the key.
 */
public record CacheKey(String normalizedEntity,
                       List<String> sortedAliases,
                       double minConfidence,
                       int maxResults,
                       Set<MatchType> matchTypes,
                       String location) {

    public CacheKey {
        sortedAliases = sortedAliases != null ? sortedAliases.stream().sorted().distinct().toList() : List.of();
        matchTypes = matchTypes != null ? Set.copyOf(matchTypes) : Set.of();
    }

    public CacheKey(String normalizedEntity, List<String> sortedAliases, double minConfidence, int maxResults,
                    Set<MatchType> matchTypes) {
        this(normalizedEntity, sortedAliases, minConfidence, maxResults, matchTypes, null);
    }
}
