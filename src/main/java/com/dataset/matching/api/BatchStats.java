package com.dataset.matching.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Aggregate figures of a batch. {@code totalProcessed} counts items that ran, whether they
 * succeeded or failed; cancelled items are counted separately.
 */
public record BatchStats(@JsonProperty("total_items") int totalItems,
                         @JsonProperty("total_processed") int totalProcessed,
                         @JsonProperty("success_count") int successCount,
                         @JsonProperty("failure_count") int failureCount,
                         @JsonProperty("cancelled_count") int cancelledCount,
                         @JsonProperty("cache_hits") int cacheHits,
                         @JsonProperty("cache_misses") int cacheMisses,
                         @JsonProperty("total_matches") int totalMatches,
                         @JsonProperty("store_queries") int storeQueries,
                         @JsonProperty("average_item_time_ms") double averageItemTimeMs,
                         @JsonProperty("total_time_ms") long totalTimeMs) {
}
