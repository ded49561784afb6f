package com.dataset.matching.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Outcome of a batch: one result per input item, in input order, plus aggregate stats.
 */
public record BatchResult(@JsonProperty("batch_id") String batchId,
                          @JsonProperty("results") List<BatchItemResult> results,
                          @JsonProperty("stats") BatchStats stats,
                          @JsonProperty("cancelled") boolean cancelled) {

    public BatchResult {
        results = List.copyOf(results);
    }
}
