package com.dataset.matching.api;

import com.dataset.matching.core.model.DatasetMatch;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Result of one batch item, in input order.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BatchItemResult(@JsonProperty("index") int index,
                              @JsonProperty("entity") String entity,
                              @JsonProperty("status") Status status,
                              @JsonProperty("matches") List<DatasetMatch> matches,
                              @JsonProperty("cache_hit") boolean cacheHit,
                              @JsonProperty("degraded") boolean degraded,
                              @JsonProperty("store_queries") int storeQueries,
                              @JsonProperty("processing_time_ms") long processingTimeMs,
                              @JsonProperty("error_code") String errorCode,
                              @JsonProperty("error_message") String errorMessage) {

    public enum Status { SUCCESS, FAILED, CANCELLED }

    public BatchItemResult {
        matches = matches != null ? List.copyOf(matches) : List.of();
    }

    static BatchItemResult success(int index, String entity, MatchOutcome outcome) {
        return new BatchItemResult(index, entity, Status.SUCCESS, outcome.matches(), outcome.cacheHit(),
                outcome.degraded(), outcome.storeQueries(), outcome.processingTimeMs(), null, null);
    }

    static BatchItemResult failure(int index, String entity, String code, String message, long processingTimeMs) {
        return new BatchItemResult(index, entity, Status.FAILED, List.of(), false, false, 0, processingTimeMs,
                code, message);
    }

    static BatchItemResult cancelled(int index, String entity) {
        return new BatchItemResult(index, entity, Status.CANCELLED, List.of(), false, false, 0, 0,
                null, null);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }
}
