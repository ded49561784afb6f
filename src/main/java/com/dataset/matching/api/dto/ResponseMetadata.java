package com.dataset.matching.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Processing details attached to every response.
 */
public record ResponseMetadata(
        @JsonProperty("processing_time_ms") long processingTimeMs,
        @JsonProperty("algorithm_version") String algorithmVersion,
        @JsonProperty("cache_used") boolean cacheUsed,
        @JsonProperty("degraded") boolean degraded,
        @JsonProperty("diagnostics") List<String> diagnostics
) {
    public static final String ALGORITHM_VERSION = "2.1.0";

    public ResponseMetadata {
        diagnostics = diagnostics != null ? List.copyOf(diagnostics) : List.of();
    }

    public static ResponseMetadata of(long processingTimeMs) {
        return new ResponseMetadata(processingTimeMs, ALGORITHM_VERSION, false, false, List.of());
    }
}
