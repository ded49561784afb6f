package com.dataset.matching.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Error payload of a failed response.
 */
public record ErrorInfo(
        @JsonProperty("code") String code,
        @JsonProperty("message") String message
) {
}
