package com.dataset.matching.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Context supplied with a query. A {@code location} naming a known country adjusts confidence
 * by geographic proximity; the note is carried into logs only.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record MatchContext(@JsonProperty("location") String location,
                           @JsonProperty("note") String note) {
}
