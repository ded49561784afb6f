package com.dataset.matching.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Advisory quality figures attached to a match for display. They never influence
 * classification, filtering or ranking.
 */
public record QualityMetrics(
        @JsonProperty("specificity") double specificity,
        @JsonProperty("length_ratio") double lengthRatio,
        @JsonProperty("word_count_ratio") double wordCountRatio,
        @JsonProperty("coverage") double coverage) {
}
