package com.dataset.matching.similarity;

import com.dataset.matching.core.model.MatchType;
import com.dataset.matching.rules.SearchVariant;

/**
 * Outcome of classifying one candidate: its match type, scores and the query variant
 * that produced them.
 */
public record Classification(MatchType matchType, double confidence, double coverage, SearchVariant variant) {
}
