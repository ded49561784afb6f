package com.dataset.matching.api;

/**
 * The single-query matching capability used by batch and affiliated fan-out.
 */
@FunctionalInterface
public interface MatchPipeline {

    /**
     * @throws InputValidationException if the query is structurally invalid
     */
    MatchOutcome match(MatchQuery query);
}
