package com.dataset.matching.rules;

/**
 * Stage at which a {@link NormalizationRule} runs.
 * {@code CLEANUP} rules produce the normalized form; {@code CORE} rules run afterwards
 * on the normalized form to produce the core form.
 */
public enum NormalizationStage {
    CLEANUP,
    CORE
}
