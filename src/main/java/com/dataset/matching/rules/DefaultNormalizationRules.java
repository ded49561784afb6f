package com.dataset.matching.rules;

import java.util.List;

/**
 * Built-in rules for organization names.
 */
public final class DefaultNormalizationRules {

    private DefaultNormalizationRules() {
        // Utility class
    }

    public static NormalizationEngine createDefaultEngine() {
        NormalizationEngine engine = new NormalizationEngine();
        engine.addRules(getCleanupRules());
        engine.addRules(getCoreRules());
        return engine;
    }

    /**
     * Rules producing the normalized form. All words survive; only bracketed qualifiers,
     * punctuation and symbols are removed.
     */
    public static List<NormalizationRule> getCleanupRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("parenthetical")
                        .pattern("\\s*[(\\[][^)\\]]*[)\\]]")
                        .replacement(" ")
                        .priority(10)
                        .build(),

                NormalizationRule.builder()
                        .name("ampersand")
                        .pattern("\\s*&\\s*")
                        .replacement(" and ")
                        .priority(20)
                        .build(),

                NormalizationRule.builder()
                        .name("apostrophe")
                        .pattern("['’`]")
                        .replacement("")
                        .priority(30)
                        .build(),

                NormalizationRule.builder()
                        .name("punctuation")
                        .pattern("[^\\p{L}\\p{N}\\s]+")
                        .replacement(" ")
                        .priority(40)
                        .build()
        );
    }

    /**
     * Rules producing the core form: organizational and legal terms that say nothing about
     * which organization is meant.
     */
    public static List<NormalizationRule> getCoreRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("core-leading-the")
                        .pattern("^the\\b")
                        .stage(NormalizationStage.CORE)
                        .priority(10)
                        .build(),

                NormalizationRule.builder()
                        .name("core-institution-prefix")
                        .pattern("\\b(university of|institute of|center for|centre for|academy of)\\b")
                        .stage(NormalizationStage.CORE)
                        .priority(20)
                        .build(),

                NormalizationRule.builder()
                        .name("core-legal-suffix")
                        .pattern("\\b(inc|incorporated|ltd|limited|llc|l l c|corp|corporation|company|co"
                                + "|plc|gmbh|ag|sa|bv|nv|pty|pte)\\b")
                        .stage(NormalizationStage.CORE)
                        .priority(30)
                        .build(),

                NormalizationRule.builder()
                        .name("core-organizational-term")
                        .pattern("\\b(group|holdings|enterprises|international|global|university|institute)\\b")
                        .stage(NormalizationStage.CORE)
                        .priority(40)
                        .build()
        );
    }
}
