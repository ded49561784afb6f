package com.dataset.matching.similarity;

import com.dataset.matching.core.model.MatchType;
import com.dataset.matching.rules.NameNormalizer;
import com.dataset.matching.rules.SearchVariant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;

/**
 * Computes similarity signals and the per-match-type confidence and coverage figures.
 *
 * <p>Confidence formulas live in a table keyed by {@link MatchType}; the constructor
 * refuses to start if a match type has no formula.</p>
 */
public class SimilarityScorer {
    private static final Logger log = LoggerFactory.getLogger(SimilarityScorer.class);

    /** Confidence for a candidate whose type has no formula. */
    public static final double UNCLASSIFIED_CONFIDENCE = 0.3;

    @FunctionalInterface
    interface ConfidenceFormula {
        double apply(SearchVariant query, PreparedCandidate candidate, SimilarityProfile profile);
    }

    private final NameNormalizer normalizer;
    private final SimilarityAlgorithm jaroWinkler;
    private final SimilarityAlgorithm levenshtein;
    private final SimilarityAlgorithm nGram;
    private final Map<MatchType, ConfidenceFormula> confidenceFormulas;

    public SimilarityScorer(NameNormalizer normalizer) {
        this(normalizer, new JaroWinklerSimilarity(), new LevenshteinSimilarity(), new NGramJaccardSimilarity(2));
    }

    public SimilarityScorer(NameNormalizer normalizer,
                            SimilarityAlgorithm jaroWinkler,
                            SimilarityAlgorithm levenshtein,
                            SimilarityAlgorithm nGram) {
        this.normalizer = normalizer;
        this.jaroWinkler = jaroWinkler;
        this.levenshtein = levenshtein;
        this.nGram = nGram;
        this.confidenceFormulas = buildConfidenceTable();
    }

    public SimilarityProfile profile(String normalized1, String normalized2) {
        return new SimilarityProfile(
                jaroWinkler.compute(normalized1, normalized2),
                levenshtein.compute(normalized1, normalized2),
                nGram.compute(normalized1, normalized2));
    }

    public double jaroWinkler(String s1, String s2) {
        return jaroWinkler.compute(s1, s2);
    }

    public double wordOverlap(String s1, String s2) {
        return normalizer.wordOverlap(s1, s2);
    }

    public double confidence(MatchType type, SearchVariant query, PreparedCandidate candidate, SimilarityProfile profile) {
        ConfidenceFormula formula = confidenceFormulas.get(type);
        double value = formula != null ? formula.apply(query, candidate, profile) : UNCLASSIFIED_CONFIDENCE;
        return clamp(value);
    }

    public double coverage(MatchType type, SearchVariant query, PreparedCandidate candidate, SimilarityProfile profile) {
        String name = candidate.entity().organizationName();
        double value = switch (type) {
            case EXACT -> query.text().trim().equals(name) ? 1.0 : 0.9;
            case ALIAS -> candidate.normalizedName().contains(query.normalized()) ? 0.95 : 0.85;
            case ALIAS_PARTIAL, CORE_MATCH -> wordOverlap(query.text(), name);
            case FUZZY, PARTIAL -> Math.max(profile.jaroWinkler(), Math.max(
                    wordOverlap(query.text(), name),
                    TextRatios.containment(query.normalized(), candidate.normalizedName())));
        };
        return clamp(value);
    }

    private Map<MatchType, ConfidenceFormula> buildConfidenceTable() {
        Map<MatchType, ConfidenceFormula> table = new EnumMap<>(MatchType.class);
        table.put(MatchType.EXACT, (query, candidate, profile) -> 1.0);
        table.put(MatchType.ALIAS, (query, candidate, profile) -> Math.min(0.95,
                candidate.normalizedAliases().stream()
                        .mapToDouble(alias -> jaroWinkler(query.normalized(), alias))
                        .max()
                        .orElse(0.9)));
        table.put(MatchType.ALIAS_PARTIAL, (query, candidate, profile) -> 0.8);
        table.put(MatchType.CORE_MATCH, (query, candidate, profile) ->
                jaroWinkler(query.core(), candidate.coreName()) * 0.85);
        table.put(MatchType.FUZZY, (query, candidate, profile) ->
                (0.5 * profile.jaroWinkler() + 0.3 * profile.levenshtein() + 0.2 * profile.nGram()) * 0.8);
        table.put(MatchType.PARTIAL, (query, candidate, profile) -> Math.max(
                wordOverlap(query.text(), candidate.entity().organizationName()),
                TextRatios.containment(query.normalized(), candidate.normalizedName())) * 0.6);

        for (MatchType type : MatchType.values()) {
            if (!table.containsKey(type)) {
                throw new IllegalStateException("No confidence formula for match type " + type);
            }
        }
        log.debug("Confidence table initialized for {} match types", table.size());
        return table;
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
