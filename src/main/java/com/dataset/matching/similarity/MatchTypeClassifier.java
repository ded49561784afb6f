package com.dataset.matching.similarity;

import com.dataset.matching.core.model.MatchType;
import com.dataset.matching.rules.SearchVariant;

import java.util.List;
import java.util.Optional;

/**
 * Assigns a {@link MatchType} to a candidate using a fixed precedence: the first type,
 * in declaration order, whose rule holds wins. Candidates for which no rule holds are dropped.
 */
public class MatchTypeClassifier {

    private static final double FUZZY_THRESHOLD = 0.8;
    private static final double FUZZY_NGRAM_THRESHOLD = 0.7;
    private static final double PARTIAL_THRESHOLD = 0.3;
    private static final int MIN_CORE_LENGTH = 4;

    private final SimilarityScorer scorer;

    public MatchTypeClassifier(SimilarityScorer scorer) {
        this.scorer = scorer;
    }

    /**
     * Classifies the candidate against a single query variant.
     */
    public Optional<Classification> classify(SearchVariant query, PreparedCandidate candidate) {
        SimilarityProfile profile = scorer.profile(query.normalized(), candidate.normalizedName());
        for (MatchType type : MatchType.values()) {
            if (holds(type, query, candidate, profile)) {
                return Optional.of(new Classification(type,
                        scorer.confidence(type, query, candidate, profile),
                        scorer.coverage(type, query, candidate, profile),
                        query));
            }
        }
        return Optional.empty();
    }

    /**
     * Classifies the candidate against every variant and keeps the strongest result:
     * highest confidence, then higher-precedence type, then earlier variant.
     */
    public Optional<Classification> classifyBest(List<SearchVariant> variants, PreparedCandidate candidate) {
        Classification best = null;
        for (SearchVariant variant : variants) {
            Optional<Classification> result = classify(variant, candidate);
            if (result.isEmpty()) {
                continue;
            }
            Classification current = result.get();
            if (best == null
                    || current.confidence() > best.confidence()
                    || (current.confidence() == best.confidence()
                    && current.matchType().ordinal() < best.matchType().ordinal())) {
                best = current;
            }
        }
        return Optional.ofNullable(best);
    }

    private boolean holds(MatchType type, SearchVariant query, PreparedCandidate candidate, SimilarityProfile profile) {
        String q = query.normalized();
        return switch (type) {
            case EXACT -> q.equals(candidate.normalizedName());
            case ALIAS -> candidate.normalizedAliases().contains(q);
            case ALIAS_PARTIAL -> candidate.normalizedAliases().stream()
                    .anyMatch(alias -> alias.contains(q) || q.contains(alias));
            case CORE_MATCH -> query.core().length() >= MIN_CORE_LENGTH
                    && query.core().equals(candidate.coreName());
            case FUZZY -> profile.jaroWinkler() > FUZZY_THRESHOLD
                    || profile.levenshtein() > FUZZY_THRESHOLD
                    || profile.nGram() > FUZZY_NGRAM_THRESHOLD;
            case PARTIAL -> TextRatios.containment(q, candidate.normalizedName()) > 0.0
                    || profile.max() > PARTIAL_THRESHOLD;
        };
    }
}
