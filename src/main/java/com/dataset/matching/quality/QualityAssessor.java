package com.dataset.matching.quality;

import com.dataset.matching.core.model.DatasetMatch;
import com.dataset.matching.core.model.MatchType;
import com.dataset.matching.core.model.QualityMetrics;
import com.dataset.matching.rules.NameNormalizer;
import com.dataset.matching.rules.SearchVariant;
import com.dataset.matching.similarity.TextRatios;

import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Filters, ranks and truncates scored matches.
 *
 * <p>Order: confidence descending, coverage descending, organization name ascending,
 * dataset name ascending. The order is total, so identical inputs always rank identically.</p>
 */
public class QualityAssessor {

    /** Upper bound on returned matches whatever the caller asks for. */
    public static final int MAX_RESULTS_CAP = 100;

    public static final Comparator<DatasetMatch> RANKING = Comparator
            .comparingDouble(DatasetMatch::getConfidenceScore).reversed()
            .thenComparing(Comparator.comparingDouble(DatasetMatch::getCoverage).reversed())
            .thenComparing(DatasetMatch::getOrganizationName)
            .thenComparing(match -> match.getDatasetName() != null ? match.getDatasetName() : "");

    private final NameNormalizer normalizer;

    public QualityAssessor(NameNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    /**
     * @param matches       scored matches in any order
     * @param minConfidence matches below this are dropped
     * @param maxResults    requested result count, capped at {@link #MAX_RESULTS_CAP}
     * @param matchTypes    types to keep; empty keeps all
     */
    public List<DatasetMatch> assess(List<DatasetMatch> matches, double minConfidence, int maxResults,
                                     Set<MatchType> matchTypes) {
        int limit = Math.max(1, Math.min(maxResults, MAX_RESULTS_CAP));
        return matches.stream()
                .filter(match -> match.getConfidenceScore() >= minConfidence)
                .filter(match -> matchTypes.isEmpty() || matchTypes.contains(match.getMatchType()))
                .sorted(RANKING)
                .limit(limit)
                .toList();
    }

    /**
     * Advisory figures for display. Never used to filter or rank.
     */
    public QualityMetrics metrics(SearchVariant query, String organizationName, double coverage) {
        String candidate = normalizer.normalize(organizationName);
        return new QualityMetrics(
                normalizer.specificity(query.text()),
                TextRatios.lengthRatio(query.normalized(), candidate),
                TextRatios.wordCountRatio(query.normalized(), candidate),
                coverage);
    }
}
