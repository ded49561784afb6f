package com.dataset.matching.api;

import com.dataset.matching.cache.CacheKey;
import com.dataset.matching.cache.MatchCache;
import com.dataset.matching.core.model.DatasetMatch;
import com.dataset.matching.core.model.ReferenceEntity;
import com.dataset.matching.geo.CountryMatch;
import com.dataset.matching.geo.CountryNormalizer;
import com.dataset.matching.geo.GeographicConfig;
import com.dataset.matching.geo.GeographicRelationship;
import com.dataset.matching.logging.LogContext;
import com.dataset.matching.metrics.MetricsService;
import com.dataset.matching.quality.QualityAssessor;
import com.dataset.matching.retrieval.CandidateRetriever;
import com.dataset.matching.retrieval.RetrievalResult;
import com.dataset.matching.rules.NameNormalizer;
import com.dataset.matching.rules.SearchVariant;
import com.dataset.matching.similarity.Classification;
import com.dataset.matching.similarity.MatchTypeClassifier;
import com.dataset.matching.similarity.PreparedCandidate;
import com.dataset.matching.store.StoreUnavailableException;
import com.dataset.matching.tracing.Span;
import com.dataset.matching.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * The single-query matching pipeline: normalize, consult the cache, retrieve candidates,
 * classify and score them, then filter and rank.
 *
 * <p>Only {@link InputValidationException} escapes. A store outage yields an empty,
 * {@code degraded} outcome that is not cached.</p>
 *
 * <p>When the query context names a recognizable country, each candidate's confidence is
 * multiplied by the {@link GeographicConfig} factor for its countries and capped at 1.0,
 * before filtering and ranking.</p>
 */
public class DatasetMatchingService implements MatchPipeline {
    private static final Logger log = LoggerFactory.getLogger(DatasetMatchingService.class);

    private final NameNormalizer normalizer;
    private final CandidateRetriever retriever;
    private final MatchTypeClassifier classifier;
    private final QualityAssessor qualityAssessor;
    private final MatchCache cache;
    private final MetricsService metricsService;
    private final TracingService tracingService;
    private final CountryNormalizer countryNormalizer;
    private final GeographicConfig geographicConfig;

    public DatasetMatchingService(NameNormalizer normalizer,
                                  CandidateRetriever retriever,
                                  MatchTypeClassifier classifier,
                                  QualityAssessor qualityAssessor,
                                  MatchCache cache,
                                  MetricsService metricsService,
                                  TracingService tracingService) {
        this(normalizer, retriever, classifier, qualityAssessor, cache, metricsService, tracingService,
                CountryNormalizer.loadDefault(), GeographicConfig.defaults());
    }

    public DatasetMatchingService(NameNormalizer normalizer,
                                  CandidateRetriever retriever,
                                  MatchTypeClassifier classifier,
                                  QualityAssessor qualityAssessor,
                                  MatchCache cache,
                                  MetricsService metricsService,
                                  TracingService tracingService,
                                  CountryNormalizer countryNormalizer,
                                  GeographicConfig geographicConfig) {
        this.normalizer = normalizer;
        this.retriever = retriever;
        this.classifier = classifier;
        this.qualityAssessor = qualityAssessor;
        this.cache = cache;
        this.metricsService = metricsService;
        this.tracingService = tracingService;
        this.countryNormalizer = countryNormalizer;
        this.geographicConfig = geographicConfig;
    }

    @Override
    public MatchOutcome match(MatchQuery query) {
        try {
            InputSanitizer.validate(query);
        } catch (InputValidationException e) {
            metricsService.incrementValidationFailure();
            throw e;
        }

        long start = System.nanoTime();
        String entity = query.entity().trim();
        MatchOptions options = query.options();

        try (LogContext ctx = LogContext.forQuery(LogContext.generateCorrelationId());
             Span span = tracingService.startSpan("match.query", Map.of("entity", entity))) {
            if (query.context() != null && query.context().location() != null) {
                ctx.with("location", query.context().location());
            }

            if (normalizer.shouldSkip(entity) && query.aliases().isEmpty()) {
                log.info("match.skipped entity='{}' reason=generic-or-too-short", entity);
                span.setStatus(Span.SpanStatus.OK);
                return new MatchOutcome(List.of(), false, false,
                        List.of("query skipped: too short or only generic terms"), 0, elapsedMs(start));
            }

            List<SearchVariant> variants = normalizer.searchVariants(entity, query.aliases());
            String location = resolveLocation(query.context());
            CacheKey key = cacheKey(variants, query, location);

            AtomicReference<PipelineRun> computed = new AtomicReference<>();
            List<DatasetMatch> matches;
            if (options.isForceRefresh()) {
                PipelineRun run = run(variants, options, location);
                computed.set(run);
                if (!run.degraded()) {
                    cache.put(key, run.matches());
                }
                matches = run.matches();
            } else {
                matches = cache.get(key, k -> {
                    PipelineRun run = run(variants, options, location);
                    computed.set(run);
                    return run.degraded() ? null : run.matches();
                });
                if (matches == null && computed.get() == null) {
                    // waited on another caller's load that ended degraded
                    computed.set(run(variants, options, location));
                }
            }

            PipelineRun run = computed.get();
            boolean cacheHit = run == null;
            if (cacheHit) {
                metricsService.recordCacheHit();
            } else {
                metricsService.recordCacheMiss();
                matches = run.matches();
            }

            long elapsed = elapsedMs(start);
            metricsService.recordMatchDuration(Duration.ofMillis(elapsed), cacheHit);
            span.setAttribute("matches", matches.size());
            span.setAttribute("cacheHit", String.valueOf(cacheHit));
            span.setStatus(run != null && run.degraded() ? Span.SpanStatus.ERROR : Span.SpanStatus.OK);

            log.info("match.completed entity='{}' variants={} matches={} cacheHit={} timeMs={}",
                    entity, variants.size(), matches.size(), cacheHit, elapsed);
            return new MatchOutcome(matches, cacheHit,
                    run != null && run.degraded(),
                    run != null ? run.diagnostics() : List.of(),
                    run != null ? run.storeQueries() : 0,
                    elapsed);
        }
    }

    private String resolveLocation(MatchContext context) {
        if (!geographicConfig.enabled() || context == null || context.location() == null) {
            return null;
        }
        Optional<CountryMatch> match = countryNormalizer.normalize(context.location());
        if (match.isEmpty()) {
            log.debug("match.location unresolved location='{}'", context.location());
            return null;
        }
        return match.get().canonical();
    }

    private PipelineRun run(List<SearchVariant> variants, MatchOptions options, String location) {
        AtomicInteger storeQueries = new AtomicInteger();
        RetrievalResult retrieval;
        try {
            retrieval = retriever.retrieve(variants, storeQueries);
        } catch (StoreUnavailableException e) {
            log.warn("match.degraded reason='{}'", e.getMessage());
            return new PipelineRun(List.of(), true, List.of("store unavailable: " + e.getMessage()),
                    storeQueries.get());
        }

        List<DatasetMatch> scored = new ArrayList<>(retrieval.candidates().size());
        Map<DatasetMatch, SearchVariant> matchedVariants = new IdentityHashMap<>();
        for (ReferenceEntity entity : retrieval.candidates()) {
            PreparedCandidate candidate = PreparedCandidate.of(entity, normalizer);
            classifier.classifyBest(variants, candidate).ifPresent(classification -> {
                DatasetMatch match = toMatch(classification, candidate, retrieval, location);
                matchedVariants.put(match, classification.variant());
                scored.add(match);
            });
        }

        List<DatasetMatch> ranked = qualityAssessor.assess(scored, options.getMinConfidence(),
                options.getMaxResults(), options.getMatchTypes()).stream()
                .map(match -> match.toBuilder()
                        .qualityMetrics(qualityAssessor.metrics(matchedVariants.get(match),
                                match.getOrganizationName(), match.getCoverage()))
                        .build())
                .toList();
        ranked.forEach(match -> {
            metricsService.incrementMatchType(match.getMatchType());
            metricsService.recordConfidence(match.getConfidenceScore());
        });

        List<String> diagnostics = new ArrayList<>();
        if (retrieval.skippedRows() > 0) {
            diagnostics.add(retrieval.skippedRows() + " malformed reference rows skipped");
        }
        if (retrieval.widened()) {
            diagnostics.add("no exact or alias candidates, candidate window searched");
        }
        log.debug("pipeline.scored candidates={} classified={} returned={}",
                retrieval.candidates().size(), scored.size(), ranked.size());
        return new PipelineRun(ranked, false, diagnostics, storeQueries.get());
    }

    private DatasetMatch toMatch(Classification classification, PreparedCandidate candidate,
                                 RetrievalResult retrieval, String location) {
        ReferenceEntity entity = candidate.entity();
        double confidence = classification.confidence();
        Double geographicBoost = null;
        if (location != null) {
            GeographicRelationship relationship = countryNormalizer.relationship(location, entity.countries());
            geographicBoost = geographicConfig.factor(relationship);
            confidence = Math.min(1.0, confidence * geographicBoost);
        }
        return DatasetMatch.builder()
                .datasetId(entity.datasetId())
                .datasetName(retrieval.datasetName(entity.datasetId()))
                .organizationName(entity.organizationName())
                .matchType(classification.matchType())
                .confidenceScore(confidence)
                .coverage(classification.coverage())
                .category(entity.category())
                .matchedVariant(classification.variant().text())
                .geographicBoost(geographicBoost)
                .build();
    }

    private CacheKey cacheKey(List<SearchVariant> variants, MatchQuery query, String location) {
        List<String> aliases = variants.stream()
                .filter(variant -> variant.kind() == SearchVariant.Kind.ALIAS)
                .map(SearchVariant::normalized)
                .toList();
        String entityKey = variants.stream()
                .filter(variant -> variant.kind() != SearchVariant.Kind.ALIAS)
                .map(SearchVariant::normalized)
                .collect(Collectors.joining("|"));
        MatchOptions options = query.options();
        return new CacheKey(entityKey, aliases, options.getMinConfidence(), options.getMaxResults(),
                options.getMatchTypes(), location);
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    private record PipelineRun(List<DatasetMatch> matches, boolean degraded, List<String> diagnostics,
                               int storeQueries) {
    }
}
