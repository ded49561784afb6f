package com.dataset.matching.api;

import com.dataset.matching.api.dto.AffiliatedBreakdown;
import com.dataset.matching.api.dto.AffiliatedCompany;
import com.dataset.matching.core.model.DatasetMatch;
import com.dataset.matching.logging.LogContext;
import com.dataset.matching.tracing.NoOpTracingService;
import com.dataset.matching.tracing.Span;
import com.dataset.matching.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Matches the companies affiliated with a queried entity and boosts their confidence.
 *
 * <p>Each distinct company runs through the {@link MatchPipeline} on its own, with half the
 * caller's result budget. Confidence becomes {@code min(1.0, confidence * boost)} and the
 * match is tagged {@code affiliated_company}. A company whose pipeline run fails contributes
 * no matches.</p>
 */
public class AffiliatedBooster implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(AffiliatedBooster.class);

    public static final int DEFAULT_PARALLELISM = 4;
    public static final double DEFAULT_HIGH_CONFIDENCE_THRESHOLD = 0.8;

    private final MatchPipeline pipeline;
    private final ExecutorService executor;
    private final double highConfidenceThreshold;
    private final TracingService tracingService;

    public AffiliatedBooster(MatchPipeline pipeline) {
        this(pipeline, DEFAULT_PARALLELISM, DEFAULT_HIGH_CONFIDENCE_THRESHOLD, new NoOpTracingService());
    }

    public AffiliatedBooster(MatchPipeline pipeline, int parallelism, double highConfidenceThreshold,
                             TracingService tracingService) {
        if (parallelism <= 0) {
            throw new IllegalArgumentException("parallelism must be > 0");
        }
        if (highConfidenceThreshold < 0.0 || highConfidenceThreshold > 1.0) {
            throw new IllegalArgumentException("highConfidenceThreshold must be between 0.0 and 1.0");
        }
        this.pipeline = pipeline;
        this.executor = Executors.newFixedThreadPool(parallelism, BatchCoordinator.namedThreads("dataset-affiliated"));
        this.highConfidenceThreshold = highConfidenceThreshold;
        this.tracingService = tracingService;
    }

    /**
     * Runs every distinct affiliated company and aggregates the boosted matches.
     *
     * @param companies affiliated companies; blank names and case-insensitive duplicates are dropped
     * @param options   options of the parent query; boost, confidence floor and result budget come from here
     * @param context   context of the parent query
     */
    public AffiliatedOutcome boost(List<AffiliatedCompany> companies, MatchOptions options, MatchContext context) {
        List<AffiliatedCompany> distinct = deduplicate(companies);
        if (distinct.isEmpty()) {
            return AffiliatedOutcome.empty();
        }
        MatchOptions affiliatedOptions = options.toBuilder()
                .maxResults(Math.max(1, options.getMaxResults() / 2))
                .build();
        String correlationId = LogContext.generateCorrelationId();

        try (Span span = tracingService.startSpan("match.affiliated",
                Map.of("companies", String.valueOf(distinct.size())))) {
            List<CompletableFuture<List<DatasetMatch>>> futures = new ArrayList<>(distinct.size());
            for (AffiliatedCompany company : distinct) {
                futures.add(CompletableFuture.supplyAsync(
                        () -> matchCompany(correlationId, company, affiliatedOptions, context), executor));
            }

            Map<String, List<DatasetMatch>> matches = new LinkedHashMap<>();
            List<AffiliatedBreakdown> breakdown = new ArrayList<>(distinct.size());
            int matched = 0;
            int total = 0;
            int highConfidence = 0;
            double confidenceSum = 0.0;
            for (int i = 0; i < distinct.size(); i++) {
                AffiliatedCompany company = distinct.get(i);
                List<DatasetMatch> companyMatches = futures.get(i).join();
                matches.put(company.companyName().trim(), companyMatches);

                double top = 0.0;
                for (DatasetMatch match : companyMatches) {
                    double confidence = match.getConfidenceScore();
                    top = Math.max(top, confidence);
                    confidenceSum += confidence;
                    if (confidence >= highConfidenceThreshold) {
                        highConfidence++;
                    }
                }
                total += companyMatches.size();
                if (!companyMatches.isEmpty()) {
                    matched++;
                }
                breakdown.add(new AffiliatedBreakdown(company.companyName().trim(), company.riskKeyword(),
                        company.relationshipType(), companyMatches.size(), !companyMatches.isEmpty(), top));
            }

            double average = total == 0 ? 0.0 : confidenceSum / total;
            span.setAttribute("matches", total);
            span.setStatus(Span.SpanStatus.OK);
            log.info("affiliated.completed companies={} matched={} matches={} highConfidence={}",
                    distinct.size(), matched, total, highConfidence);
            return new AffiliatedOutcome(matches, breakdown, distinct.size(), matched, total, highConfidence, average);
        }
    }

    private List<DatasetMatch> matchCompany(String correlationId, AffiliatedCompany company,
                                            MatchOptions options, MatchContext context) {
        String name = company.companyName().trim();
        double boost = options.getAffiliatedBoost();
        try (LogContext ignored = LogContext.forAffiliated(correlationId, name)) {
            MatchOutcome outcome = pipeline.match(new MatchQuery(name, List.of(), context, options));
            return outcome.matches().stream()
                    .map(match -> match.toAffiliated(
                            boostedConfidence(match.getConfidenceScore(), boost), company.riskKeyword(), boost))
                    .filter(match -> match.getConfidenceScore() >= options.getMinConfidence())
                    .toList();
        } catch (RuntimeException e) {
            log.warn("affiliated.failed company='{}' reason={}", name, e.getMessage());
            return List.of();
        }
    }

    static double boostedConfidence(double confidence, double boost) {
        return Math.min(1.0, confidence * boost);
    }

    private static List<AffiliatedCompany> deduplicate(List<AffiliatedCompany> companies) {
        if (companies == null || companies.isEmpty()) {
            return List.of();
        }
        Map<String, AffiliatedCompany> distinct = new LinkedHashMap<>();
        for (AffiliatedCompany company : companies) {
            if (company == null || company.companyName() == null || company.companyName().isBlank()) {
                continue;
            }
            distinct.putIfAbsent(company.companyName().trim().toLowerCase(Locale.ROOT), company);
        }
        return List.copyOf(distinct.values());
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
