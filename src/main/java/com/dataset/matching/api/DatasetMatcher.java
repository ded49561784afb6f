package com.dataset.matching.api;

import com.dataset.matching.api.dto.AffiliatedCompany;
import com.dataset.matching.api.dto.MatchRequest;
import com.dataset.matching.api.dto.MatchResponse;
import com.dataset.matching.api.dto.MatchSummary;
import com.dataset.matching.api.dto.ResponseMetadata;
import com.dataset.matching.cache.CacheStats;
import com.dataset.matching.cache.LruMatchCache;
import com.dataset.matching.cache.MatchCache;
import com.dataset.matching.cache.NoOpMatchCache;
import com.dataset.matching.core.model.DatasetMatch;
import com.dataset.matching.geo.CountryNormalizer;
import com.dataset.matching.health.HealthCheckRegistry;
import com.dataset.matching.health.HealthStatus;
import com.dataset.matching.health.MatchCacheHealthCheck;
import com.dataset.matching.health.ReferenceStoreHealthCheck;
import com.dataset.matching.metrics.MetricsService;
import com.dataset.matching.metrics.NoOpMetricsService;
import com.dataset.matching.quality.QualityAssessor;
import com.dataset.matching.retrieval.CandidateRetriever;
import com.dataset.matching.rules.DefaultNormalizationRules;
import com.dataset.matching.rules.NameNormalizer;
import com.dataset.matching.rules.NormalizationEngine;
import com.dataset.matching.similarity.BlockingKeyStrategy;
import com.dataset.matching.similarity.DefaultBlockingKeyStrategy;
import com.dataset.matching.similarity.MatchTypeClassifier;
import com.dataset.matching.similarity.SimilarityScorer;
import com.dataset.matching.store.CypherReferenceStore;
import com.dataset.matching.store.FalkorDBConnection;
import com.dataset.matching.store.GraphConnection;
import com.dataset.matching.store.ReferenceStore;
import com.dataset.matching.tracing.NoOpTracingService;
import com.dataset.matching.tracing.TracingService;
import com.google.common.base.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Main entry point: matches entity names against the active reference datasets.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * InMemoryReferenceStore store = new InMemoryReferenceStore();
 * new JsonReferenceDatasetLoader().loadResource("datasets/reference.json", store);
 *
 * try (DatasetMatcher matcher = DatasetMatcher.builder()
 *         .referenceStore(store)
 *         .config(MatcherConfig.loadDefault())
 *         .build()) {
 *
 *     MatchResponse response = matcher.match(MatchRequest.of("National University of Defense Technology (NUDT)"));
 *
 *     BatchResult batch = matcher.matchBatch(List.of(MatchQuery.of("NUDT"), MatchQuery.of("Acme")));
 * }
 * </pre>
 */
public class DatasetMatcher implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(DatasetMatcher.class);

    private final MatcherConfig config;
    private final DatasetMatchingService service;
    private final BatchCoordinator batchCoordinator;
    private final AffiliatedBooster affiliatedBooster;
    private final MatchCache cache;
    private final ExecutorService storeExecutor;
    private final HealthCheckRegistry healthCheckRegistry;
    private final GraphConnection ownedConnection;

    private DatasetMatcher(Builder builder) {
        this.config = builder.config;
        this.ownedConnection = builder.ownedConnection;
        MetricsService metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        TracingService tracingService = builder.tracingService != null
                ? builder.tracingService : new NoOpTracingService();

        NormalizationEngine engine = builder.normalizationEngine != null
                ? builder.normalizationEngine : DefaultNormalizationRules.createDefaultEngine();
        NameNormalizer normalizer = new NameNormalizer(engine);
        BlockingKeyStrategy blockingKeyStrategy = builder.blockingKeyStrategy != null
                ? builder.blockingKeyStrategy : new DefaultBlockingKeyStrategy();

        if (builder.cache != null) {
            this.cache = builder.cache;
        } else if (config.getCacheConfig().enabled()) {
            this.cache = builder.ticker != null
                    ? new LruMatchCache(config.getCacheConfig(), builder.ticker)
                    : new LruMatchCache(config.getCacheConfig());
        } else {
            this.cache = new NoOpMatchCache();
        }

        int storeThreads = config.getBatchParallelism() + config.getAffiliatedParallelism();
        this.storeExecutor = Executors.newFixedThreadPool(storeThreads, BatchCoordinator.namedThreads("dataset-store"));
        CandidateRetriever retriever = new CandidateRetriever(builder.referenceStore, blockingKeyStrategy,
                storeExecutor, config.getStoreTimeout(), config.getWindowSize(), metricsService);

        CountryNormalizer countryNormalizer = builder.countryNormalizer != null
                ? builder.countryNormalizer : CountryNormalizer.loadDefault();

        this.service = new DatasetMatchingService(normalizer, retriever,
                new MatchTypeClassifier(new SimilarityScorer(normalizer)), new QualityAssessor(normalizer),
                cache, metricsService, tracingService, countryNormalizer, config.getGeographicConfig());
        this.batchCoordinator = new BatchCoordinator(service, config.getBatchParallelism(),
                config.getBatchMaxSize(), metricsService, tracingService);
        this.affiliatedBooster = new AffiliatedBooster(service, config.getAffiliatedParallelism(),
                config.getHighConfidenceThreshold(), tracingService);

        this.healthCheckRegistry = new HealthCheckRegistry();
        healthCheckRegistry.register(new ReferenceStoreHealthCheck(builder.referenceStore));
        healthCheckRegistry.register(new MatchCacheHealthCheck(cache));

        log.info("DatasetMatcher initialized with store={} config={}", builder.referenceStore.getName(), config);
    }

    // ========== Matching API ==========

    /**
     * Matches a request, including its affiliated companies.
     * An invalid entity yields {@code success=false}; every other outcome is a success,
     * possibly with no matches.
     */
    public MatchResponse match(MatchRequest request) {
        long start = System.nanoTime();
        if (request == null) {
            return MatchResponse.failure(InputValidationException.CODE, "request must not be null", 0);
        }
        MatchQuery query = request.toMatchQuery();
        MatchOutcome direct;
        try {
            direct = service.match(query);
        } catch (InputValidationException e) {
            log.warn("match.rejected code={} reason={}", e.getCode(), e.getMessage());
            return MatchResponse.failure(e.getCode(), e.getMessage(), elapsedMs(start));
        }

        List<AffiliatedCompany> companies = request.affiliatedCompanies();
        AffiliatedOutcome affiliated = companies.isEmpty()
                ? AffiliatedOutcome.empty()
                : affiliatedBooster.boost(companies, query.options(), query.context());

        MatchSummary summary = summarize(direct.matches(), affiliated);
        ResponseMetadata metadata = new ResponseMetadata(elapsedMs(start), ResponseMetadata.ALGORITHM_VERSION,
                direct.cacheHit(), direct.degraded(), direct.diagnostics());
        return new MatchResponse(true, direct.matches(), affiliated.matches(), affiliated.breakdown(),
                summary, metadata, null);
    }

    /**
     * Runs a single query through the pipeline.
     *
     * @throws InputValidationException if the query is structurally invalid
     */
    public MatchOutcome match(MatchQuery query) {
        return service.match(query);
    }

    public BatchResult matchBatch(List<MatchQuery> queries) {
        return batchCoordinator.process(queries);
    }

    /**
     * Runs a batch; items not yet started when {@code token} is cancelled are reported as cancelled.
     */
    public BatchResult matchBatch(List<MatchQuery> queries, CancellationToken token) {
        return batchCoordinator.process(queries, token);
    }

    private MatchSummary summarize(List<DatasetMatch> direct, AffiliatedOutcome affiliated) {
        List<DatasetMatch> all = new ArrayList<>(direct);
        all.addAll(affiliated.allMatches());
        int highConfidence = (int) all.stream()
                .filter(match -> match.getConfidenceScore() >= config.getHighConfidenceThreshold())
                .count();
        double average = all.stream().mapToDouble(DatasetMatch::getConfidenceScore).average().orElse(0.0);
        return new MatchSummary(affiliated.entitiesConsidered(), affiliated.entitiesMatched(), direct.size(),
                affiliated.totalMatches(), highConfidence, Math.round(average * 100.0) / 100.0);
    }

    // ========== Operations ==========

    public HealthStatus health() {
        return healthCheckRegistry.checkAll();
    }

    public CacheStats cacheStats() {
        return cache.getStats();
    }

    public void clearCache() {
        cache.invalidateAll();
        log.info("Match cache cleared");
    }

    public MatcherConfig getConfig() {
        return config;
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    @Override
    public void close() {
        batchCoordinator.close();
        affiliatedBooster.close();
        storeExecutor.shutdown();
        try {
            if (!storeExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                storeExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            storeExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        if (ownedConnection != null) {
            try {
                ownedConnection.close();
            } catch (Exception e) {
                log.warn("Error closing graph connection", e);
            }
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private ReferenceStore referenceStore;
        private GraphConnection ownedConnection;
        private boolean initializeSchema = false;
        private MatcherConfig config = MatcherConfig.defaults();
        private NormalizationEngine normalizationEngine;
        private BlockingKeyStrategy blockingKeyStrategy;
        private MatchCache cache;
        private Ticker ticker;
        private CountryNormalizer countryNormalizer;
        private MetricsService metricsService;
        private TracingService tracingService;

        /**
         * Sets the reference store to match against.
         */
        public Builder referenceStore(ReferenceStore referenceStore) {
            this.referenceStore = referenceStore;
            this.ownedConnection = null;
            return this;
        }

        /**
         * Matches against a FalkorDB graph. The connection is owned and closed with the matcher.
         */
        public Builder falkorDB(String host, int port, String graphName) {
            FalkorDBConnection connection = new FalkorDBConnection(host, port, graphName);
            this.referenceStore = new CypherReferenceStore(connection);
            this.ownedConnection = connection;
            return this;
        }

        /**
         * Creates the graph indexes on build when the store is a {@link CypherReferenceStore}.
         */
        public Builder initializeSchema(boolean initializeSchema) {
            this.initializeSchema = initializeSchema;
            return this;
        }

        public Builder config(MatcherConfig config) {
            this.config = config;
            return this;
        }

        public Builder normalizationEngine(NormalizationEngine normalizationEngine) {
            this.normalizationEngine = normalizationEngine;
            return this;
        }

        /**
         * Sets the strategy used to key the candidate window.
         * Defaults to {@link DefaultBlockingKeyStrategy}.
         */
        public Builder blockingKeyStrategy(BlockingKeyStrategy blockingKeyStrategy) {
            this.blockingKeyStrategy = blockingKeyStrategy;
            return this;
        }

        /**
         * Overrides the cache built from {@link MatcherConfig#getCacheConfig()}.
         */
        public Builder cache(MatchCache cache) {
            this.cache = cache;
            return this;
        }

        /**
         * Clock for the default cache's TTL.
         */
        public Builder ticker(Ticker ticker) {
            this.ticker = ticker;
            return this;
        }

        /**
         * Country table used to resolve search locations. Defaults to the bundled one.
         */
        public Builder countryNormalizer(CountryNormalizer countryNormalizer) {
            this.countryNormalizer = countryNormalizer;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        public DatasetMatcher build() {
            if (referenceStore == null) {
                throw new IllegalStateException("ReferenceStore is required");
            }
            if (config == null) {
                throw new IllegalStateException("MatcherConfig is required");
            }
            if (initializeSchema && referenceStore instanceof CypherReferenceStore cypherStore) {
                cypherStore.initializeSchema();
            }
            return new DatasetMatcher(this);
        }
    }
}
