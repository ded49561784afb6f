package com.dataset.matching.metrics;

import com.dataset.matching.core.model.MatchType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer implementation of {@link MetricsService}. Requires {@code micrometer-core}
 * (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code dataset.match.duration}: Timer (tag: cache = hit|miss)</li>
 *   <li>{@code dataset.match.type}: Counter (tag: matchType)</li>
 *   <li>{@code dataset.match.confidence}: DistributionSummary</li>
 *   <li>{@code dataset.batch.size}: DistributionSummary</li>
 *   <li>{@code dataset.cache.hit} / {@code dataset.cache.miss}: Counter</li>
 *   <li>{@code dataset.store.failure}: Counter (tag: operation)</li>
 *   <li>{@code dataset.record.parse.failure}: Counter</li>
 *   <li>{@code dataset.validation.failure}: Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Timer hitTimer;
    private final Timer missTimer;
    private final DistributionSummary confidenceSummary;
    private final DistributionSummary batchSizeSummary;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;
    private final Counter parseFailureCounter;
    private final Counter validationFailureCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.hitTimer = matchTimer("hit");
        this.missTimer = matchTimer("miss");
        this.confidenceSummary = DistributionSummary.builder("dataset.match.confidence")
                .description("Confidence of returned matches")
                .register(registry);
        this.batchSizeSummary = DistributionSummary.builder("dataset.batch.size")
                .description("Number of items per batch")
                .register(registry);
        this.cacheHitCounter = Counter.builder("dataset.cache.hit")
                .description("Match cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("dataset.cache.miss")
                .description("Match cache misses")
                .register(registry);
        this.parseFailureCounter = Counter.builder("dataset.record.parse.failure")
                .description("Malformed reference rows skipped")
                .register(registry);
        this.validationFailureCounter = Counter.builder("dataset.validation.failure")
                .description("Queries rejected by input validation")
                .register(registry);
    }

    @Override
    public void recordMatchDuration(Duration duration, boolean cacheHit) {
        (cacheHit ? hitTimer : missTimer).record(duration);
    }

    @Override
    public void incrementMatchType(MatchType type) {
        counterCache.computeIfAbsent("type:" + type.wireName(), k ->
                Counter.builder("dataset.match.type")
                        .description("Returned matches by match type")
                        .tag("matchType", type.wireName())
                        .register(registry)).increment();
    }

    @Override
    public void recordConfidence(double confidence) {
        confidenceSummary.record(confidence);
    }

    @Override
    public void recordBatchSize(int size) {
        batchSizeSummary.record(size);
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }

    @Override
    public void incrementStoreFailure(String operation) {
        counterCache.computeIfAbsent("store:" + operation, k ->
                Counter.builder("dataset.store.failure")
                        .description("Failed or timed-out reference store calls")
                        .tag("operation", operation)
                        .register(registry)).increment();
    }

    @Override
    public void incrementRecordParseFailure() {
        parseFailureCounter.increment();
    }

    @Override
    public void incrementValidationFailure() {
        validationFailureCounter.increment();
    }

    private Timer matchTimer(String cache) {
        return Timer.builder("dataset.match.duration")
                .description("Duration of single-query matching")
                .tag("cache", cache)
                .register(registry);
    }
}
