package com.dataset.matching.metrics;

import com.dataset.matching.core.model.MatchType;

import java.time.Duration;

/**
 * Records matching metrics. {@link NoOpMetricsService} is the default so the library
 * runs without a metrics backend on the classpath.
 */
public interface MetricsService {

    void recordMatchDuration(Duration duration, boolean cacheHit);

    void incrementMatchType(MatchType type);

    void recordConfidence(double confidence);

    void recordBatchSize(int size);

    void recordCacheHit();

    void recordCacheMiss();

    void incrementStoreFailure(String operation);

    void incrementRecordParseFailure();

    void incrementValidationFailure();
}
