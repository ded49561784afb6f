package com.dataset.matching.metrics;

import com.dataset.matching.core.model.MatchType;

import java.time.Duration;

/**
 * Discards every metric.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordMatchDuration(Duration duration, boolean cacheHit) {
    }

    @Override
    public void incrementMatchType(MatchType type) {
    }

    @Override
    public void recordConfidence(double confidence) {
    }

    @Override
    public void recordBatchSize(int size) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }

    @Override
    public void incrementStoreFailure(String operation) {
    }

    @Override
    public void incrementRecordParseFailure() {
    }

    @Override
    public void incrementValidationFailure() {
    }
}
