package com.dataset.matching.cache;

import com.dataset.matching.core.model.DatasetMatch;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Read-through cache of ranked match lists. Implementations must be thread-safe.
 */
public interface MatchCache {

    Optional<List<DatasetMatch>> get(CacheKey key);

    void put(CacheKey key, List<DatasetMatch> matches);

    /**
     * Returns the cached value or computes it. Concurrent callers for the same key wait for
     * a single computation. A loader returning {@code null} leaves nothing cached and the
     * method returns {@code null}.
     */
    List<DatasetMatch> get(CacheKey key, Function<CacheKey, List<DatasetMatch>> loader);

    void invalidateAll();

    CacheStats getStats();
}
