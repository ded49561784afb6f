package com.dataset.matching.cache;

import com.dataset.matching.core.model.DatasetMatch;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Caching disabled: nothing is stored and every lookup computes.
 */
public class NoOpMatchCache implements MatchCache {

    @Override
    public Optional<List<DatasetMatch>> get(CacheKey key) {
        return Optional.empty();
    }

    @Override
    public void put(CacheKey key, List<DatasetMatch> matches) {
    }

    @Override
    public List<DatasetMatch> get(CacheKey key, Function<CacheKey, List<DatasetMatch>> loader) {
        return loader.apply(key);
    }

    @Override
    public void invalidateAll() {
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
