package com.dataset.matching.cache;

import com.dataset.matching.core.model.DatasetMatch;
import com.google.common.base.Ticker;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.util.concurrent.ExecutionError;
import com.google.common.util.concurrent.UncheckedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.function.Function;

/**
 * Guava-backed {@link MatchCache} with least-recently-used eviction and expire-after-write TTL.
 *
 * <p>A single segment keeps the access order global, so the entry evicted on overflow is
 * always the one least recently read or written. Loads run outside the segment lock: a slow
 * load blocks only callers of the same key.</p>
 *
 * <p>The {@link Ticker} is injectable so tests can advance time.</p>
 */
public class LruMatchCache implements MatchCache {
    private static final Logger log = LoggerFactory.getLogger(LruMatchCache.class);

    private final Cache<CacheKey, List<DatasetMatch>> cache;

    public LruMatchCache(CacheConfig config) {
        this(config, Ticker.systemTicker());
    }

    public LruMatchCache(CacheConfig config, Ticker ticker) {
        this.cache = CacheBuilder.newBuilder()
                .concurrencyLevel(1)
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .ticker(ticker)
                .recordStats()
                .build();
        log.info("LruMatchCache initialized: maxSize={}, ttl={}s", config.maxSize(), config.ttlSeconds());
    }

    @Override
    public Optional<List<DatasetMatch>> get(CacheKey key) {
        return Optional.ofNullable(cache.getIfPresent(key));
    }

    @Override
    public void put(CacheKey key, List<DatasetMatch> matches) {
        cache.put(key, List.copyOf(matches));
    }

    @Override
    public List<DatasetMatch> get(CacheKey key, Function<CacheKey, List<DatasetMatch>> loader) {
        try {
            return cache.get(key, () -> {
                List<DatasetMatch> loaded = loader.apply(key);
                return loaded != null ? List.copyOf(loaded) : null;
            });
        } catch (CacheLoader.InvalidCacheLoadException e) {
            // the loader declined to produce a cacheable value
            return null;
        } catch (UncheckedExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw e;
        } catch (ExecutionError e) {
            throw (Error) e.getCause();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Match cache load failed for " + key, e.getCause());
        }
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        log.debug("Match cache cleared");
    }

    @Override
    public CacheStats getStats() {
        cache.cleanUp();
        com.google.common.cache.CacheStats stats = cache.stats();
        return new CacheStats(stats.hitCount(), stats.missCount(), stats.evictionCount(), cache.size());
    }
}
