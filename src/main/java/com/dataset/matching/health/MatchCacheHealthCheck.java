package com.dataset.matching.health;

import com.dataset.matching.cache.CacheStats;
import com.dataset.matching.cache.MatchCache;

/**
 * Reports cache occupancy and hit rate. The cache has no failure mode, so this is always UP.
 */
public class MatchCacheHealthCheck implements HealthCheck {

    private final MatchCache cache;

    public MatchCacheHealthCheck(MatchCache cache) {
        this.cache = cache;
    }

    @Override
    public String getName() {
        return "match-cache";
    }

    @Override
    public HealthStatus check() {
        CacheStats stats = cache.getStats();
        return HealthStatus.up("cache operational")
                .withDetail("size", stats.size())
                .withDetail("hits", stats.hitCount())
                .withDetail("misses", stats.missCount())
                .withDetail("evictions", stats.evictionCount())
                .withDetail("hitRate", stats.hitRate());
    }
}
