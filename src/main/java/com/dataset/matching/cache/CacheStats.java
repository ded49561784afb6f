package com.dataset.matching.cache;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Snapshot of match cache counters.
 */
public record CacheStats(@JsonProperty("hits") long hitCount,
                         @JsonProperty("misses") long missCount,
                         @JsonProperty("evictions") long evictionCount,
                         @JsonProperty("size") long size) {

    public static CacheStats empty() {
        return new CacheStats(0, 0, 0, 0);
    }

    @JsonProperty("hit_rate")
    public double hitRate() {
        long total = hitCount + missCount;
        return total == 0 ? 0.0 : (double) hitCount / total;
    }
}
