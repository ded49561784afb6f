package com.dataset.matching.cache;

/**
 * Configuration of the match cache.
 *
 * @param maxSize    maximum number of cached queries
 * @param ttlSeconds time-to-live of an entry, counted from its write
 * @param enabled    whether caching is enabled
 */
public record CacheConfig(int maxSize, int ttlSeconds, boolean enabled) {

    public CacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be > 0");
        }
    }

    /**
     * 100 entries, five minutes, enabled.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(100, 300, true);
    }

    public static CacheConfig disabled() {
        return new CacheConfig(1, 1, false);
    }
}
