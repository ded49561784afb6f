package com.dataset.matching.api;

import com.dataset.matching.cache.CacheConfig;
import com.dataset.matching.geo.GeographicConfig;
import com.dataset.matching.retrieval.CandidateRetriever;
import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.ConfigProvider;

import java.time.Duration;

/**
 * Engine-wide settings: cache sizing, store timeout, pool sizes, thresholds and location factors.
 *
 * <p>Built programmatically through {@link #builder()}, or read from MicroProfile Config.
 * The bundled {@code META-INF/microprofile-config.properties} lists every key; system
 * properties and environment variables override it the usual MicroProfile way.</p>
 * <pre>
 * dataset-matching.cache.max-size=100
 * dataset-matching.cache.ttl-seconds=300
 * dataset-matching.cache.enabled=true
 * dataset-matching.store.timeout-ms=3000
 * dataset-matching.batch.parallelism=5
 * dataset-matching.batch.max-size=100
 * dataset-matching.affiliated.parallelism=4
 * dataset-matching.retrieval.window-size=50
 * dataset-matching.high-confidence-threshold=0.8
 * dataset-matching.geographic.enabled=true
 * dataset-matching.geographic.same-country=1.2
 * dataset-matching.geographic.same-region=1.1
 * dataset-matching.geographic.different-region=0.9
 * </pre>
 */
public class MatcherConfig {
    static final String PREFIX = "dataset-matching.";

    private final CacheConfig cacheConfig;
    private final Duration storeTimeout;
    private final int batchParallelism;
    private final int batchMaxSize;
    private final int affiliatedParallelism;
    private final int windowSize;
    private final double highConfidenceThreshold;
    private final GeographicConfig geographicConfig;

    private MatcherConfig(Builder builder) {
        this.cacheConfig = builder.cacheConfig;
        this.storeTimeout = builder.storeTimeout;
        this.batchParallelism = builder.batchParallelism;
        this.batchMaxSize = builder.batchMaxSize;
        this.affiliatedParallelism = builder.affiliatedParallelism;
        this.windowSize = builder.windowSize;
        this.highConfidenceThreshold = builder.highConfidenceThreshold;
        this.geographicConfig = builder.geographicConfig;
    }

    public CacheConfig getCacheConfig() {
        return cacheConfig;
    }

    public Duration getStoreTimeout() {
        return storeTimeout;
    }

    public int getBatchParallelism() {
        return batchParallelism;
    }

    public int getBatchMaxSize() {
        return batchMaxSize;
    }

    public int getAffiliatedParallelism() {
        return affiliatedParallelism;
    }

    public int getWindowSize() {
        return windowSize;
    }

    public double getHighConfidenceThreshold() {
        return highConfidenceThreshold;
    }

    public GeographicConfig getGeographicConfig() {
        return geographicConfig;
    }

    public static MatcherConfig defaults() {
        return builder().build();
    }

    /**
     * Reads the {@code dataset-matching.*} keys from the application's MicroProfile Config.
     */
    public static MatcherConfig loadDefault() {
        return fromConfig(ConfigProvider.getConfig());
    }

    /**
     * Builds a config from {@code dataset-matching.*} keys; missing keys keep their defaults.
     *
     * @throws IllegalArgumentException if a value does not convert to the expected type, or is out of range
     */
    public static MatcherConfig fromConfig(Config config) {
        CacheConfig cacheDefaults = CacheConfig.defaults();
        CacheConfig cache = new CacheConfig(
                value(config, "cache.max-size", Integer.class, cacheDefaults.maxSize()),
                value(config, "cache.ttl-seconds", Integer.class, cacheDefaults.ttlSeconds()),
                value(config, "cache.enabled", Boolean.class, cacheDefaults.enabled()));

        GeographicConfig geoDefaults = GeographicConfig.defaults();
        GeographicConfig geographic = new GeographicConfig(
                value(config, "geographic.enabled", Boolean.class, geoDefaults.enabled()),
                value(config, "geographic.same-country", Double.class, geoDefaults.sameCountry()),
                value(config, "geographic.same-region", Double.class, geoDefaults.sameRegion()),
                value(config, "geographic.different-region", Double.class, geoDefaults.differentRegion()));

        return builder()
                .cacheConfig(cache)
                .storeTimeout(Duration.ofMillis(value(config, "store.timeout-ms", Long.class,
                        CandidateRetriever.DEFAULT_TIMEOUT.toMillis())))
                .batchParallelism(value(config, "batch.parallelism", Integer.class,
                        BatchCoordinator.DEFAULT_PARALLELISM))
                .batchMaxSize(value(config, "batch.max-size", Integer.class, BatchCoordinator.DEFAULT_MAX_BATCH_SIZE))
                .affiliatedParallelism(value(config, "affiliated.parallelism", Integer.class,
                        AffiliatedBooster.DEFAULT_PARALLELISM))
                .windowSize(value(config, "retrieval.window-size", Integer.class,
                        CandidateRetriever.DEFAULT_WINDOW_SIZE))
                .highConfidenceThreshold(value(config, "high-confidence-threshold", Double.class,
                        AffiliatedBooster.DEFAULT_HIGH_CONFIDENCE_THRESHOLD))
                .geographicConfig(geographic)
                .build();
    }

    private static <T> T value(Config config, String key, Class<T> type, T defaultValue) {
        return config.getOptionalValue(PREFIX + key, type).orElse(defaultValue);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private CacheConfig cacheConfig = CacheConfig.defaults();
        private Duration storeTimeout = CandidateRetriever.DEFAULT_TIMEOUT;
        private int batchParallelism = BatchCoordinator.DEFAULT_PARALLELISM;
        private int batchMaxSize = BatchCoordinator.DEFAULT_MAX_BATCH_SIZE;
        private int affiliatedParallelism = AffiliatedBooster.DEFAULT_PARALLELISM;
        private int windowSize = CandidateRetriever.DEFAULT_WINDOW_SIZE;
        private double highConfidenceThreshold = AffiliatedBooster.DEFAULT_HIGH_CONFIDENCE_THRESHOLD;
        private GeographicConfig geographicConfig = GeographicConfig.defaults();

        public Builder cacheConfig(CacheConfig cacheConfig) {
            this.cacheConfig = cacheConfig;
            return this;
        }

        public Builder storeTimeout(Duration storeTimeout) {
            this.storeTimeout = storeTimeout;
            return this;
        }

        public Builder batchParallelism(int batchParallelism) {
            this.batchParallelism = batchParallelism;
            return this;
        }

        public Builder batchMaxSize(int batchMaxSize) {
            this.batchMaxSize = batchMaxSize;
            return this;
        }

        public Builder affiliatedParallelism(int affiliatedParallelism) {
            this.affiliatedParallelism = affiliatedParallelism;
            return this;
        }

        public Builder windowSize(int windowSize) {
            this.windowSize = windowSize;
            return this;
        }

        public Builder highConfidenceThreshold(double highConfidenceThreshold) {
            this.highConfidenceThreshold = highConfidenceThreshold;
            return this;
        }

        public Builder geographicConfig(GeographicConfig geographicConfig) {
            this.geographicConfig = geographicConfig;
            return this;
        }

        public MatcherConfig build() {
            if (cacheConfig == null) {
                throw new IllegalArgumentException("cacheConfig is required");
            }
            if (geographicConfig == null) {
                throw new IllegalArgumentException("geographicConfig is required");
            }
            if (storeTimeout == null || storeTimeout.isZero() || storeTimeout.isNegative()) {
                throw new IllegalArgumentException("storeTimeout must be positive");
            }
            if (batchParallelism <= 0 || affiliatedParallelism <= 0) {
                throw new IllegalArgumentException("parallelism must be > 0");
            }
            if (batchMaxSize <= 0) {
                throw new IllegalArgumentException("batchMaxSize must be > 0");
            }
            if (windowSize <= 0) {
                throw new IllegalArgumentException("windowSize must be > 0");
            }
            if (highConfidenceThreshold < 0.0 || highConfidenceThreshold > 1.0) {
                throw new IllegalArgumentException("highConfidenceThreshold must be between 0.0 and 1.0");
            }
            return new MatcherConfig(this);
        }
    }

    @Override
    public String toString() {
        return "MatcherConfig{" +
                "cacheConfig=" + cacheConfig +
                ", storeTimeout=" + storeTimeout +
                ", batchParallelism=" + batchParallelism +
                ", batchMaxSize=" + batchMaxSize +
                ", affiliatedParallelism=" + affiliatedParallelism +
                ", windowSize=" + windowSize +
                ", highConfidenceThreshold=" + highConfidenceThreshold +
                ", geographicConfig=" + geographicConfig +
                '}';
    }
}
