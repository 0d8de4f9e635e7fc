package com.weather.route.cache;

import java.time.Duration;

/**
 * Configuration for the in-process fast layer.
 *
 * @param maxSize    maximum number of entries
 * @param defaultTtl TTL for entries written without an explicit expiry
 * @param enabled    whether the layer stores anything
 */
public record CacheLayerConfig(int maxSize, Duration defaultTtl, boolean enabled) {

    public CacheLayerConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        if (defaultTtl == null || defaultTtl.isZero() || defaultTtl.isNegative()) {
            throw new IllegalArgumentException("defaultTtl must be > 0");
        }
    }

    /**
     * 100,000 entries, 24h default TTL, enabled.
     */
    public static CacheLayerConfig defaults() {
        return new CacheLayerConfig(100_000, Duration.ofHours(24), true);
    }

    public static CacheLayerConfig disabled() {
        return new CacheLayerConfig(1, Duration.ofSeconds(1), false);
    }
}
