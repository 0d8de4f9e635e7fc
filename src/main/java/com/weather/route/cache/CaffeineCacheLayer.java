package com.weather.route.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.weather.route.core.model.CacheEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Caffeine-backed fast layer. Each entry lives until its own {@code expiresAt};
 * entries without one use the configured default TTL.
 */
public class CaffeineCacheLayer implements CacheLayer {
    private static final Logger log = LoggerFactory.getLogger(CaffeineCacheLayer.class);

    private final Cache<String, CacheEntry> cache;
    private final CacheLayerConfig config;
    private final Clock clock;

    public CaffeineCacheLayer(CacheLayerConfig config) {
        this(config, Clock.systemUTC());
    }

    public CaffeineCacheLayer(CacheLayerConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfter(new EntryExpiry())
                .recordStats()
                .build();
        log.info("CaffeineCacheLayer initialized: maxSize={}, defaultTtl={}, enabled={}",
                config.maxSize(), config.defaultTtl(), config.enabled());
    }

    @Override
    public String name() {
        return "fast";
    }

    @Override
    public Optional<CacheEntry> get(String key) {
        if (!config.enabled()) {
            return Optional.empty();
        }
        CacheEntry entry = cache.getIfPresent(key);
        if (entry != null && entry.isExpired(clock.instant())) {
            cache.invalidate(key);
            return Optional.empty();
        }
        return Optional.ofNullable(entry);
    }

    @Override
    public void put(CacheEntry entry) {
        if (config.enabled()) {
            cache.put(entry.key(), entry);
        }
    }

    @Override
    public boolean invalidate(String key) {
        return cache.asMap().remove(key) != null;
    }

    @Override
    public int invalidatePrefix(String prefix) {
        int before = cache.asMap().size();
        cache.asMap().keySet().removeIf(key -> key.startsWith(prefix));
        int removed = before - cache.asMap().size();
        log.debug("Invalidated {} fast entries with prefix {}", removed, prefix);
        return Math.max(removed, 0);
    }

    @Override
    public int purgeExpired(Instant now) {
        int before = cache.asMap().size();
        cache.asMap().values().removeIf(entry -> entry.isExpired(now));
        cache.cleanUp();
        return Math.max(before - cache.asMap().size(), 0);
    }

    @Override
    public long size() {
        return cache.estimatedSize();
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    /**
     * Caffeine's own counters, independent of the tiered cache bookkeeping.
     */
    public com.github.benmanes.caffeine.cache.stats.CacheStats nativeStats() {
        return cache.stats();
    }

    private final class EntryExpiry implements Expiry<String, CacheEntry> {

        @Override
        public long expireAfterCreate(String key, CacheEntry entry, long currentTime) {
            return lifetimeNanos(entry);
        }

        @Override
        public long expireAfterUpdate(String key, CacheEntry entry, long currentTime, long currentDuration) {
            return lifetimeNanos(entry);
        }

        @Override
        public long expireAfterRead(String key, CacheEntry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }

        private long lifetimeNanos(CacheEntry entry) {
            if (!entry.hasExpiry()) {
                return config.defaultTtl().toNanos();
            }
            Duration remaining = Duration.between(clock.instant(), entry.expiresAt());
            return remaining.isNegative() ? 0L : remaining.toNanos();
        }
    }
}
