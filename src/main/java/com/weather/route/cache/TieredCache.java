package com.weather.route.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.weather.route.core.error.CacheLayerDownException;
import com.weather.route.core.model.CacheEntry;
import com.weather.route.metrics.MetricsService;
import com.weather.route.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Read-through cache over a fast volatile layer and a durable layer.
 *
 * <p>Reads try the fast layer, then the durable layer; a durable hit re-warms the fast layer
 * before returning. A layer that is down is skipped, and with both down reads miss and writes
 * are dropped, so callers fall through to the origin. {@link CacheLayerDownException} never
 * leaves this class.</p>
 *
 * <p>Values are stored as JSON produced by the shared {@link ObjectMapper}.</p>
 */
public class TieredCache {
    private static final Logger log = LoggerFactory.getLogger(TieredCache.class);

    private final CacheLayer fast;
    private final CacheLayer durable;
    private final ObjectMapper objectMapper;
    private final Duration defaultFastTtl;
    private final Clock clock;
    private final MetricsService metricsService;
    private final Counters fastCounters = new Counters();
    private final Counters durableCounters = new Counters();

    public TieredCache(CacheLayer fast, CacheLayer durable, ObjectMapper objectMapper, Duration defaultFastTtl) {
        this(fast, durable, objectMapper, defaultFastTtl, Clock.systemUTC(), new NoOpMetricsService());
    }

    public TieredCache(CacheLayer fast, CacheLayer durable, ObjectMapper objectMapper, Duration defaultFastTtl,
                       Clock clock, MetricsService metricsService) {
        this.fast = Objects.requireNonNull(fast, "fast layer is required");
        this.durable = Objects.requireNonNull(durable, "durable layer is required");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper is required");
        if (defaultFastTtl == null || defaultFastTtl.isZero() || defaultFastTtl.isNegative()) {
            throw new IllegalArgumentException("defaultFastTtl must be > 0");
        }
        this.defaultFastTtl = defaultFastTtl;
        this.clock = clock;
        this.metricsService = metricsService;
    }

    /**
     * Mapper for cache payloads: ISO-8601 timestamps, unknown properties ignored so older entries stay readable.
     */
    public static ObjectMapper defaultObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Fresh value for {@code key}, or empty.
     */
    public <V> Optional<V> get(String key, Class<V> type) {
        return lookup(key, type).map(CacheHit::value);
    }

    /**
     * Fresh entry for {@code key} with the tier that answered, or empty.
     */
    public <V> Optional<CacheHit<V>> lookup(String key, Class<V> type) {
        Instant now = clock.instant();

        Optional<CacheEntry> fastEntry = read(fast, fastCounters, key);
        if (fastEntry.isPresent() && !fastEntry.get().isExpired(now)) {
            Optional<V> value = decode(fastEntry.get(), type);
            if (value.isPresent()) {
                recordLookup(fast, fastCounters, true);
                return Optional.of(new CacheHit<>(value.get(), fastEntry.get(), CacheHit.Tier.FAST, false));
            }
        }
        recordLookup(fast, fastCounters, false);

        Optional<CacheEntry> durableEntry = read(durable, durableCounters, key);
        if (durableEntry.isPresent() && !durableEntry.get().isExpired(now)) {
            Optional<V> value = decode(durableEntry.get(), type);
            if (value.isPresent()) {
                recordLookup(durable, durableCounters, true);
                backfill(durableEntry.get(), now);
                return Optional.of(new CacheHit<>(value.get(), durableEntry.get(), CacheHit.Tier.DURABLE, false));
            }
        }
        recordLookup(durable, durableCounters, false);
        return Optional.empty();
    }

    /**
     * Like {@link #lookup(String, Class)}, but falls back to a durable entry that expired less than
     * {@code grace} ago. Such hits are flagged stale and never backfilled.
     */
    public <V> Optional<CacheHit<V>> getWithinGrace(String key, Class<V> type, Duration grace) {
        Optional<CacheHit<V>> fresh = lookup(key, type);
        if (fresh.isPresent()) {
            return fresh;
        }
        Instant now = clock.instant();
        Optional<CacheEntry> entry = read(durable, durableCounters, key);
        if (entry.isPresent() && entry.get().hasExpiry()
                && now.isBefore(entry.get().expiresAt().plus(grace))) {
            Optional<V> value = decode(entry.get(), type);
            if (value.isPresent()) {
                durableCounters.staleHits.incrementAndGet();
                return Optional.of(new CacheHit<>(value.get(), entry.get(), CacheHit.Tier.DURABLE, true));
            }
        }
        return Optional.empty();
    }

    /**
     * Writes the fast layer with {@code fastTtl} and, if {@code persistDurable}, the durable layer
     * without expiry.
     */
    public <V> void put(String key, V value, Duration fastTtl, boolean persistDurable) {
        if (fastTtl == null || fastTtl.isZero() || fastTtl.isNegative()) {
            throw new IllegalArgumentException("fastTtl must be > 0");
        }
        Instant now = clock.instant();
        String payload = encode(key, value);
        write(fast, fastCounters, new CacheEntry(key, payload, now, now.plus(fastTtl), null), false);
        if (persistDurable) {
            write(durable, durableCounters, new CacheEntry(key, payload, now, null, null), false);
        }
    }

    /**
     * Writes an entry valid until {@code expiresAt} to the fast layer and, if {@code persistDurable},
     * to the durable layer. An expiry that is not in the future writes nothing.
     *
     * @return whether anything was written
     */
    public <V> boolean putUntil(String key, V value, Instant expiresAt, boolean persistDurable, String generation) {
        Instant now = clock.instant();
        if (!expiresAt.isAfter(now)) {
            log.debug("Skipping write of {}: expiry {} is not after {}", key, expiresAt, now);
            return false;
        }
        CacheEntry entry = new CacheEntry(key, encode(key, value), now, expiresAt, generation);
        write(fast, fastCounters, entry, false);
        if (persistDurable) {
            write(durable, durableCounters, entry, false);
        }
        return true;
    }

    /**
     * Removes {@code key} from both layers.
     *
     * @return true if either layer held the key
     */
    public boolean invalidate(String key) {
        boolean removedFast = remove(fast, fastCounters, () -> fast.invalidate(key));
        boolean removedDurable = remove(durable, durableCounters, () -> durable.invalidate(key));
        log.info("Invalidated {} (fast={}, durable={})", key, removedFast, removedDurable);
        return removedFast || removedDurable;
    }

    /**
     * Removes every key starting with {@code prefix} from both layers.
     */
    public int invalidatePrefix(String prefix) {
        int removed = count(fast, fastCounters, () -> fast.invalidatePrefix(prefix))
                + count(durable, durableCounters, () -> durable.invalidatePrefix(prefix));
        log.info("Invalidated {} entries with prefix {}", removed, prefix);
        return removed;
    }

    /**
     * Deletes expired entries from both layers.
     */
    public int purgeExpired() {
        Instant now = clock.instant();
        int removed = count(fast, fastCounters, () -> fast.purgeExpired(now))
                + count(durable, durableCounters, () -> durable.purgeExpired(now));
        log.info("Purged {} expired cache entries", removed);
        return removed;
    }

    public LayerStats fastStats() {
        return fastCounters.snapshot(fast.name(), sizeOf(fast));
    }

    public LayerStats durableStats() {
        return durableCounters.snapshot(durable.name(), sizeOf(durable));
    }

    public CacheLayer fastLayer() {
        return fast;
    }

    public CacheLayer durableLayer() {
        return durable;
    }

    // ========== Layer access ==========

    private Optional<CacheEntry> read(CacheLayer layer, Counters counters, String key) {
        try {
            return layer.get(key);
        } catch (CacheLayerDownException e) {
            layerDown(layer, counters, "read " + key, e);
            return Optional.empty();
        }
    }

    private void write(CacheLayer layer, Counters counters, CacheEntry entry, boolean backfill) {
        try {
            layer.put(entry);
            counters.writes.incrementAndGet();
            if (backfill) {
                counters.backfills.incrementAndGet();
            }
        } catch (CacheLayerDownException e) {
            layerDown(layer, counters, "write " + entry.key(), e);
        }
    }

    private void backfill(CacheEntry durableEntry, Instant now) {
        Instant fastExpiry = now.plus(defaultFastTtl);
        if (durableEntry.hasExpiry() && durableEntry.expiresAt().isBefore(fastExpiry)) {
            fastExpiry = durableEntry.expiresAt();
        }
        if (!fastExpiry.isAfter(durableEntry.createdAt())) {
            return;
        }
        write(fast, fastCounters, durableEntry.withExpiresAt(fastExpiry), true);
        log.debug("Backfilled fast layer for {}", durableEntry.key());
    }

    private boolean remove(CacheLayer layer, Counters counters, LayerCall<Boolean> call) {
        try {
            return call.run();
        } catch (CacheLayerDownException e) {
            layerDown(layer, counters, "invalidate", e);
            return false;
        }
    }

    private int count(CacheLayer layer, Counters counters, LayerCall<Integer> call) {
        try {
            return call.run();
        } catch (CacheLayerDownException e) {
            layerDown(layer, counters, "bulk removal", e);
            return 0;
        }
    }

    private long sizeOf(CacheLayer layer) {
        try {
            return layer.size();
        } catch (CacheLayerDownException e) {
            return -1;
        }
    }

    private void layerDown(CacheLayer layer, Counters counters, String operation, CacheLayerDownException e) {
        counters.errors.incrementAndGet();
        metricsService.recordCacheLayerFailure(layer.name());
        log.warn("Cache layer '{}' unavailable on {}: {}", layer.name(), operation, e.getMessage());
    }

    private void recordLookup(CacheLayer layer, Counters counters, boolean hit) {
        if (hit) {
            counters.hits.incrementAndGet();
        } else {
            counters.misses.incrementAndGet();
        }
        metricsService.recordCacheLookup(layer.name(), hit);
    }

    // ========== Serialization ==========

    private String encode(String key, Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize value for cache key " + key, e);
        }
    }

    private <V> Optional<V> decode(CacheEntry entry, Class<V> type) {
        try {
            return Optional.of(objectMapper.readValue(entry.payload(), type));
        } catch (JsonProcessingException e) {
            log.warn("Unreadable payload for {} as {}: {}", entry.key(), type.getSimpleName(), e.getMessage());
            return Optional.empty();
        }
    }

    @FunctionalInterface
    private interface LayerCall<T> {
        T run();
    }

    private static final class Counters {
        final AtomicLong hits = new AtomicLong();
        final AtomicLong misses = new AtomicLong();
        final AtomicLong errors = new AtomicLong();
        final AtomicLong writes = new AtomicLong();
        final AtomicLong backfills = new AtomicLong();
        final AtomicLong staleHits = new AtomicLong();

        LayerStats snapshot(String layer, long size) {
            return new LayerStats(layer, hits.get(), misses.get(), errors.get(),
                    writes.get(), backfills.get(), staleHits.get(), size);
        }
    }
}
