package com.weather.route.cache;

import com.weather.route.chaos.ChaosCacheLayer;
import com.weather.route.core.model.CacheEntry;
import com.weather.route.core.model.WeatherPayload;
import com.weather.route.fakes.MutableClock;
import com.weather.route.metrics.NoOpMetricsService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class TieredCacheTest {

    private static final String KEY = "weather:u4pru:202603101000:gfs";

    private MutableClock clock;
    private ChaosCacheLayer fast;
    private ChaosCacheLayer durable;
    private TieredCache cache;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-03-10T10:15:00Z");
        fast = new ChaosCacheLayer(new CaffeineCacheLayer(new CacheLayerConfig(1000, Duration.ofHours(1), true), clock));
        durable = new ChaosCacheLayer(new InMemoryCacheLayer());
        cache = new TieredCache(fast, durable, TieredCache.defaultObjectMapper(), Duration.ofHours(1),
                clock, new NoOpMetricsService());
    }

    private static WeatherPayload payload(double temperature) {
        return WeatherPayload.of(temperature, "Clear", 10.0, 50.0).withModelGeneration("gfs");
    }

    @Nested
    @DisplayName("Read-through")
    class ReadThrough {

        @Test
        @DisplayName("Should answer from the fast layer after a write")
        void shouldReadFromFastLayer() {
            cache.put(KEY, payload(21.5), Duration.ofMinutes(30), true);

            Optional<CacheHit<WeatherPayload>> hit = cache.lookup(KEY, WeatherPayload.class);
            assertTrue(hit.isPresent());
            assertEquals(CacheHit.Tier.FAST, hit.get().tier());
            assertEquals(21.5, hit.get().value().temperature());
        }

        @Test
        @DisplayName("Should recover from the durable layer and re-warm the fast layer")
        void shouldBackfillFastLayer() {
            cache.put(KEY, payload(18.0), Duration.ofMinutes(30), true);
            fast.delegate().invalidate(KEY);

            Optional<CacheHit<WeatherPayload>> recovered = cache.lookup(KEY, WeatherPayload.class);
            assertEquals(CacheHit.Tier.DURABLE, recovered.get().tier());

            Optional<CacheHit<WeatherPayload>> again = cache.lookup(KEY, WeatherPayload.class);
            assertEquals(CacheHit.Tier.FAST, again.get().tier());
            assertEquals(1, cache.fastStats().backfillCount());
        }

        @Test
        @DisplayName("Should miss when neither layer holds the key")
        void shouldMiss() {
            assertTrue(cache.get("route:1:2", WeatherPayload.class).isEmpty());
            assertEquals(1, cache.fastStats().missCount());
            assertEquals(1, cache.durableStats().missCount());
        }

        @Test
        @DisplayName("Should skip a durable payload that cannot be decoded")
        void shouldSkipUndecodablePayload() {
            durable.put(new CacheEntry(KEY, "{not json", clock.instant(), null, null));

            assertTrue(cache.get(KEY, WeatherPayload.class).isEmpty());
        }
    }

    @Nested
    @DisplayName("Layer outages")
    class LayerOutages {

        @Test
        @DisplayName("Should serve from the durable layer while the fast layer is down")
        void shouldServeFromDurableWhenFastDown() {
            fast.setDown(true);
            cache.put(KEY, payload(12.0), Duration.ofMinutes(30), true);

            Optional<CacheHit<WeatherPayload>> hit = cache.lookup(KEY, WeatherPayload.class);
            assertEquals(CacheHit.Tier.DURABLE, hit.get().tier());
            assertTrue(cache.fastStats().errorCount() > 0);
            assertEquals(-1, cache.fastStats().size());
        }

        @Test
        @DisplayName("Should re-warm the fast layer once it comes back")
        void shouldRewarmAfterRecovery() {
            fast.setDown(true);
            cache.put(KEY, payload(12.0), Duration.ofMinutes(30), true);
            fast.setDown(false);

            assertEquals(CacheHit.Tier.DURABLE, cache.lookup(KEY, WeatherPayload.class).get().tier());
            assertEquals(CacheHit.Tier.FAST, cache.lookup(KEY, WeatherPayload.class).get().tier());
        }

        @Test
        @DisplayName("Should degrade to misses when both layers are down")
        void shouldMissWhenBothDown() {
            fast.setDown(true);
            durable.setDown(true);

            assertDoesNotThrow(() -> cache.put(KEY, payload(1.0), Duration.ofMinutes(5), true));
            assertTrue(cache.get(KEY, WeatherPayload.class).isEmpty());
            assertEquals(0, cache.invalidatePrefix("weather:"));
        }
    }

    @Nested
    @DisplayName("Expiry")
    class Expiry {

        @Test
        @DisplayName("Should hide an entry once its expiry passes")
        void shouldHideExpiredEntry() {
            assertTrue(cache.putUntil(KEY, payload(5.0), Instant.parse("2026-03-10T11:00:00Z"), true, "gfs"));
            assertTrue(cache.get(KEY, WeatherPayload.class).isPresent());

            clock.advance(Duration.ofMinutes(50));

            assertTrue(cache.get(KEY, WeatherPayload.class).isEmpty());
        }

        @Test
        @DisplayName("Should serve a recently expired entry within the grace window")
        void shouldServeWithinGrace() {
            cache.putUntil(KEY, payload(5.0), Instant.parse("2026-03-10T11:00:00Z"), true, "gfs");
            clock.advance(Duration.ofMinutes(65));

            Optional<CacheHit<WeatherPayload>> stale = cache.getWithinGrace(KEY, WeatherPayload.class, Duration.ofHours(1));
            assertTrue(stale.isPresent());
            assertTrue(stale.get().stale());
            assertEquals(1, cache.durableStats().staleHitCount());

            assertTrue(cache.getWithinGrace(KEY, WeatherPayload.class, Duration.ofMinutes(10)).isEmpty());
        }

        @Test
        @DisplayName("Should not write an entry whose expiry has passed")
        void shouldSkipPastExpiry() {
            assertFalse(cache.putUntil(KEY, payload(5.0), Instant.parse("2026-03-10T10:00:00Z"), true, "gfs"));
            assertEquals(0, durable.size());
        }

        @Test
        @DisplayName("Should purge expired entries from both layers")
        void shouldPurgeExpired() {
            cache.putUntil(KEY, payload(5.0), Instant.parse("2026-03-10T11:00:00Z"), true, "gfs");
            cache.put("route:1:2", payload(1.0), Duration.ofHours(24), true);
            clock.advance(Duration.ofHours(2));

            assertTrue(cache.purgeExpired() >= 1);
            assertEquals(1, durable.size());
            assertTrue(cache.get("route:1:2", WeatherPayload.class).isPresent());
        }

        @Test
        @DisplayName("Should reject a non-positive fast TTL")
        void shouldRejectBadTtl() {
            assertThrows(IllegalArgumentException.class, () -> cache.put(KEY, payload(1.0), Duration.ZERO, true));
        }
    }

    @Nested
    @DisplayName("Invalidation")
    class Invalidation {

        @Test
        @DisplayName("Should remove a key from both layers")
        void shouldInvalidateKey() {
            cache.put(KEY, payload(1.0), Duration.ofMinutes(5), true);

            assertTrue(cache.invalidate(KEY));
            assertTrue(cache.get(KEY, WeatherPayload.class).isEmpty());
            assertFalse(cache.invalidate(KEY));
        }

        @Test
        @DisplayName("Should remove every key under a prefix")
        void shouldInvalidatePrefix() {
            cache.put("weather:u4pru:202603101000:gfs", payload(1.0), Duration.ofMinutes(5), true);
            cache.put("weather:u4pru:202603101100:gfs", payload(2.0), Duration.ofMinutes(5), true);
            cache.put("weather:u4prv:202603101000:gfs", payload(3.0), Duration.ofMinutes(5), true);

            assertEquals(4, cache.invalidatePrefix(TemporalCacheKey.cellPrefix("u4pru")));
            assertTrue(cache.get("weather:u4prv:202603101000:gfs", WeatherPayload.class).isPresent());
        }
    }
}
