package com.weather.route.cache;

import com.weather.route.core.error.CacheLayerDownException;
import com.weather.route.core.model.CacheEntry;
import com.weather.route.fakes.StubGraphConnection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class GraphCacheLayerTest {

    private static final Instant CREATED = Instant.parse("2026-03-10T10:15:00Z");
    private static final Instant EXPIRES = Instant.parse("2026-03-10T11:00:00Z");

    private StubGraphConnection connection;
    private GraphCacheLayer layer;

    @BeforeEach
    void setUp() {
        connection = new StubGraphConnection();
        layer = new GraphCacheLayer(connection);
    }

    @Test
    @DisplayName("Should create indexes on construction")
    void shouldCreateIndexes() {
        assertEquals(2, connection.queriesContaining("CREATE INDEX FOR (c:CacheEntry)").size());
    }

    @Test
    @DisplayName("Should upsert entries with epoch millis and a no-expiry marker")
    void shouldPersistEntry() {
        layer.put(new CacheEntry("route:1:2", "{\"a\":1}", CREATED, null, null));
        layer.put(new CacheEntry("weather:u4pru:202603101000:gfs", "{}", CREATED, EXPIRES, "gfs"));

        List<String> merges = connection.queriesContaining("MERGE (c:CacheEntry {key: $key})");
        assertEquals(2, merges.size());

        Map<String, Object> routeParams = connection.executedParams.get(connection.executedParams.size() - 2);
        assertEquals("route:1:2", routeParams.get("key"));
        assertEquals(-1L, routeParams.get("expiresAt"));
        assertEquals("", routeParams.get("generation"));

        Map<String, Object> weatherParams = connection.executedParams.get(connection.executedParams.size() - 1);
        assertEquals(EXPIRES.toEpochMilli(), weatherParams.get("expiresAt"));
        assertEquals(CREATED.toEpochMilli(), weatherParams.get("createdAt"));
        assertEquals("gfs", weatherParams.get("generation"));
    }

    @Test
    @DisplayName("Should map a stored row back to an entry")
    void shouldReadEntry() {
        connection.respondWith((query, params) -> {
            if (!query.contains("RETURN c.payload")) {
                return List.of();
            }
            Map<String, Object> row = new HashMap<>();
            row.put("payload", "{\"temperature\":3.5}");
            row.put("createdAt", CREATED.toEpochMilli());
            row.put("expiresAt", EXPIRES.toEpochMilli());
            row.put("generation", "gfs");
            return List.of(row);
        });

        Optional<CacheEntry> entry = layer.get("weather:u4pru:202603101000:gfs");

        assertTrue(entry.isPresent());
        assertEquals("{\"temperature\":3.5}", entry.get().payload());
        assertEquals(EXPIRES, entry.get().expiresAt());
        assertEquals("gfs", entry.get().generation());
    }

    @Test
    @DisplayName("Should read an entry without expiry")
    void shouldReadEntryWithoutExpiry() {
        connection.respondWith((query, params) -> {
            Map<String, Object> row = new HashMap<>();
            row.put("payload", "{}");
            row.put("createdAt", CREATED.toEpochMilli());
            row.put("expiresAt", -1L);
            row.put("generation", "");
            return List.of(row);
        });

        CacheEntry entry = layer.get("route:1:2").orElseThrow();
        assertFalse(entry.hasExpiry());
        assertNull(entry.generation());
    }

    @Test
    @DisplayName("Should return empty for an unknown key")
    void shouldMissUnknownKey() {
        assertTrue(layer.get("route:9:9").isEmpty());
        assertEquals("route:9:9", connection.executedParams.get(connection.executedParams.size() - 1).get("key"));
    }

    @Test
    @DisplayName("Should report removed counts from delete queries")
    void shouldCountRemovals() {
        connection.respondWith((query, params) -> query.contains("DELETE c")
                ? List.of(Map.of("removed", 3L)) : List.of());

        assertTrue(layer.invalidate("route:1:2"));
        assertEquals(3, layer.invalidatePrefix("weather:u4pru:"));
        assertEquals(3, layer.purgeExpired(EXPIRES));
        assertEquals("weather:u4pru:", connection.executedParams.get(connection.executedParams.size() - 2).get("prefix"));
    }

    @Test
    @DisplayName("Should wrap store failures as layer-down errors")
    void shouldWrapFailures() {
        connection.setFailing(true);

        CacheLayerDownException e = assertThrows(CacheLayerDownException.class, () -> layer.get("route:1:2"));
        assertEquals("durable", e.getLayer());
        assertThrows(CacheLayerDownException.class,
                () -> layer.put(new CacheEntry("route:1:2", "{}", CREATED, null, null)));
    }

    @Test
    @DisplayName("Should reject invalid keys before touching the store")
    void shouldRejectInvalidKey() {
        int before = connection.executedQueries.size();

        assertThrows(IllegalArgumentException.class,
                () -> layer.put(new CacheEntry("bad\nkey", "{}", CREATED, null, null)));
        assertEquals(before, connection.executedQueries.size());
    }

    @Test
    @DisplayName("Should follow the connection for availability")
    void shouldReportAvailability() {
        assertTrue(layer.isAvailable());
        connection.setConnected(false);
        assertFalse(layer.isAvailable());
    }
}
