package com.weather.route.cache;

import com.weather.route.core.error.CacheLayerDownException;
import com.weather.route.core.model.CacheEntry;
import com.weather.route.graph.GraphConnection;
import com.weather.route.graph.InputSanitizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable layer persisted as {@code :CacheEntry} nodes in FalkorDB.
 *
 * <p>Timestamps are stored as epoch milliseconds; {@code expiresAt = -1} marks an entry that never
 * expires. Nodes are only removed by explicit invalidation or {@link #purgeExpired(Instant)}.</p>
 */
public class GraphCacheLayer implements CacheLayer {
    private static final Logger log = LoggerFactory.getLogger(GraphCacheLayer.class);

    private static final long NO_EXPIRY = -1L;

    private final GraphConnection connection;

    public GraphCacheLayer(GraphConnection connection) {
        this.connection = connection;
        createIndexes();
    }

    private void createIndexes() {
        safeExecute("CREATE INDEX FOR (c:CacheEntry) ON (c.key)");
        safeExecute("CREATE INDEX FOR (c:CacheEntry) ON (c.expiresAt)");
    }

    private void safeExecute(String query) {
        try {
            connection.execute(query);
        } catch (Exception e) {
            log.debug("Index creation query result: {} - {}", query, e.getMessage());
        }
    }

    @Override
    public String name() {
        return "durable";
    }

    @Override
    public Optional<CacheEntry> get(String key) {
        String query = """
                MATCH (c:CacheEntry {key: $key})
                RETURN c.payload as payload, c.createdAt as createdAt,
                       c.expiresAt as expiresAt, c.generation as generation
                """;
        List<Map<String, Object>> rows = run(() -> connection.query(query, Map.of("key", key)), "get " + key);
        if (rows.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(mapToEntry(key, rows.get(0)));
    }

    @Override
    public void put(CacheEntry entry) {
        InputSanitizer.validateCacheKey(entry.key());
        InputSanitizer.validatePayload(entry.payload());
        String query = """
                MERGE (c:CacheEntry {key: $key})
                SET c.payload = $payload,
                    c.createdAt = $createdAt,
                    c.expiresAt = $expiresAt,
                    c.generation = $generation
                """;
        Map<String, Object> params = new HashMap<>();
        params.put("key", entry.key());
        params.put("payload", entry.payload());
        params.put("createdAt", entry.createdAt().toEpochMilli());
        params.put("expiresAt", entry.hasExpiry() ? entry.expiresAt().toEpochMilli() : NO_EXPIRY);
        params.put("generation", entry.generation() != null ? entry.generation() : "");
        run(() -> {
            connection.execute(query, params);
            return null;
        }, "put " + entry.key());
        log.debug("Persisted cache entry {}", entry.key());
    }

    @Override
    public boolean invalidate(String key) {
        String query = """
                MATCH (c:CacheEntry {key: $key})
                DELETE c
                RETURN count(c) as removed
                """;
        return removedCount(run(() -> connection.query(query, Map.of("key", key)), "invalidate " + key)) > 0;
    }

    @Override
    public int invalidatePrefix(String prefix) {
        String query = """
                MATCH (c:CacheEntry)
                WHERE c.key STARTS WITH $prefix
                DELETE c
                RETURN count(c) as removed
                """;
        int removed = removedCount(run(() -> connection.query(query, Map.of("prefix", prefix)),
                "invalidatePrefix " + prefix));
        log.debug("Invalidated {} durable entries with prefix {}", removed, prefix);
        return removed;
    }

    @Override
    public int purgeExpired(Instant now) {
        String query = """
                MATCH (c:CacheEntry)
                WHERE c.expiresAt >= 0 AND c.expiresAt <= $now
                DELETE c
                RETURN count(c) as removed
                """;
        return removedCount(run(() -> connection.query(query, Map.of("now", now.toEpochMilli())), "purgeExpired"));
    }

    @Override
    public long size() {
        List<Map<String, Object>> rows = run(
                () -> connection.query("MATCH (c:CacheEntry) RETURN count(c) as total"), "size");
        return rows.isEmpty() ? 0 : ((Number) rows.get(0).get("total")).longValue();
    }

    @Override
    public boolean isAvailable() {
        return connection.isConnected();
    }

    private CacheEntry mapToEntry(String key, Map<String, Object> row) {
        long expiresAt = ((Number) row.get("expiresAt")).longValue();
        String generation = (String) row.get("generation");
        return new CacheEntry(
                key,
                (String) row.get("payload"),
                Instant.ofEpochMilli(((Number) row.get("createdAt")).longValue()),
                expiresAt == NO_EXPIRY ? null : Instant.ofEpochMilli(expiresAt),
                generation == null || generation.isEmpty() ? null : generation
        );
    }

    private static int removedCount(List<Map<String, Object>> rows) {
        if (rows.isEmpty() || rows.get(0).get("removed") == null) {
            return 0;
        }
        return ((Number) rows.get(0).get("removed")).intValue();
    }

    private <T> T run(GraphCall<T> call, String operation) {
        try {
            return call.run();
        } catch (IllegalArgumentException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CacheLayerDownException(name(), "Durable layer failed on " + operation + ": " + e.getMessage(), e);
        }
    }

    @FunctionalInterface
    private interface GraphCall<T> {
        T run();
    }
}
