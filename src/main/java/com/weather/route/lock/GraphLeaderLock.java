package com.weather.route.lock;

import com.weather.route.graph.GraphConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * FalkorDB MERGE-based {@link LeaderLock} for multi-JVM deployments.
 *
 * <p>Uses a {@code :Lock} node per key with atomic MERGE for check-and-set. A lease whose
 * {@code expiresAt} has passed is taken over by the next caller.</p>
 */
public class GraphLeaderLock implements LeaderLock {
    private static final Logger log = LoggerFactory.getLogger(GraphLeaderLock.class);

    private final GraphConnection connection;
    private final LockConfig config;
    private final Clock clock;
    private final String instanceId;

    public GraphLeaderLock(GraphConnection connection) {
        this(connection, LockConfig.defaults(), Clock.systemUTC());
    }

    public GraphLeaderLock(GraphConnection connection, LockConfig config, Clock clock) {
        this.connection = connection;
        this.config = config;
        this.clock = clock;
        this.instanceId = ProcessHandle.current().pid() + "-" + UUID.randomUUID().toString().substring(0, 8);
        createLockIndex();
    }

    @Override
    public Optional<String> tryAcquire(String key, Duration ttl) {
        String token = instanceId + "-" + UUID.randomUUID();
        RuntimeException lastFailure = null;

        for (int attempt = 1; attempt <= config.maxAttempts(); attempt++) {
            try {
                boolean granted = attemptLock(key, token, ttl);
                log.debug("Lock {} for {} (attempt {})", granted ? "granted" : "held elsewhere", key, attempt);
                return granted ? Optional.of(token) : Optional.empty();
            } catch (RuntimeException e) {
                lastFailure = e;
                log.debug("Lock attempt {} failed for {}: {}", attempt, key, e.getMessage());
            }
            if (attempt < config.maxAttempts()) {
                sleep(key);
            }
        }
        throw new LockUnavailableException("Lock store unavailable for key '" + key + "' after "
                + config.maxAttempts() + " attempts", lastFailure);
    }

    @Override
    public void release(String key, String token) {
        String query = """
                MATCH (l:Lock {key: $key, owner: $owner})
                DELETE l
                """;
        try {
            connection.execute(query, Map.of("key", key, "owner", token));
            log.debug("Lock released: {}", key);
        } catch (Exception e) {
            log.warn("Failed to release lock {}: {}", key, e.getMessage());
        }
    }

    private boolean attemptLock(String key, String token, Duration ttl) {
        long now = clock.millis();
        long expiresAt = now + ttl.toMillis();

        String query = """
                MERGE (l:Lock {key: $key})
                ON CREATE SET l.owner = $owner, l.acquiredAt = $now, l.expiresAt = $expiresAt
                ON MATCH SET l.owner = CASE
                    WHEN l.expiresAt <= $now THEN $owner
                    ELSE l.owner
                END,
                l.acquiredAt = CASE
                    WHEN l.expiresAt <= $now THEN $now
                    ELSE l.acquiredAt
                END,
                l.expiresAt = CASE
                    WHEN l.expiresAt <= $now THEN $expiresAt
                    ELSE l.expiresAt
                END
                RETURN l.owner as owner
                """;

        List<Map<String, Object>> rows = connection.query(query, Map.of(
                "key", key,
                "owner", token,
                "now", now,
                "expiresAt", expiresAt
        ));
        return !rows.isEmpty() && token.equals(rows.get(0).get("owner"));
    }

    private void sleep(String key) {
        try {
            Thread.sleep(config.retryDelayMs());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockUnavailableException("Interrupted while acquiring lock for: " + key, e);
        }
    }

    private void createLockIndex() {
        try {
            connection.execute("CREATE INDEX FOR (l:Lock) ON (l.key)");
        } catch (Exception e) {
            log.debug("Lock index creation: {}", e.getMessage());
        }
    }
}
