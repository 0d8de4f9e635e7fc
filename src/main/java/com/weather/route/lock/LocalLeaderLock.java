package com.weather.route.lock;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-process {@link LeaderLock} with TTL-based reclaim. Suitable for single-JVM deployments and tests.
 */
public class LocalLeaderLock implements LeaderLock {

    private final ConcurrentMap<String, Lease> leases = new ConcurrentHashMap<>();
    private final Clock clock;

    public LocalLeaderLock() {
        this(Clock.systemUTC());
    }

    public LocalLeaderLock(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<String> tryAcquire(String key, Duration ttl) {
        Instant now = clock.instant();
        Lease candidate = new Lease(UUID.randomUUID().toString(), now.plus(ttl));
        Lease winner = leases.compute(key, (k, current) ->
                current == null || !now.isBefore(current.expiresAt()) ? candidate : current);
        return winner == candidate ? Optional.of(candidate.token()) : Optional.empty();
    }

    @Override
    public void release(String key, String token) {
        leases.computeIfPresent(key, (k, current) -> current.token().equals(token) ? null : current);
    }

    /**
     * Number of leases currently held, expired ones included until reclaimed.
     */
    public int heldCount() {
        return leases.size();
    }

    private record Lease(String token, Instant expiresAt) {
    }
}
