package com.weather.route.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Unit stored by a cache layer.
 *
 * @param key        cache key
 * @param payload    serialized value (JSON)
 * @param createdAt  write time
 * @param expiresAt  logical expiry, {@code null} for entries that never expire
 * @param generation upstream generation tag, {@code null} when not applicable
 */
public record CacheEntry(String key, String payload, Instant createdAt, Instant expiresAt, String generation) {

    public CacheEntry {
        Objects.requireNonNull(key, "key is required");
        Objects.requireNonNull(payload, "payload is required");
        Objects.requireNonNull(createdAt, "createdAt is required");
        if (expiresAt != null && !expiresAt.isAfter(createdAt)) {
            throw new IllegalArgumentException(
                    "expiresAt must be after createdAt for key '" + key + "'");
        }
    }

    public boolean hasExpiry() {
        return expiresAt != null;
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    public CacheEntry withExpiresAt(Instant newExpiresAt) {
        return new CacheEntry(key, payload, createdAt, newExpiresAt, generation);
    }
}
