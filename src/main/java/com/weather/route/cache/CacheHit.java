package com.weather.route.cache;

import com.weather.route.core.model.CacheEntry;

/**
 * A decoded value together with the entry it came from.
 *
 * @param value the decoded payload
 * @param entry the raw entry (timestamps, generation)
 * @param tier  layer that answered
 * @param stale whether the entry was already past its expiry
 */
public record CacheHit<V>(V value, CacheEntry entry, Tier tier, boolean stale) {

    public enum Tier { FAST, DURABLE }
}
