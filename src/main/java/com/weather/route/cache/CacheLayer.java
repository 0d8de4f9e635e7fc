package com.weather.route.cache;

import com.weather.route.core.error.CacheLayerDownException;
import com.weather.route.core.model.CacheEntry;

import java.time.Instant;
import java.util.Optional;

/**
 * One tier of the {@link TieredCache}. Every method may throw {@link CacheLayerDownException}
 * when the backing store cannot be reached.
 */
public interface CacheLayer {

    /**
     * Short name used in stats, metrics and logs (e.g. "fast", "durable").
     */
    String name();

    /**
     * Returns the stored entry. Durable layers may return entries past their expiry;
     * the caller decides whether an expired entry is usable.
     */
    Optional<CacheEntry> get(String key);

    void put(CacheEntry entry);

    /**
     * @return true if an entry was removed
     */
    boolean invalidate(String key);

    /**
     * Removes every entry whose key starts with {@code prefix}.
     *
     * @return number of removed entries
     */
    int invalidatePrefix(String prefix);

    /**
     * Removes entries whose expiry is at or before {@code now}. Entries without expiry stay.
     *
     * @return number of removed entries
     */
    int purgeExpired(Instant now);

    long size();

    /**
     * Cheap reachability check; never throws.
     */
    boolean isAvailable();
}
