package com.weather.route.cache;

import com.weather.route.core.model.CacheEntry;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Durable-layer stand-in that lives in process memory. Nothing is evicted on its own;
 * expired entries stay readable until {@link #purgeExpired(Instant)} runs.
 */
public class InMemoryCacheLayer implements CacheLayer {

    private final String name;
    private final Map<String, CacheEntry> entries = new ConcurrentHashMap<>();

    public InMemoryCacheLayer() {
        this("durable");
    }

    public InMemoryCacheLayer(String name) {
        this.name = name;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Optional<CacheEntry> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public void put(CacheEntry entry) {
        entries.put(entry.key(), entry);
    }

    @Override
    public boolean invalidate(String key) {
        return entries.remove(key) != null;
    }

    @Override
    public int invalidatePrefix(String prefix) {
        int before = entries.size();
        entries.keySet().removeIf(key -> key.startsWith(prefix));
        return before - entries.size();
    }

    @Override
    public int purgeExpired(Instant now) {
        int before = entries.size();
        entries.values().removeIf(entry -> entry.isExpired(now));
        return before - entries.size();
    }

    @Override
    public long size() {
        return entries.size();
    }

    @Override
    public boolean isAvailable() {
        return true;
    }
}
