package com.weather.route.chaos;

import com.weather.route.cache.CacheLayer;
import com.weather.route.core.error.CacheLayerDownException;
import com.weather.route.core.model.CacheEntry;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Decorator around a {@link CacheLayer} that can be switched off to simulate an unreachable layer.
 * While down, every operation throws {@link CacheLayerDownException}.
 */
public class ChaosCacheLayer implements CacheLayer {

    private final CacheLayer delegate;
    private final AtomicBoolean down = new AtomicBoolean(false);
    private final AtomicInteger rejected = new AtomicInteger();

    public ChaosCacheLayer(CacheLayer delegate) {
        this.delegate = delegate;
    }

    public void setDown(boolean isDown) {
        down.set(isDown);
    }

    /**
     * Operations refused since construction.
     */
    public int rejectedOperations() {
        return rejected.get();
    }

    public CacheLayer delegate() {
        return delegate;
    }

    @Override
    public String name() {
        return delegate.name();
    }

    @Override
    public Optional<CacheEntry> get(String key) {
        failIfDown("get");
        return delegate.get(key);
    }

    @Override
    public void put(CacheEntry entry) {
        failIfDown("put");
        delegate.put(entry);
    }

    @Override
    public boolean invalidate(String key) {
        failIfDown("invalidate");
        return delegate.invalidate(key);
    }

    @Override
    public int invalidatePrefix(String prefix) {
        failIfDown("invalidatePrefix");
        return delegate.invalidatePrefix(prefix);
    }

    @Override
    public int purgeExpired(Instant now) {
        failIfDown("purgeExpired");
        return delegate.purgeExpired(now);
    }

    @Override
    public long size() {
        failIfDown("size");
        return delegate.size();
    }

    @Override
    public boolean isAvailable() {
        return !down.get() && delegate.isAvailable();
    }

    private void failIfDown(String operation) {
        if (down.get()) {
            rejected.incrementAndGet();
            throw new CacheLayerDownException(name(), "ChaosCacheLayer: simulated outage on " + operation);
        }
    }
}
