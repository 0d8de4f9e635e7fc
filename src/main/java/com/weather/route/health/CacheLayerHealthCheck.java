package com.weather.route.health;

import com.weather.route.cache.CacheLayer;
import com.weather.route.cache.LayerStats;
import com.weather.route.cache.TieredCache;
import com.weather.route.core.error.CacheLayerDownException;

/**
 * Checks both layers of a {@link TieredCache}. One layer down is DEGRADED, since lookups fall back
 * to the other; both down is DOWN, every lookup then goes to the origin.
 */
public class CacheLayerHealthCheck implements HealthCheck {

    static final String CHECK_KEY = "health:check";

    private final TieredCache cache;

    public CacheLayerHealthCheck(TieredCache cache) {
        this.cache = cache;
    }

    @Override
    public String getName() {
        return "cache";
    }

    @Override
    public HealthStatus check() {
        boolean fastUp = isReachable(cache.fastLayer());
        boolean durableUp = isReachable(cache.durableLayer());

        HealthStatus base;
        if (fastUp && durableUp) {
            base = HealthStatus.up();
        } else if (durableUp) {
            base = HealthStatus.degraded("Fast layer unavailable, serving from durable layer");
        } else if (fastUp) {
            base = HealthStatus.degraded("Durable layer unavailable, results are not persisted");
        } else {
            base = HealthStatus.down("Both cache layers unavailable");
        }
        LayerStats fast = cache.fastStats();
        LayerStats durable = cache.durableStats();
        return base
                .withDetail(fast.layer() + ".available", fastUp)
                .withDetail(fast.layer() + ".hitRate", Math.round(fast.hitRate() * 1000.0) / 10.0)
                .withDetail(fast.layer() + ".errors", fast.errorCount())
                .withDetail(durable.layer() + ".available", durableUp)
                .withDetail(durable.layer() + ".hitRate", Math.round(durable.hitRate() * 1000.0) / 10.0)
                .withDetail(durable.layer() + ".errors", durable.errorCount());
    }

    private static boolean isReachable(CacheLayer layer) {
        if (!layer.isAvailable()) {
            return false;
        }
        try {
            layer.get(CHECK_KEY);
            return true;
        } catch (CacheLayerDownException e) {
            return false;
        }
    }
}
