package com.weather.route.metrics;

import java.time.Duration;

/**
 * Records engine metrics. The default {@link NoOpMetricsService} does nothing, so the engine runs
 * without a meter registry.
 */
public interface MetricsService {

    /**
     * @param layer cache layer name ("fast", "durable")
     * @param hit   whether the layer answered the lookup
     */
    void recordCacheLookup(String layer, boolean hit);

    void recordCacheLayerFailure(String layer);

    /**
     * @param role "leader", "follower", "follower_timeout" or "unguarded"
     */
    void recordSingleflight(String role);

    /**
     * @param provider "weather", "routing" or "places"
     * @param outcome  "success", "failure" or "timeout"
     */
    void recordProviderCall(String provider, String outcome, Duration duration);

    void recordPathSearch(Duration duration, int settledNodes, boolean found);

    void recordStaleServe();

    void recordGraphInjection(int nodes, int edges);
}
