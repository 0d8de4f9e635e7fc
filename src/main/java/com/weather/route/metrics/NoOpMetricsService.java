package com.weather.route.metrics;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordCacheLookup(String layer, boolean hit) {
    }

    @Override
    public void recordCacheLayerFailure(String layer) {
    }

    @Override
    public void recordSingleflight(String role) {
    }

    @Override
    public void recordProviderCall(String provider, String outcome, Duration duration) {
    }

    @Override
    public void recordPathSearch(Duration duration, int settledNodes, boolean found) {
    }

    @Override
    public void recordStaleServe() {
    }

    @Override
    public void recordGraphInjection(int nodes, int edges) {
    }
}
