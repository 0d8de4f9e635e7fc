package com.weather.route.api;

import com.weather.route.cache.LayerStats;
import com.weather.route.lock.DedupStats;

import java.time.Instant;

/**
 * Point-in-time snapshot of engine counters, for an admin surface to format.
 */
public record EngineStats(Instant capturedAt, LayerStats fastLayer, LayerStats durableLayer,
                          DedupStats singleflight, RouteStats routes, WeatherStats weather,
                          int places, int nodes, int edges) {
}
