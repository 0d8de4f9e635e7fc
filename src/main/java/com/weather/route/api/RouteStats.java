package com.weather.route.api;

/**
 * Counters of {@link RouteCacheCoordinator}.
 *
 * @param requests           route lookups served or attempted
 * @param cacheHits          lookups answered by the tiered cache
 * @param graphComputations  shortest-path searches that found a route in the local graph
 * @param providerCalls      calls to the routing provider
 * @param injections         provider routes injected into the graph
 * @param failures           lookups that ended with an error
 */
public record RouteStats(long requests, long cacheHits, long graphComputations, long providerCalls,
                         long injections, long failures) {

    public double cacheHitRate() {
        return requests > 0 ? (double) cacheHits / requests : 0.0;
    }
}
