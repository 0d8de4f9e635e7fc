package com.weather.route.api;

/**
 * Counters of {@link WeatherSegmentCache}.
 *
 * @param requests        single lookups, bulk lookups count each distinct key once
 * @param cacheHits       answered by the tiered cache
 * @param cacheMisses     went through the single-flight gate
 * @param staleServes     provider failed and a recent expired entry was served instead
 * @param providerCalls   calls to the weather provider
 * @param pastHourFetches requests for an hour already over, fetched without caching
 * @param modelRefreshes  cells invalidated because the provider reported a new model generation
 * @param failures        lookups that ended with an error
 */
public record WeatherStats(long requests, long cacheHits, long cacheMisses, long staleServes, long providerCalls,
                           long pastHourFetches, long modelRefreshes, long failures) {

    public double cacheHitRate() {
        return requests > 0 ? (double) cacheHits / requests : 0.0;
    }
}
