package com.weather.route.provider;

import com.weather.route.core.model.WeatherPayload;

import java.time.Instant;

/**
 * Upstream forecast source. Implementations wrap an HTTP client; the engine only relies on this
 * contract and bounds every call with {@link ProviderInvoker}.
 */
public interface WeatherProvider {

    /**
     * Forecast for the hour containing {@code timestamp} at the given position.
     * The returned payload should carry the provider's model generation when it is known.
     *
     * @throws RuntimeException on any upstream failure
     */
    WeatherPayload fetch(double lat, double lon, Instant timestamp);

    default String getProviderName() {
        return "weather";
    }
}
