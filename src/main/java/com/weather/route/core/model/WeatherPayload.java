package com.weather.route.core.model;

import java.time.Instant;

/**
 * Forecast for one cell and hour. Providers fill the measurements and model generation;
 * the cache stamps {@code cachedAt}/{@code expiresAt} and the stale flag.
 *
 * @param temperature     air temperature in degrees Celsius
 * @param condition       short condition text (e.g. "Clear", "Rain")
 * @param windSpeed       wind speed in km/h
 * @param humidity        relative humidity in percent
 * @param cachedAt        when the value entered the cache, {@code null} straight from a provider
 * @param expiresAt       top of the local hour after the forecast time
 * @param modelGeneration upstream forecast model run, {@code null} if unknown
 * @param stale           served from the grace window after a provider failure
 */
public record WeatherPayload(double temperature, String condition, double windSpeed, double humidity,
                             Instant cachedAt, Instant expiresAt, String modelGeneration, boolean stale) {

    public static WeatherPayload of(double temperature, String condition, double windSpeed, double humidity) {
        return new WeatherPayload(temperature, condition, windSpeed, humidity, null, null, null, false);
    }

    public WeatherPayload withModelGeneration(String generation) {
        return new WeatherPayload(temperature, condition, windSpeed, humidity, cachedAt, expiresAt, generation, stale);
    }

    public WeatherPayload withCacheWindow(Instant newCachedAt, Instant newExpiresAt) {
        return new WeatherPayload(temperature, condition, windSpeed, humidity,
                newCachedAt, newExpiresAt, modelGeneration, stale);
    }

    public WeatherPayload asStale() {
        return new WeatherPayload(temperature, condition, windSpeed, humidity,
                cachedAt, expiresAt, modelGeneration, true);
    }
}
