package com.weather.route.core.error;

/**
 * An upstream provider (weather, routing, place discovery) timed out or failed.
 * Retryable.
 */
public class ProviderUnavailableException extends TripCacheException {

    public ProviderUnavailableException(String message) {
        super(message);
    }

    public ProviderUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
