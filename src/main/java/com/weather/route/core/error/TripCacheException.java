package com.weather.route.core.error;

/**
 * Root of the engine's failure taxonomy. Every failure that leaves a top-level call is one of
 * its subclasses, so callers can tell retryable outages from permanent rejections.
 */
public abstract class TripCacheException extends RuntimeException {

    protected TripCacheException(String message) {
        super(message);
    }

    protected TripCacheException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Whether repeating the same call later may succeed.
     */
    public abstract boolean isRetryable();
}
