package com.weather.route.core.error;

/**
 * No path exists between the requested places, or a referenced place or node is unknown.
 */
public class NotFoundException extends TripCacheException {

    public NotFoundException(String message) {
        super(message);
    }

    public NotFoundException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
