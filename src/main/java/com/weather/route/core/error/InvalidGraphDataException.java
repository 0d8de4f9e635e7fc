package com.weather.route.core.error;

/**
 * A write violated a graph constraint, e.g. an edge with non-positive distance or speed.
 * Never retried; nothing is persisted.
 */
public class InvalidGraphDataException extends TripCacheException {

    public InvalidGraphDataException(String message) {
        super(message);
    }

    public InvalidGraphDataException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
