package com.weather.route.core.error;

/**
 * A cache layer could not be reached. Thrown by layers only; the tiered cache absorbs it.
 */
public class CacheLayerDownException extends TripCacheException {

    private final String layer;

    public CacheLayerDownException(String layer, String message) {
        super(message);
        this.layer = layer;
    }

    public CacheLayerDownException(String layer, String message, Throwable cause) {
        super(message, cause);
        this.layer = layer;
    }

    public String getLayer() {
        return layer;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
