package com.weather.route.lock;

/**
 * Configuration for the graph-backed leader lock.
 *
 * @param maxAttempts  attempts per acquisition when the store errors out
 * @param retryDelayMs delay between attempts in milliseconds
 */
public record LockConfig(int maxAttempts, long retryDelayMs) {

    public LockConfig {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be > 0");
        }
        if (retryDelayMs < 0) {
            throw new IllegalArgumentException("retryDelayMs must be >= 0");
        }
    }

    /**
     * Default configuration: 3 attempts, 50ms apart.
     */
    public static LockConfig defaults() {
        return new LockConfig(3, 50);
    }
}
