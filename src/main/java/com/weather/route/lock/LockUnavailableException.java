package com.weather.route.lock;

/**
 * Runtime exception thrown when the lock store cannot be reached.
 * The gate then proceeds without a distributed lease.
 */
public class LockUnavailableException extends RuntimeException {

    public LockUnavailableException(String message) {
        super(message);
    }

    public LockUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
