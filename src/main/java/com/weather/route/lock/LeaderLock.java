package com.weather.route.lock;

import java.time.Duration;
import java.util.Optional;

/**
 * Per-key lease that elects the single leader allowed to fetch from the origin.
 * A lease expires on its own after its TTL, so a crashed holder cannot block other callers.
 */
public interface LeaderLock {

    /**
     * Tries to take the lease for {@code key} without waiting.
     *
     * @return an owner token if the lease was granted, empty if another holder has it
     * @throws LockUnavailableException if the lock store cannot be reached
     */
    Optional<String> tryAcquire(String key, Duration ttl);

    /**
     * Releases the lease if {@code token} still owns it. Never throws.
     */
    void release(String key, String token);
}
