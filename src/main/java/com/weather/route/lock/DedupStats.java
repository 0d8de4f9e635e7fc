package com.weather.route.lock;

/**
 * Counters of the single-flight gate.
 *
 * @param leaders          callers elected Leader
 * @param followers        callers that waited on another caller's fetch
 * @param followerTimeouts followers that gave up waiting and fetched on their own
 * @param leaderFailures   Leader fetches that failed
 * @param unguardedLeaders Leaders that ran without a distributed lease because the lock store was down
 * @param inFlight         keys currently being fetched
 */
public record DedupStats(long leaders, long followers, long followerTimeouts,
                         long leaderFailures, long unguardedLeaders, int inFlight) {

    /**
     * Share of callers that did not trigger their own origin fetch.
     */
    public double dedupRate() {
        long total = leaders + followers;
        if (total == 0) {
            return 0.0;
        }
        return (double) (followers - followerTimeouts) / total;
    }
}
