package com.weather.route.lock;

import com.weather.route.core.error.ProviderUnavailableException;
import com.weather.route.metrics.MetricsService;
import com.weather.route.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Single-flight gate: at most one origin fetch per key is in flight.
 *
 * <p>Election happens in two steps. Inside the JVM, the first caller registers a flight for the key
 * and every later caller follows it through the flight's completion future. The flight owner then
 * asks the {@link LeaderLock} for the cross-process lease. With the lease it is the Leader; without
 * it another process is fetching, so the owner polls the cache like any remote follower and hands
 * what it finds to its local followers.</p>
 *
 * <p>Followers wait at most the follower timeout and then fetch on their own. A flight older than
 * its lock TTL is considered abandoned and replaced by the next caller. The Leader's fetch runs on
 * the gate's own executor, so an interrupted caller does not cancel it: the fetch still completes
 * and writes the cache.</p>
 */
public class DedupGate implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(DedupGate.class);

    public enum Role { LEADER, FOLLOWER }

    private final LeaderLock leaderLock;
    private final Duration followerWaitTimeout;
    private final Duration followerPollInterval;
    private final Clock clock;
    private final MetricsService metricsService;
    private final ExecutorService fetchExecutor;
    private final ConcurrentMap<String, Flight> inFlight = new ConcurrentHashMap<>();

    private final AtomicLong leaders = new AtomicLong();
    private final AtomicLong followers = new AtomicLong();
    private final AtomicLong followerTimeouts = new AtomicLong();
    private final AtomicLong leaderFailures = new AtomicLong();
    private final AtomicLong unguardedLeaders = new AtomicLong();

    public DedupGate(LeaderLock leaderLock, Duration followerWaitTimeout, Duration followerPollInterval) {
        this(leaderLock, followerWaitTimeout, followerPollInterval, Clock.systemUTC(), new NoOpMetricsService());
    }

    public DedupGate(LeaderLock leaderLock, Duration followerWaitTimeout, Duration followerPollInterval,
                     Clock clock, MetricsService metricsService) {
        this.leaderLock = Objects.requireNonNull(leaderLock, "leaderLock is required");
        this.followerWaitTimeout = requirePositive(followerWaitTimeout, "followerWaitTimeout");
        this.followerPollInterval = requirePositive(followerPollInterval, "followerPollInterval");
        this.clock = clock;
        this.metricsService = metricsService;
        this.fetchExecutor = Executors.newCachedThreadPool(new FetchThreadFactory());
    }

    /**
     * Elects the caller as Leader or Follower for {@code key}.
     * The returned ticket must be closed; closing a ticket that owns the flight without publishing fails its
     * followers, so they stop waiting and fetch on their own.
     */
    public Ticket acquire(String key, Duration leaderLockTtl) {
        Objects.requireNonNull(key, "key is required");
        requirePositive(leaderLockTtl, "leaderLockTtl");

        Instant now = clock.instant();
        Flight candidate = new Flight(now.plus(leaderLockTtl));
        Flight flight = inFlight.compute(key, (k, current) ->
                current == null || current.isAbandoned(now) ? candidate : current);

        if (flight != candidate) {
            return new Ticket(key, Role.FOLLOWER, flight, false, null);
        }

        try {
            Optional<String> token = leaderLock.tryAcquire(key, leaderLockTtl);
            if (token.isPresent()) {
                return new Ticket(key, Role.LEADER, candidate, true, token.get());
            }
            // Another process holds the lease; this caller follows it on behalf of local followers.
            return new Ticket(key, Role.FOLLOWER, candidate, true, null);
        } catch (LockUnavailableException e) {
            unguardedLeaders.incrementAndGet();
            metricsService.recordSingleflight("unguarded");
            log.warn("Leader lock unavailable for {}, fetching without distributed lease: {}", key, e.getMessage());
            return new Ticket(key, Role.LEADER, candidate, true, null);
        } catch (RuntimeException e) {
            inFlight.remove(key, candidate);
            candidate.result.completeExceptionally(e);
            throw e;
        }
    }

    /**
     * Runs {@code loader} at most once per key across concurrent callers.
     *
     * @param key           dedup key, usually the cache key
     * @param leaderLockTtl lease TTL for the Leader
     * @param cacheLookup    reads the value from the cache; used by followers of a remote Leader
     * @param loader        fetches from the origin and writes the cache
     */
    public <T> T execute(String key, Duration leaderLockTtl, Supplier<Optional<T>> cacheLookup, Supplier<T> loader) {
        try (Ticket ticket = acquire(key, leaderLockTtl)) {
            if (ticket.isLeader()) {
                leaders.incrementAndGet();
                metricsService.recordSingleflight("leader");
                ticket.fetchRunning = true;
                // Re-check the cache: a flight that just finished may have written it.
                CompletableFuture.supplyAsync(() -> cacheLookup.get().orElseGet(loader), fetchExecutor)
                        .whenComplete((value, error) -> {
                            if (error != null) {
                                ticket.fail(unwrap(error));
                            } else {
                                ticket.publish(value);
                            }
                        });
                return ticket.awaitOwnFlight();
            }

            followers.incrementAndGet();
            metricsService.recordSingleflight("follower");
            Optional<T> shared = ticket.await(cacheLookup, followerWaitTimeout);
            if (shared.isPresent()) {
                return shared.get();
            }

            followerTimeouts.incrementAndGet();
            metricsService.recordSingleflight("follower_timeout");
            log.warn("Follower wait for {} timed out after {}, fetching independently", key, followerWaitTimeout);
            try {
                T value = loader.get();
                ticket.publish(value);
                return value;
            } catch (RuntimeException e) {
                ticket.fail(e);
                throw e;
            }
        }
    }

    public DedupStats stats() {
        return new DedupStats(leaders.get(), followers.get(), followerTimeouts.get(),
                leaderFailures.get(), unguardedLeaders.get(), inFlight.size());
    }

    @Override
    public void close() {
        fetchExecutor.shutdown();
        try {
            if (!fetchExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                fetchExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            fetchExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("DedupGate closed");
    }

    /**
     * Outcome of {@link #acquire(String, Duration)}.
     */
    public final class Ticket implements AutoCloseable {
        private final String key;
        private final Role role;
        private final Flight flight;
        private final boolean ownsFlight;
        private final String leaseToken;
        private final AtomicInteger settled = new AtomicInteger();
        private volatile boolean fetchRunning;

        private Ticket(String key, Role role, Flight flight, boolean ownsFlight, String leaseToken) {
            this.key = key;
            this.role = role;
            this.flight = flight;
            this.ownsFlight = ownsFlight;
            this.leaseToken = leaseToken;
        }

        public String key() {
            return key;
        }

        public Role role() {
            return role;
        }

        public boolean isLeader() {
            return role == Role.LEADER;
        }

        /**
         * Completes the flight with a value and releases the lease. No-op for tickets that do not own the flight.
         */
        public void publish(Object value) {
            if (ownsFlight && settled.compareAndSet(0, 1)) {
                flight.result.complete(value);
                finish();
            }
        }

        /**
         * Completes the flight exceptionally and releases the lease.
         */
        public void fail(Throwable cause) {
            if (ownsFlight && settled.compareAndSet(0, 1)) {
                if (isLeader()) {
                    leaderFailures.incrementAndGet();
                }
                flight.result.completeExceptionally(cause);
                finish();
            }
        }

        /**
         * Waits for the shared result. Local followers are woken by the flight owner; the owner of a flight
         * whose lease is held by another process polls {@code cacheLookup} instead.
         *
         * @return the shared value, or empty once {@code timeout} elapses
         */
        @SuppressWarnings("unchecked")
        public <T> Optional<T> await(Supplier<Optional<T>> cacheLookup, Duration timeout) {
            long deadline = System.nanoTime() + timeout.toNanos();
            while (true) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    return Optional.empty();
                }
                if (ownsFlight) {
                    Optional<T> cached = cacheLookup.get();
                    if (cached.isPresent()) {
                        publish(cached.get());
                        return cached;
                    }
                    sleep(Math.min(remaining, followerPollInterval.toNanos()));
                    continue;
                }
                try {
                    return Optional.ofNullable((T) flight.result.get(
                            Math.min(remaining, followerPollInterval.toNanos()), TimeUnit.NANOSECONDS));
                } catch (TimeoutException e) {
                    // keep waiting until the deadline
                } catch (ExecutionException e) {
                    throw rethrow(e.getCause());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new ProviderUnavailableException("Interrupted while waiting for " + key, e);
                }
            }
        }

        @SuppressWarnings("unchecked")
        private <T> T awaitOwnFlight() {
            try {
                return (T) flight.result.get();
            } catch (ExecutionException e) {
                throw rethrow(e.getCause());
            } catch (CancellationException e) {
                throw new ProviderUnavailableException("Fetch for " + key + " was cancelled", e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ProviderUnavailableException("Interrupted while fetching " + key, e);
            }
        }

        private void finish() {
            inFlight.remove(key, flight);
            if (leaseToken != null) {
                leaderLock.release(key, leaseToken);
            }
        }

        private void sleep(long nanos) {
            try {
                TimeUnit.NANOSECONDS.sleep(nanos);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ProviderUnavailableException("Interrupted while waiting for " + key, e);
            }
        }

        /**
         * An unsettled flight with a running fetch is left to that fetch's callback.
         */
        @Override
        public void close() {
            if (ownsFlight && !fetchRunning && settled.get() == 0) {
                fail(new ProviderUnavailableException("No result available for " + key));
            }
        }
    }

    private static RuntimeException rethrow(Throwable cause) {
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new ProviderUnavailableException("Fetch failed: " + cause.getMessage(), cause);
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }

    private static Duration requirePositive(Duration value, String name) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be > 0");
        }
        return value;
    }

    private static final class Flight {
        final CompletableFuture<Object> result = new CompletableFuture<>();
        final Instant abandonAfter;

        Flight(Instant abandonAfter) {
            this.abandonAfter = abandonAfter;
        }

        boolean isAbandoned(Instant now) {
            return !now.isBefore(abandonAfter);
        }
    }

    private static final class FetchThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "dedup-fetch-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
