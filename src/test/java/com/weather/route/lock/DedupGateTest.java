package com.weather.route.lock;

import com.weather.route.core.error.ProviderUnavailableException;
import com.weather.route.fakes.MutableClock;
import com.weather.route.metrics.NoOpMetricsService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DedupGateTest {

    private static final Duration LOCK_TTL = Duration.ofSeconds(30);

    @Mock
    private LeaderLock remoteLock;

    private DedupGate gate;
    private ExecutorService executor;
    private final Map<String, String> store = new ConcurrentHashMap<>();

    @BeforeEach
    void setUp() {
        gate = new DedupGate(new LocalLeaderLock(), Duration.ofSeconds(5), Duration.ofMillis(20));
        executor = Executors.newFixedThreadPool(50);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
        gate.close();
    }

    @Nested
    @DisplayName("Single flight")
    class SingleFlight {

        @Test
        @DisplayName("Should run one origin fetch for fifty concurrent callers")
        void shouldCollapseConcurrentCalls() throws Exception {
            AtomicInteger fetches = new AtomicInteger();
            CountDownLatch start = new CountDownLatch(1);
            List<Future<String>> results = new ArrayList<>();

            for (int i = 0; i < 50; i++) {
                results.add(executor.submit(() -> {
                    start.await();
                    return gate.execute("weather:u4pru:202603101000:gfs", LOCK_TTL,
                            () -> Optional.ofNullable(store.get("k")),
                            () -> {
                                fetches.incrementAndGet();
                                sleep(200);
                                store.put("k", "sunny");
                                return "sunny";
                            });
                }));
            }
            start.countDown();

            for (Future<String> result : results) {
                assertEquals("sunny", result.get(10, TimeUnit.SECONDS));
            }
            assertEquals(1, fetches.get());
            DedupStats stats = gate.stats();
            assertEquals(0, stats.inFlight());
            assertEquals(50, stats.leaders() + stats.followers());
        }

        @Test
        @DisplayName("Should fetch independently for different keys")
        void shouldNotShareAcrossKeys() {
            AtomicInteger fetches = new AtomicInteger();

            gate.execute("a", LOCK_TTL, Optional::empty, () -> "A" + fetches.incrementAndGet());
            gate.execute("b", LOCK_TTL, Optional::empty, () -> "B" + fetches.incrementAndGet());

            assertEquals(2, fetches.get());
            assertEquals(2, gate.stats().leaders());
        }

        @Test
        @DisplayName("Should answer from the cache lookup before calling the loader")
        void shouldCheckCacheBeforeLoading() {
            store.put("k", "cached");

            String value = gate.execute("k", LOCK_TTL, () -> Optional.ofNullable(store.get("k")),
                    () -> fail("loader must not run"));

            assertEquals("cached", value);
        }
    }

    @Nested
    @DisplayName("Abandoned flights")
    class AbandonedFlights {

        @Test
        @DisplayName("Should elect a new Leader once the stuck Leader's flight outlives the lock TTL")
        void shouldReplaceStuckLeader() throws Exception {
            MutableClock clock = MutableClock.at("2026-03-10T10:00:00Z");
            DedupGate timedGate = new DedupGate(new LocalLeaderLock(clock), Duration.ofSeconds(5),
                    Duration.ofMillis(20), clock, new NoOpMetricsService());
            Duration ttl = Duration.ofSeconds(10);
            CountDownLatch stuckStarted = new CountDownLatch(1);
            CountDownLatch unstick = new CountDownLatch(1);
            try {
                Future<String> stuck = executor.submit(() -> timedGate.execute("route:1:2", ttl,
                        Optional::empty,
                        () -> {
                            stuckStarted.countDown();
                            await(unstick);
                            return "stale";
                        }));
                assertTrue(stuckStarted.await(5, TimeUnit.SECONDS));

                clock.advance(Duration.ofSeconds(11));
                String fresh = timedGate.execute("route:1:2", ttl, Optional::empty, () -> "fresh");

                assertEquals("fresh", fresh);
                assertEquals(2, timedGate.stats().leaders());
                assertEquals(0, timedGate.stats().followers());

                unstick.countDown();
                assertEquals("stale", stuck.get(5, TimeUnit.SECONDS));
            } finally {
                unstick.countDown();
                timedGate.close();
            }
        }

        @Test
        @DisplayName("Should keep following a Leader that is still within the lock TTL")
        void shouldFollowLiveLeader() throws Exception {
            MutableClock clock = MutableClock.at("2026-03-10T10:00:00Z");
            DedupGate timedGate = new DedupGate(new LocalLeaderLock(clock), Duration.ofSeconds(5),
                    Duration.ofMillis(20), clock, new NoOpMetricsService());
            Duration ttl = Duration.ofSeconds(10);
            CountDownLatch leaderStarted = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            try {
                Future<String> leader = executor.submit(() -> timedGate.execute("route:1:2", ttl,
                        Optional::empty,
                        () -> {
                            leaderStarted.countDown();
                            await(release);
                            return "shared";
                        }));
                assertTrue(leaderStarted.await(5, TimeUnit.SECONDS));

                clock.advance(Duration.ofSeconds(9));
                Future<String> follower = executor.submit(() ->
                        timedGate.execute("route:1:2", ttl, Optional::empty, () -> "own"));
                long deadline = System.currentTimeMillis() + 5_000;
                while (timedGate.stats().followers() == 0 && System.currentTimeMillis() < deadline) {
                    Thread.sleep(10);
                }
                release.countDown();

                assertEquals("shared", leader.get(5, TimeUnit.SECONDS));
                assertEquals("shared", follower.get(5, TimeUnit.SECONDS));
                assertEquals(1, timedGate.stats().leaders());
            } finally {
                release.countDown();
                timedGate.close();
            }
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("Should propagate a leader failure to its followers")
        void shouldPropagateLeaderFailure() throws Exception {
            CountDownLatch loaderStarted = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);

            Future<String> leader = executor.submit(() -> gate.<String>execute("k", LOCK_TTL, Optional::empty, () -> {
                loaderStarted.countDown();
                await(release);
                throw new ProviderUnavailableException("upstream down");
            }));
            assertTrue(loaderStarted.await(5, TimeUnit.SECONDS));

            Future<String> follower = executor.submit(() -> gate.execute("k", LOCK_TTL, Optional::empty,
                    () -> "follower should not fetch"));
            sleep(100);
            release.countDown();

            Exception leaderError = assertThrows(Exception.class, () -> leader.get(5, TimeUnit.SECONDS));
            assertInstanceOf(ProviderUnavailableException.class, leaderError.getCause());
            Exception followerError = assertThrows(Exception.class, () -> follower.get(5, TimeUnit.SECONDS));
            assertInstanceOf(ProviderUnavailableException.class, followerError.getCause());
            assertEquals(1, gate.stats().leaderFailures());
            assertEquals(0, gate.stats().inFlight());
        }

        @Test
        @DisplayName("Should let a follower fetch on its own after the wait timeout")
        void shouldFetchAfterFollowerTimeout() throws Exception {
            DedupGate impatient = new DedupGate(new LocalLeaderLock(), Duration.ofMillis(150), Duration.ofMillis(20));
            CountDownLatch loaderStarted = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            try {
                Future<String> leader = executor.submit(() -> impatient.execute("k", LOCK_TTL, Optional::empty, () -> {
                    loaderStarted.countDown();
                    await(release);
                    return "leader";
                }));
                assertTrue(loaderStarted.await(5, TimeUnit.SECONDS));

                String own = impatient.execute("k", LOCK_TTL, Optional::empty, () -> "own");

                assertEquals("own", own);
                assertEquals(1, impatient.stats().followerTimeouts());
                release.countDown();
                assertEquals("leader", leader.get(5, TimeUnit.SECONDS));
            } finally {
                release.countDown();
                impatient.close();
            }
        }

        @Test
        @DisplayName("Should fetch without a lease when the lock store is down")
        void shouldRunUnguardedWhenLockDown() {
            when(remoteLock.tryAcquire(anyString(), any())).thenThrow(new LockUnavailableException("store down"));
            DedupGate unguarded = new DedupGate(remoteLock, Duration.ofSeconds(1), Duration.ofMillis(20));
            try {
                assertEquals("value", unguarded.execute("k", LOCK_TTL, Optional::empty, () -> "value"));
                assertEquals(1, unguarded.stats().unguardedLeaders());
                verify(remoteLock, never()).release(anyString(), anyString());
            } finally {
                unguarded.close();
            }
        }
    }

    @Nested
    @DisplayName("Remote leader")
    class RemoteLeader {

        @Test
        @DisplayName("Should poll the cache while another process holds the lease")
        void shouldPollCacheForRemoteLeader() {
            when(remoteLock.tryAcquire(anyString(), any())).thenReturn(Optional.empty());
            DedupGate follower = new DedupGate(remoteLock, Duration.ofSeconds(2), Duration.ofMillis(10));
            AtomicInteger lookups = new AtomicInteger();
            AtomicInteger loads = new AtomicInteger();
            try {
                String value = follower.execute("k", LOCK_TTL,
                        () -> lookups.incrementAndGet() >= 3 ? Optional.of("remote") : Optional.empty(),
                        () -> "local" + loads.incrementAndGet());

                assertEquals("remote", value);
                assertEquals(0, loads.get());
                assertEquals(1, follower.stats().followers());
            } finally {
                follower.close();
            }
        }

        @Test
        @DisplayName("Should release the lease after the leader finishes")
        void shouldReleaseLease() {
            when(remoteLock.tryAcquire(eq("k"), any())).thenReturn(Optional.of("token-1"));
            DedupGate leader = new DedupGate(remoteLock, Duration.ofSeconds(1), Duration.ofMillis(10));
            try {
                leader.execute("k", LOCK_TTL, Optional::empty, () -> "v");

                verify(remoteLock, timeout(1000)).release("k", "token-1");
            } finally {
                leader.close();
            }
        }
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
