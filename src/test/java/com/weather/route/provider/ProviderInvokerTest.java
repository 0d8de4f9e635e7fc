package com.weather.route.provider;

import com.weather.route.core.error.ProviderUnavailableException;
import com.weather.route.metrics.MicrometerMetricsService;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ProviderInvokerTest {

    private SimpleMeterRegistry registry;
    private ProviderInvoker invoker;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        invoker = new ProviderInvoker(Duration.ofMillis(200), new MicrometerMetricsService(registry));
    }

    @AfterEach
    void tearDown() {
        invoker.close();
    }

    private long calls(String provider, String outcome) {
        Timer timer = registry.find("weather.route.provider.calls").tag("provider", provider).tag("outcome", outcome).timer();
        return timer == null ? 0 : timer.count();
    }

    @Test
    @DisplayName("Should return the provider result")
    void shouldReturnResult() {
        assertEquals("ok", invoker.invoke("weather", () -> "ok"));
        assertEquals(1, calls("weather", "success"));
    }

    @Test
    @DisplayName("Should give up after the timeout")
    void shouldTimeOut() {
        long started = System.nanoTime();

        ProviderUnavailableException e = assertThrows(ProviderUnavailableException.class,
                () -> invoker.invoke("routing", () -> {
                    try {
                        Thread.sleep(5_000);
                    } catch (InterruptedException interrupted) {
                        Thread.currentThread().interrupt();
                    }
                    return "late";
                }));

        assertTrue(e.getMessage().contains("timed out"));
        assertTrue(Duration.ofNanos(System.nanoTime() - started).compareTo(Duration.ofSeconds(2)) < 0);
        assertEquals(1, calls("routing", "timeout"));
    }

    @Test
    @DisplayName("Should wrap provider exceptions")
    void shouldWrapFailures() {
        ProviderUnavailableException e = assertThrows(ProviderUnavailableException.class,
                () -> invoker.invoke("places", () -> {
                    throw new IllegalStateException("HTTP 503");
                }));

        assertInstanceOf(IllegalStateException.class, e.getCause());
        assertTrue(e.getMessage().contains("HTTP 503"));
        assertEquals(1, calls("places", "failure"));
    }

    @Test
    @DisplayName("Should treat a null result as unavailable")
    void shouldRejectNullResult() {
        assertThrows(ProviderUnavailableException.class, () -> invoker.invoke("weather", () -> null));
        assertEquals(1, calls("weather", "failure"));
    }

    @Test
    @DisplayName("Should reject a non-positive timeout")
    void shouldRejectBadTimeout() {
        assertThrows(IllegalArgumentException.class, () -> new ProviderInvoker(Duration.ZERO));
    }
}
