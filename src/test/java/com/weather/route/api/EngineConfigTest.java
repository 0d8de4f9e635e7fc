package com.weather.route.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class EngineConfigTest {

    @Nested
    @DisplayName("Defaults")
    class Defaults {

        @Test
        @DisplayName("Should expose the documented defaults")
        void shouldUseDefaults() {
            EngineConfig config = EngineConfig.defaults();

            assertEquals(5, config.getCellPrecision());
            assertEquals(7, config.getNodeIndexPrecision());
            assertEquals(Duration.ofHours(1), config.getStaleGraceWindow());
            assertEquals(Duration.ofSeconds(30), config.getLeaderLockTtl());
            assertEquals(Duration.ofHours(24), config.getRouteFastTtl());
            assertEquals(50.0, config.getNodeSnapToleranceMeters());
            assertEquals(8, config.getMaxParallelWeatherFetches());
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("Should reject out-of-range precision")
        void shouldRejectPrecision() {
            assertThrows(IllegalArgumentException.class, () -> EngineConfig.builder().cellPrecision(0));
            assertThrows(IllegalArgumentException.class, () -> EngineConfig.builder().cellPrecision(13));
        }

        @Test
        @DisplayName("Should require the node grid to be at least as fine as the weather grid")
        void shouldRejectCoarseNodeGrid() {
            assertThrows(IllegalArgumentException.class,
                    () -> EngineConfig.builder().cellPrecision(6).nodeIndexPrecision(5).build());
        }

        @Test
        @DisplayName("Should reject a poll interval longer than the follower wait")
        void shouldRejectPollInterval() {
            assertThrows(IllegalArgumentException.class, () -> EngineConfig.builder()
                    .followerWaitTimeout(Duration.ofSeconds(1))
                    .followerPollInterval(Duration.ofSeconds(2))
                    .build());
        }

        @Test
        @DisplayName("Should reject non-positive durations and values")
        void shouldRejectNonPositive() {
            assertThrows(IllegalArgumentException.class, () -> EngineConfig.builder().leaderLockTtl(Duration.ZERO));
            assertThrows(IllegalArgumentException.class, () -> EngineConfig.builder().defaultSpeedKmh(0));
            assertThrows(IllegalArgumentException.class, () -> EngineConfig.builder().maxParallelWeatherFetches(0));
            assertThrows(IllegalArgumentException.class, () -> EngineConfig.builder().nodeSnapToleranceMeters(-1));
        }

        @Test
        @DisplayName("Should allow a zero stale grace window")
        void shouldAllowZeroGrace() {
            EngineConfig config = EngineConfig.builder().staleGraceWindow(Duration.ZERO).build();
            assertEquals(Duration.ZERO, config.getStaleGraceWindow());
        }
    }

    @Nested
    @DisplayName("Properties")
    class FromProperties {

        @Test
        @DisplayName("Should read every key from a properties file")
        void shouldLoadPropertiesFile() throws IOException {
            Properties properties = new Properties();
            try (InputStream in = getClass().getResourceAsStream("/weather-route-test.properties")) {
                assertNotNull(in);
                properties.load(in);
            }

            EngineConfig config = EngineConfig.fromProperties(properties);

            assertEquals(4, config.getCellPrecision());
            assertEquals(50_000, config.getFastLayerMaxSize());
            assertEquals(Duration.ofMinutes(30), config.getStaleGraceWindow());
            assertEquals(Duration.ofSeconds(10), config.getLeaderLockTtl());
            assertEquals(Duration.ofSeconds(5), config.getFollowerWaitTimeout());
            assertEquals(Duration.ofMillis(100), config.getFollowerPollInterval());
            assertEquals(8, config.getNodeIndexPrecision());
            assertEquals(25.0, config.getNodeSnapToleranceMeters());
            assertEquals(0.5, config.getInjectionSampleKm());
            assertEquals(60.0, config.getDefaultSpeedKmh());
            assertEquals(2500.0, config.getPlaceSearchRadiusMeters());
            assertEquals(Duration.ofHours(12), config.getRouteFastTtl());
            assertEquals(Duration.ofSeconds(15), config.getProviderTimeout());
            assertEquals(20.0, config.getWeatherSampleKm());
            assertEquals(4, config.getMaxParallelWeatherFetches());
            assertEquals(ZoneId.of("Asia/Tehran"), config.getDefaultZone());
        }

        @Test
        @DisplayName("Should keep defaults for missing keys")
        void shouldKeepDefaults() {
            EngineConfig config = EngineConfig.fromProperties(new Properties());
            assertEquals(EngineConfig.DEFAULT_PROVIDER_TIMEOUT, config.getProviderTimeout());
        }

        @Test
        @DisplayName("Should name the key of a malformed value")
        void shouldNameMalformedKey() {
            Properties properties = new Properties();
            properties.setProperty("weather-route.lock.leader-ttl", "soon");

            IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                    () -> EngineConfig.fromProperties(properties));
            assertTrue(e.getMessage().contains("weather-route.lock.leader-ttl"));
            assertTrue(e.getMessage().contains("soon"));
        }

        @Test
        @DisplayName("Should name the key of an out-of-range value")
        void shouldNameOutOfRangeKey() {
            Properties properties = new Properties();
            properties.setProperty("weather-route.cache.cell-precision", "0");

            IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                    () -> EngineConfig.fromProperties(properties));
            assertTrue(e.getMessage().contains("weather-route.cache.cell-precision"));
        }

        @Test
        @DisplayName("Should parse ISO-8601 and suffixed durations")
        void shouldParseDurations() {
            assertEquals(Duration.ofSeconds(30), EngineConfig.parseDuration("PT30S"));
            assertEquals(Duration.ofMillis(250), EngineConfig.parseDuration("250ms"));
            assertEquals(Duration.ofMinutes(5), EngineConfig.parseDuration("5m"));
            assertEquals(Duration.ofHours(2), EngineConfig.parseDuration("2h"));
            assertEquals(Duration.ofDays(1), EngineConfig.parseDuration("1d"));
            assertThrows(IllegalArgumentException.class, () -> EngineConfig.parseDuration("5 weeks"));
        }
    }
}
