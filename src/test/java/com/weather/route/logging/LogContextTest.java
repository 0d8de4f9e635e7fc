package com.weather.route.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LogContext Tests")
class LogContextTest {

    @AfterEach
    void cleanupMDC() {
        MDC.clear();
    }

    @Test
    @DisplayName("forRoute should set correlationId, operation and routeKey in MDC")
    void forRouteSetsMDC() {
        try (LogContext ctx = LogContext.forRoute("route:1:2")) {
            assertNotNull(MDC.get(LogContext.CORRELATION_ID));
            assertEquals("route", MDC.get(LogContext.OPERATION));
            assertEquals("route:1:2", MDC.get(LogContext.ROUTE_KEY));
        }
    }

    @Test
    @DisplayName("forWeather should set the cache key")
    void forWeatherSetsMDC() {
        try (LogContext ctx = LogContext.forWeather("weather:u4pru:202603101400:latest")) {
            assertEquals("weather", MDC.get(LogContext.OPERATION));
            assertEquals("weather:u4pru:202603101400:latest", MDC.get(LogContext.CACHE_KEY));
        }
    }

    @Test
    @DisplayName("Try-with-resources should clean up MDC")
    void tryWithResourcesCleansUp() {
        try (LogContext ctx = LogContext.forAdmin("purgeExpired").with(LogContext.CACHE_KEY, "k")) {
            assertEquals("purgeExpired", MDC.get(LogContext.OPERATION));
        }
        assertNull(MDC.get(LogContext.CORRELATION_ID));
        assertNull(MDC.get(LogContext.OPERATION));
        assertNull(MDC.get(LogContext.CACHE_KEY));
    }

    @Test
    @DisplayName("Nested contexts should restore the outer values on close")
    void nestedContextRestoresOuter() {
        try (LogContext outer = LogContext.forRoute("route:1:2")) {
            String outerId = MDC.get(LogContext.CORRELATION_ID);
            try (LogContext inner = LogContext.forWeather("weather:tnkp7:202603101000:latest")) {
                assertEquals("weather", MDC.get(LogContext.OPERATION));
                assertNotEquals(outerId, MDC.get(LogContext.CORRELATION_ID));
            }
            assertEquals("route", MDC.get(LogContext.OPERATION));
            assertEquals(outerId, MDC.get(LogContext.CORRELATION_ID));
            assertEquals("route:1:2", MDC.get(LogContext.ROUTE_KEY));
            assertNull(MDC.get(LogContext.CACHE_KEY));
        }
    }

    @Test
    @DisplayName("Correlation ids should be unique")
    void correlationIdsAreUnique() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            ids.add(LogContext.generateCorrelationId());
        }
        assertEquals(100, ids.size());
    }
}
