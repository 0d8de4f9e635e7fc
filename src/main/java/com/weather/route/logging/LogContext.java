package com.weather.route.logging;

import org.slf4j.MDC;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.UUID;

/**
 * Scoped SLF4J MDC entries. Entries are removed on {@link #close()}, and a key that was already
 * set by an enclosing context gets its previous value back.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forRoute("route:12:40")) {
 *     log.info("route.computed nodes={}", nodes.size());
 * }
 * </pre>
 */
public final class LogContext implements AutoCloseable {

    public static final String CORRELATION_ID = "correlationId";
    public static final String OPERATION = "operation";
    public static final String ROUTE_KEY = "routeKey";
    public static final String CACHE_KEY = "cacheKey";

    private final Deque<String[]> previous = new ArrayDeque<>();

    private LogContext() {
    }

    /**
     * Context for a route lookup.
     */
    public static LogContext forRoute(String routeKey) {
        return new LogContext()
                .with(CORRELATION_ID, generateCorrelationId())
                .with(OPERATION, "route")
                .with(ROUTE_KEY, routeKey);
    }

    /**
     * Context for a weather lookup of one cell and hour.
     */
    public static LogContext forWeather(String cacheKey) {
        return new LogContext()
                .with(CORRELATION_ID, generateCorrelationId())
                .with(OPERATION, "weather")
                .with(CACHE_KEY, cacheKey);
    }

    /**
     * Context for an administrative operation (invalidation, reload, purge).
     */
    public static LogContext forAdmin(String operation) {
        return new LogContext()
                .with(CORRELATION_ID, generateCorrelationId())
                .with(OPERATION, operation);
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    public LogContext with(String key, String value) {
        previous.push(new String[]{key, MDC.get(key)});
        MDC.put(key, value);
        return this;
    }

    @Override
    public void close() {
        while (!previous.isEmpty()) {
            String[] entry = previous.pop();
            if (entry[1] == null) {
                MDC.remove(entry[0]);
            } else {
                MDC.put(entry[0], entry[1]);
            }
        }
    }
}
