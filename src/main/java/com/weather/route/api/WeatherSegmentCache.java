package com.weather.route.api;

import com.weather.route.cache.CacheHit;
import com.weather.route.cache.TemporalCacheKey;
import com.weather.route.cache.TieredCache;
import com.weather.route.core.error.ProviderUnavailableException;
import com.weather.route.core.model.Coordinate;
import com.weather.route.core.model.RouteRecord;
import com.weather.route.core.model.WeatherPayload;
import com.weather.route.lock.DedupGate;
import com.weather.route.logging.LogContext;
import com.weather.route.metrics.MetricsService;
import com.weather.route.metrics.NoOpMetricsService;
import com.weather.route.provider.ProviderInvoker;
import com.weather.route.provider.WeatherProvider;
import com.weather.route.spatial.GeometrySampler;
import com.weather.route.spatial.ZoneResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-cell, per-hour weather lookups.
 *
 * <p>A lookup resolves the coordinate's cell and local zone, builds the temporal key with the
 * cell's current model generation and reads the tiered cache. Misses go through the
 * {@link DedupGate}, so concurrent lookups of one cell and hour cost a single provider call. The
 * Leader writes the forecast until the top of the next local hour.</p>
 *
 * <p>A forecast hour that is already over is never read from the cache: it is fetched and returned
 * without being stored. When the provider fails, an entry of the same cell that expired less than
 * the stale grace window ago is served flagged stale.</p>
 */
public class WeatherSegmentCache implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(WeatherSegmentCache.class);

    private final TieredCache cache;
    private final TemporalCacheKey keys;
    private final DedupGate dedupGate;
    private final WeatherProvider provider;
    private final ProviderInvoker invoker;
    private final ZoneResolver zoneResolver;
    private final EngineConfig config;
    private final Clock clock;
    private final MetricsService metricsService;
    private final ExecutorService bulkExecutor;

    // cell -> last model generation reported by the provider
    private final ConcurrentMap<String, String> generations = new ConcurrentHashMap<>();

    private final AtomicLong requests = new AtomicLong();
    private final AtomicLong cacheHits = new AtomicLong();
    private final AtomicLong cacheMisses = new AtomicLong();
    private final AtomicLong staleServes = new AtomicLong();
    private final AtomicLong providerCalls = new AtomicLong();
    private final AtomicLong pastHourFetches = new AtomicLong();
    private final AtomicLong modelRefreshes = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();

    public WeatherSegmentCache(TieredCache cache, TemporalCacheKey keys, DedupGate dedupGate,
                               WeatherProvider provider, ProviderInvoker invoker, ZoneResolver zoneResolver,
                               EngineConfig config) {
        this(cache, keys, dedupGate, provider, invoker, zoneResolver, config,
                Clock.systemUTC(), new NoOpMetricsService());
    }

    public WeatherSegmentCache(TieredCache cache, TemporalCacheKey keys, DedupGate dedupGate,
                               WeatherProvider provider, ProviderInvoker invoker, ZoneResolver zoneResolver,
                               EngineConfig config, Clock clock, MetricsService metricsService) {
        this.cache = Objects.requireNonNull(cache, "cache is required");
        this.keys = Objects.requireNonNull(keys, "keys is required");
        this.dedupGate = Objects.requireNonNull(dedupGate, "dedupGate is required");
        this.provider = Objects.requireNonNull(provider, "provider is required");
        this.invoker = Objects.requireNonNull(invoker, "invoker is required");
        this.zoneResolver = Objects.requireNonNull(zoneResolver, "zoneResolver is required");
        this.config = Objects.requireNonNull(config, "config is required");
        this.clock = clock;
        this.metricsService = metricsService;
        AtomicInteger threads = new AtomicInteger();
        this.bulkExecutor = Executors.newFixedThreadPool(config.getMaxParallelWeatherFetches(), task -> {
            Thread thread = new Thread(task, "weather-bulk-" + threads.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Forecast at {@code coordinate} for the hour containing {@code timestamp}, in the coordinate's zone.
     */
    public WeatherPayload get(Coordinate coordinate, Instant timestamp) {
        Objects.requireNonNull(coordinate, "coordinate is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        return get(coordinate, timestamp.atZone(zoneAt(coordinate)));
    }

    /**
     * Forecast for the local hour containing {@code forecastTime}; its zone decides the hour boundaries.
     *
     * @throws ProviderUnavailableException if the provider fails and no recent entry can stand in
     */
    public WeatherPayload get(Coordinate coordinate, ZonedDateTime forecastTime) {
        Objects.requireNonNull(coordinate, "coordinate is required");
        Objects.requireNonNull(forecastTime, "forecastTime is required");
        requests.incrementAndGet();

        String cell = keys.cellOf(coordinate);
        String key = keys.build(cell, forecastTime, currentGeneration(cell));
        try (LogContext ctx = LogContext.forWeather(key)) {
            if (TemporalCacheKey.isPastHour(forecastTime.toInstant(), forecastTime.getZone(), clock.instant())) {
                pastHourFetches.incrementAndGet();
                log.debug("weather.past_hour key={}, fetching without cache", key);
                return fetch(cell, coordinate, forecastTime);
            }

            Optional<WeatherPayload> cached = cache.get(key, WeatherPayload.class);
            if (cached.isPresent()) {
                cacheHits.incrementAndGet();
                return cached.get();
            }
            cacheMisses.incrementAndGet();

            try {
                return dedupGate.execute(TemporalCacheKey.hourPrefix(cell, forecastTime), config.getLeaderLockTtl(),
                        () -> cache.get(keys.build(cell, forecastTime, currentGeneration(cell)), WeatherPayload.class),
                        () -> fetchAndStore(cell, coordinate, forecastTime));
            } catch (ProviderUnavailableException e) {
                Optional<WeatherPayload> stale = staleFallback(cell, forecastTime);
                if (stale.isPresent()) {
                    staleServes.incrementAndGet();
                    metricsService.recordStaleServe();
                    log.warn("weather.stale key={} served after provider failure: {}", key, e.getMessage());
                    return stale.get();
                }
                throw e;
            }
        } catch (RuntimeException e) {
            failures.incrementAndGet();
            throw e;
        }
    }

    /**
     * Bulk lookup. Requests that share a cell and hour are fetched once; at most
     * {@code maxParallelWeatherFetches} lookups run at a time. Results follow the request order.
     *
     * @throws ProviderUnavailableException for the first request, in order, that failed
     */
    public List<WeatherPayload> getAll(List<SegmentRequest> segmentRequests) {
        Map<String, CompletableFuture<WeatherPayload>> byKey = new LinkedHashMap<>();
        List<CompletableFuture<WeatherPayload>> ordered = new ArrayList<>(segmentRequests.size());
        for (SegmentRequest request : segmentRequests) {
            ZonedDateTime forecastTime = request.timestamp().atZone(zoneAt(request.coordinate()));
            String dedupKey = TemporalCacheKey.hourPrefix(keys.cellOf(request.coordinate()), forecastTime);
            CompletableFuture<WeatherPayload> future = byKey.computeIfAbsent(dedupKey, k ->
                    CompletableFuture.supplyAsync(() -> get(request.coordinate(), forecastTime), bulkExecutor));
            ordered.add(future);
        }
        log.debug("weather.bulk requests={} distinct={}", segmentRequests.size(), byKey.size());

        List<WeatherPayload> results = new ArrayList<>(ordered.size());
        for (CompletableFuture<WeatherPayload> future : ordered) {
            try {
                results.add(future.join());
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                if (cause instanceof RuntimeException runtime) {
                    throw runtime;
                }
                throw new ProviderUnavailableException("Weather lookup failed: " + cause.getMessage(), cause);
            }
        }
        return results;
    }

    /**
     * Weather along a route: one segment per distinct cell and arrival hour, with arrival times
     * estimated from the distance travelled and the route's average speed.
     */
    public List<WeatherSegment> alongRoute(RouteRecord route, Instant departure) {
        Objects.requireNonNull(route, "route is required");
        Objects.requireNonNull(departure, "departure is required");
        double speedKmh = route.averageSpeedKmh() > 0 ? route.averageSpeedKmh() : config.getDefaultSpeedKmh();

        Map<String, WeatherSegment> distinct = new LinkedHashMap<>();
        List<SegmentRequest> requestsToFetch = new ArrayList<>();
        for (GeometrySampler.Sample sample : GeometrySampler.sample(route.geometry(), config.getWeatherSampleKm())) {
            double km = sample.cumulativeMeters() / 1000.0;
            Instant arrival = departure.plusMillis(Math.round(km / speedKmh * 3_600_000.0));
            String cell = keys.cellOf(sample.coordinate());
            String slot = TemporalCacheKey.hourPrefix(cell, arrival.atZone(zoneAt(sample.coordinate())));
            if (!distinct.containsKey(slot)) {
                distinct.put(slot, new WeatherSegment(sample.coordinate(), cell, arrival, km, null));
                requestsToFetch.add(new SegmentRequest(sample.coordinate(), arrival));
            }
        }

        List<WeatherPayload> forecasts = getAll(requestsToFetch);
        List<WeatherSegment> segments = new ArrayList<>(forecasts.size());
        int i = 0;
        for (WeatherSegment pending : distinct.values()) {
            segments.add(new WeatherSegment(pending.coordinate(), pending.cellId(), pending.estimatedArrival(),
                    pending.distanceFromStartKm(), forecasts.get(i++)));
        }
        log.info("weather.route segments={} from {} geometry points", segments.size(), route.geometry().size());
        return segments;
    }

    /**
     * Drops every cached forecast of a cell, all hours and generations.
     */
    public int invalidateCell(String cellId) {
        return cache.invalidatePrefix(TemporalCacheKey.cellPrefix(cellId));
    }

    public String currentGeneration(String cellId) {
        return generations.getOrDefault(cellId, TemporalCacheKey.UNKNOWN_GENERATION);
    }

    public WeatherStats stats() {
        return new WeatherStats(requests.get(), cacheHits.get(), cacheMisses.get(), staleServes.get(),
                providerCalls.get(), pastHourFetches.get(), modelRefreshes.get(), failures.get());
    }

    @Override
    public void close() {
        bulkExecutor.shutdown();
        try {
            if (!bulkExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                bulkExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            bulkExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    // ========== Fetching ==========

    private WeatherPayload fetchAndStore(String cell, Coordinate coordinate, ZonedDateTime forecastTime) {
        WeatherPayload fetched = fetch(cell, coordinate, forecastTime);
        String generation = TemporalCacheKey.normalizeGeneration(fetched.modelGeneration());
        if (fetched.modelGeneration() == null) {
            generation = currentGeneration(cell);
        }
        String key = keys.build(cell, forecastTime, generation);
        boolean written = cache.putUntil(key, fetched, fetched.expiresAt(), true, generation);
        log.debug("weather.fetched key={} written={} expiresAt={}", key, written, fetched.expiresAt());
        return fetched;
    }

    /**
     * Calls the provider and stamps the cache window. A new model generation for the cell drops
     * the cell's cached forecasts before anything is written.
     */
    private WeatherPayload fetch(String cell, Coordinate coordinate, ZonedDateTime forecastTime) {
        providerCalls.incrementAndGet();
        Instant timestamp = forecastTime.toInstant();
        WeatherPayload fetched = invoker.invoke(provider.getProviderName(),
                () -> provider.fetch(coordinate.lat(), coordinate.lon(), timestamp));
        observeGeneration(cell, fetched.modelGeneration());
        Instant now = clock.instant();
        return fetched.withCacheWindow(now, TemporalCacheKey.expiresAt(timestamp, forecastTime.getZone()));
    }

    private void observeGeneration(String cell, String reported) {
        if (reported == null) {
            return;
        }
        String generation = TemporalCacheKey.normalizeGeneration(reported);
        String previous = generations.put(cell, generation);
        if (previous != null && !previous.equals(generation)) {
            modelRefreshes.incrementAndGet();
            int removed = invalidateCell(cell);
            log.info("weather.model_refresh cell={} {} -> {}, dropped {} entries", cell, previous, generation, removed);
        }
    }

    /**
     * A recently expired entry of the requested hour or the hour before it.
     */
    private Optional<WeatherPayload> staleFallback(String cell, ZonedDateTime forecastTime) {
        Duration grace = config.getStaleGraceWindow();
        if (grace.isZero()) {
            return Optional.empty();
        }
        String generation = currentGeneration(cell);
        Optional<CacheHit<WeatherPayload>> sameHour =
                cache.getWithinGrace(keys.build(cell, forecastTime, generation), WeatherPayload.class, grace);
        if (sameHour.isPresent()) {
            WeatherPayload value = sameHour.get().value();
            return Optional.of(sameHour.get().stale() ? value.asStale() : value);
        }
        return cache.getWithinGrace(keys.build(cell, forecastTime.minusHours(1), generation),
                        WeatherPayload.class, grace)
                .map(hit -> hit.value().asStale());
    }

    private ZoneId zoneAt(Coordinate coordinate) {
        ZoneId zone = zoneResolver.zoneAt(coordinate);
        return zone != null ? zone : config.getDefaultZone();
    }
}
