package com.weather.route.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.weather.route.cache.CacheLayer;
import com.weather.route.cache.CacheLayerConfig;
import com.weather.route.cache.CaffeineCacheLayer;
import com.weather.route.cache.GraphCacheLayer;
import com.weather.route.cache.InMemoryCacheLayer;
import com.weather.route.cache.TemporalCacheKey;
import com.weather.route.cache.TieredCache;
import com.weather.route.core.error.NotFoundException;
import com.weather.route.core.model.Coordinate;
import com.weather.route.core.model.Place;
import com.weather.route.core.model.PlaceType;
import com.weather.route.core.model.RouteRecord;
import com.weather.route.core.model.WeatherPayload;
import com.weather.route.graph.GraphConnection;
import com.weather.route.graph.GraphInjector;
import com.weather.route.graph.GraphRoadGraphStore;
import com.weather.route.graph.InMemoryRoadGraphStore;
import com.weather.route.graph.PathFinder;
import com.weather.route.graph.RoadGraphStore;
import com.weather.route.health.CacheLayerHealthCheck;
import com.weather.route.health.GraphStoreHealthCheck;
import com.weather.route.health.HealthCheckRegistry;
import com.weather.route.health.HealthStatus;
import com.weather.route.lock.DedupGate;
import com.weather.route.lock.GraphLeaderLock;
import com.weather.route.lock.LeaderLock;
import com.weather.route.lock.LocalLeaderLock;
import com.weather.route.lock.LockConfig;
import com.weather.route.logging.LogContext;
import com.weather.route.metrics.MetricsService;
import com.weather.route.metrics.NoOpMetricsService;
import com.weather.route.provider.PlaceDiscoveryProvider;
import com.weather.route.provider.ProviderInvoker;
import com.weather.route.provider.RoutingProvider;
import com.weather.route.provider.WeatherProvider;
import com.weather.route.spatial.GeohashCellIndex;
import com.weather.route.spatial.NearestNodeLocator;
import com.weather.route.spatial.ZoneResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Objects;

/**
 * Entry point of the engine: wires the caches, the road graph and the providers, and exposes the
 * route, weather and admin operations.
 *
 * <pre>
 * try (TripPlanner planner = TripPlanner.builder()
 *         .weatherProvider(weather)
 *         .routingProvider(routing)
 *         .build()) {
 *     Place tehran = planner.upsertPlace("Tehran", PlaceType.CITY, "Tehran", Coordinate.of(35.6892, 51.3890));
 *     Place mashhad = planner.upsertPlace("Mashhad", PlaceType.CITY, "Razavi Khorasan", Coordinate.of(36.2605, 59.6168));
 *     RouteRecord route = planner.getRoute(tehran, mashhad);
 *     List&lt;WeatherSegment&gt; weather = planner.weatherAlongRoute(route, Instant.now());
 * }
 * </pre>
 *
 * <p>Without a {@link GraphConnection} everything runs in process: Caffeine fast layer, in-memory
 * durable layer, in-memory road graph and a local leader lock. With one, the durable layer, the
 * road graph and the leader lock live in FalkorDB. The connection stays owned by the caller.</p>
 */
public class TripPlanner implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TripPlanner.class);

    private final EngineConfig config;
    private final TieredCache cache;
    private final RoadGraphStore store;
    private final DedupGate dedupGate;
    private final ProviderInvoker invoker;
    private final RouteCacheCoordinator routes;
    private final WeatherSegmentCache weather;
    private final ZoneResolver zoneResolver;
    private final HealthCheckRegistry healthChecks;
    private final Clock clock;

    private TripPlanner(Builder builder) {
        this.config = builder.config;
        this.clock = builder.clock;
        this.zoneResolver = builder.zoneResolver != null
                ? builder.zoneResolver : ZoneResolver.fixed(config.getDefaultZone());
        MetricsService metrics = builder.metricsService;
        ObjectMapper mapper = builder.objectMapper != null ? builder.objectMapper : TieredCache.defaultObjectMapper();
        GraphConnection connection = builder.graphConnection;

        CacheLayer fast = builder.fastLayer != null ? builder.fastLayer
                : new CaffeineCacheLayer(new CacheLayerConfig((int) Math.min(config.getFastLayerMaxSize(), Integer.MAX_VALUE),
                        config.getRouteFastTtl(), true), clock);
        CacheLayer durable = builder.durableLayer != null ? builder.durableLayer
                : connection != null ? new GraphCacheLayer(connection) : new InMemoryCacheLayer();
        this.cache = new TieredCache(fast, durable, mapper, config.getRouteFastTtl(), clock, metrics);

        if (builder.roadGraphStore != null) {
            this.store = builder.roadGraphStore;
        } else {
            NearestNodeLocator locator = new NearestNodeLocator(config.getNodeIndexPrecision());
            this.store = connection != null
                    ? new GraphRoadGraphStore(connection, locator, config.getNodeSnapToleranceMeters(), mapper)
                    : new InMemoryRoadGraphStore(locator, config.getNodeSnapToleranceMeters());
        }

        LeaderLock lock = builder.leaderLock != null ? builder.leaderLock
                : connection != null ? new GraphLeaderLock(connection, LockConfig.defaults(), clock)
                : new LocalLeaderLock(clock);
        this.dedupGate = new DedupGate(lock, config.getFollowerWaitTimeout(), config.getFollowerPollInterval(),
                clock, metrics);
        this.invoker = new ProviderInvoker(config.getProviderTimeout(), metrics);

        PathFinder pathFinder = new PathFinder(store, metrics);
        GraphInjector injector = new GraphInjector(store, config.getInjectionSampleKm(),
                config.getDefaultSpeedKmh(), metrics);
        this.routes = new RouteCacheCoordinator(cache, store, pathFinder, injector, builder.routingProvider,
                builder.placeDiscoveryProvider, invoker, dedupGate, config);
        this.weather = new WeatherSegmentCache(cache, new TemporalCacheKey(new GeohashCellIndex(config.getCellPrecision())),
                dedupGate, builder.weatherProvider, invoker, zoneResolver, config, clock, metrics);

        this.healthChecks = new HealthCheckRegistry().register(new CacheLayerHealthCheck(cache));
        if (connection != null) {
            healthChecks.register(new GraphStoreHealthCheck(connection));
        }
        log.info("TripPlanner started: {}", config);
    }

    public static Builder builder() {
        return new Builder();
    }

    // ========== Places ==========

    /**
     * Returns the place for (name, type, region), creating it with the zone of its coordinate.
     */
    public Place upsertPlace(String name, PlaceType type, String region, Coordinate coordinate) {
        return upsertPlace(name, type, region, coordinate, zoneResolver.zoneAt(coordinate));
    }

    public Place upsertPlace(String name, PlaceType type, String region, Coordinate coordinate, ZoneId zoneId) {
        return store.upsertPlace(name, type, region, coordinate, zoneId);
    }

    public Place getPlace(long placeId) {
        return store.getPlace(placeId).orElseThrow(() -> new NotFoundException("Unknown place: " + placeId));
    }

    // ========== Routes ==========

    public RouteRecord getRoute(Place source, Place target) {
        return routes.getRoute(source, target);
    }

    public RouteRecord getRoute(long sourcePlaceId, long targetPlaceId) {
        return routes.getRoute(getPlace(sourcePlaceId), getPlace(targetPlaceId));
    }

    // ========== Weather ==========

    public WeatherPayload weather(Coordinate coordinate, Instant timestamp) {
        return weather.get(coordinate, timestamp);
    }

    public WeatherPayload weather(Coordinate coordinate, ZonedDateTime forecastTime) {
        return weather.get(coordinate, forecastTime);
    }

    public List<WeatherPayload> weather(List<SegmentRequest> requests) {
        return weather.getAll(requests);
    }

    public List<WeatherSegment> weatherAlongRoute(RouteRecord route, Instant departure) {
        return weather.alongRoute(route, departure);
    }

    public List<WeatherSegment> weatherAlongRoute(Place source, Place target, Instant departure) {
        return weather.alongRoute(routes.getRoute(source, target), departure);
    }

    // ========== Admin ==========

    public EngineStats stats() {
        return new EngineStats(clock.instant(), cache.fastStats(), cache.durableStats(), dedupGate.stats(),
                routes.stats(), weather.stats(), store.placeCount(), store.nodeCount(), store.edgeCount());
    }

    /**
     * Removes one cache key from both layers.
     */
    public boolean invalidate(String key) {
        try (LogContext ctx = LogContext.forAdmin("invalidate").with(LogContext.CACHE_KEY, key)) {
            return cache.invalidate(key);
        }
    }

    public boolean invalidateRoute(Place source, Place target) {
        try (LogContext ctx = LogContext.forAdmin("invalidateRoute")) {
            return routes.invalidate(source, target);
        }
    }

    /**
     * Removes every cached forecast of a weather cell.
     */
    public int invalidateCell(String cellId) {
        try (LogContext ctx = LogContext.forAdmin("invalidateCell")) {
            return weather.invalidateCell(cellId);
        }
    }

    /**
     * Rebuilds the nearest-node index from the stored graph, e.g. after external edits.
     */
    public void reloadSpatialIndex() {
        try (LogContext ctx = LogContext.forAdmin("reloadSpatialIndex")) {
            store.reloadSpatialIndex();
            log.info("Spatial index reloaded: {} nodes", store.nodeCount());
        }
    }

    public int purgeExpired() {
        try (LogContext ctx = LogContext.forAdmin("purgeExpired")) {
            return cache.purgeExpired();
        }
    }

    public HealthStatus health() {
        return healthChecks.checkAll();
    }

    public EngineConfig getConfig() {
        return config;
    }

    @Override
    public void close() {
        routes.close();
        weather.close();
        dedupGate.close();
        invoker.close();
        log.info("TripPlanner closed");
    }

    public static class Builder {
        private EngineConfig config = EngineConfig.defaults();
        private WeatherProvider weatherProvider;
        private RoutingProvider routingProvider;
        private PlaceDiscoveryProvider placeDiscoveryProvider;
        private CacheLayer fastLayer;
        private CacheLayer durableLayer;
        private RoadGraphStore roadGraphStore;
        private LeaderLock leaderLock;
        private GraphConnection graphConnection;
        private ZoneResolver zoneResolver;
        private Clock clock = Clock.systemUTC();
        private MetricsService metricsService = new NoOpMetricsService();
        private ObjectMapper objectMapper;

        public Builder config(EngineConfig config) {
            this.config = Objects.requireNonNull(config, "config is required");
            return this;
        }

        public Builder weatherProvider(WeatherProvider weatherProvider) {
            this.weatherProvider = weatherProvider;
            return this;
        }

        public Builder routingProvider(RoutingProvider routingProvider) {
            this.routingProvider = routingProvider;
            return this;
        }

        public Builder placeDiscoveryProvider(PlaceDiscoveryProvider placeDiscoveryProvider) {
            this.placeDiscoveryProvider = placeDiscoveryProvider;
            return this;
        }

        public Builder fastLayer(CacheLayer fastLayer) {
            this.fastLayer = fastLayer;
            return this;
        }

        public Builder durableLayer(CacheLayer durableLayer) {
            this.durableLayer = durableLayer;
            return this;
        }

        public Builder roadGraphStore(RoadGraphStore roadGraphStore) {
            this.roadGraphStore = roadGraphStore;
            return this;
        }

        public Builder leaderLock(LeaderLock leaderLock) {
            this.leaderLock = leaderLock;
            return this;
        }

        /**
         * Backs the durable layer, road graph and leader lock with FalkorDB, unless set explicitly.
         */
        public Builder graphConnection(GraphConnection graphConnection) {
            this.graphConnection = graphConnection;
            return this;
        }

        public Builder zoneResolver(ZoneResolver zoneResolver) {
            this.zoneResolver = zoneResolver;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock is required");
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = Objects.requireNonNull(metricsService, "metricsService is required");
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        public TripPlanner build() {
            if (weatherProvider == null) {
                throw new IllegalStateException("weatherProvider is required");
            }
            if (routingProvider == null) {
                throw new IllegalStateException("routingProvider is required");
            }
            return new TripPlanner(this);
        }
    }
}
