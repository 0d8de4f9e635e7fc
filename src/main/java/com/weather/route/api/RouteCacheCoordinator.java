package com.weather.route.api;

import com.weather.route.cache.TieredCache;
import com.weather.route.core.error.NotFoundException;
import com.weather.route.core.error.ProviderUnavailableException;
import com.weather.route.core.model.Coordinate;
import com.weather.route.core.model.Node;
import com.weather.route.core.model.Place;
import com.weather.route.core.model.RouteRecord;
import com.weather.route.graph.GraphInjector;
import com.weather.route.graph.GraphPath;
import com.weather.route.graph.PathFinder;
import com.weather.route.graph.RoadGraphStore;
import com.weather.route.lock.DedupGate;
import com.weather.route.logging.LogContext;
import com.weather.route.provider.DiscoveredPlace;
import com.weather.route.provider.PlaceDiscoveryProvider;
import com.weather.route.provider.ProviderInvoker;
import com.weather.route.provider.RoutingProvider;
import com.weather.route.provider.RoutingResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Route lookups between places: tiered cache first, then the local road graph, then the routing
 * provider whose geometry is injected into the graph before a single retry of the search.
 *
 * <p>Routes are cached per ordered place pair and never expire from the durable layer; roads are
 * assumed static, so a route only goes away through {@link #invalidate(Place, Place)}.</p>
 */
public class RouteCacheCoordinator implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RouteCacheCoordinator.class);

    static final String KEY_PREFIX = "route:";

    private final TieredCache cache;
    private final RoadGraphStore store;
    private final PathFinder pathFinder;
    private final GraphInjector injector;
    private final RoutingProvider routingProvider;
    private final PlaceDiscoveryProvider discoveryProvider;
    private final ProviderInvoker invoker;
    private final DedupGate dedupGate;
    private final EngineConfig config;
    private final ExecutorService seedExecutor;

    private final AtomicLong requests = new AtomicLong();
    private final AtomicLong cacheHits = new AtomicLong();
    private final AtomicLong graphComputations = new AtomicLong();
    private final AtomicLong providerCalls = new AtomicLong();
    private final AtomicLong injections = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();

    /**
     * @param discoveryProvider seeds places along injected routes; may be {@code null}
     */
    public RouteCacheCoordinator(TieredCache cache, RoadGraphStore store, PathFinder pathFinder,
                                 GraphInjector injector, RoutingProvider routingProvider,
                                 PlaceDiscoveryProvider discoveryProvider, ProviderInvoker invoker,
                                 DedupGate dedupGate, EngineConfig config) {
        this.cache = Objects.requireNonNull(cache, "cache is required");
        this.store = Objects.requireNonNull(store, "store is required");
        this.pathFinder = Objects.requireNonNull(pathFinder, "pathFinder is required");
        this.injector = Objects.requireNonNull(injector, "injector is required");
        this.routingProvider = Objects.requireNonNull(routingProvider, "routingProvider is required");
        this.discoveryProvider = discoveryProvider;
        this.invoker = Objects.requireNonNull(invoker, "invoker is required");
        this.dedupGate = Objects.requireNonNull(dedupGate, "dedupGate is required");
        this.config = Objects.requireNonNull(config, "config is required");
        this.seedExecutor = Executors.newSingleThreadExecutor(task -> {
            Thread thread = new Thread(task, "place-seeder");
            thread.setDaemon(true);
            return thread;
        });
    }

    public static String routeKey(long sourcePlaceId, long targetPlaceId) {
        return KEY_PREFIX + sourcePlaceId + ":" + targetPlaceId;
    }

    /**
     * Route from {@code source} to {@code target}.
     *
     * @throws ProviderUnavailableException if the graph has no path and the routing provider fails
     * @throws NotFoundException            if no path exists even after injecting the provider route, or both
     *                                      places resolve to the same road node
     */
    public RouteRecord getRoute(Place source, Place target) {
        Objects.requireNonNull(source, "source is required");
        Objects.requireNonNull(target, "target is required");
        if (source.getId() == target.getId()) {
            throw new IllegalArgumentException("Source and target must be different places: " + source.getName());
        }
        String key = routeKey(source.getId(), target.getId());
        requests.incrementAndGet();

        try (LogContext ctx = LogContext.forRoute(key)) {
            Optional<RouteRecord> cached = cache.get(key, RouteRecord.class);
            if (cached.isPresent()) {
                cacheHits.incrementAndGet();
                log.debug("route.cache.hit key={}", key);
                return cached.get();
            }
            return dedupGate.execute(key, config.getLeaderLockTtl(),
                    () -> cache.get(key, RouteRecord.class),
                    () -> compute(source, target, key));
        } catch (RuntimeException e) {
            failures.incrementAndGet();
            log.warn("route.failed key={} error={}", key, e.getMessage());
            throw e;
        }
    }

    /**
     * Drops the cached route for the ordered pair.
     *
     * @return whether a cached route was removed
     */
    public boolean invalidate(Place source, Place target) {
        return invalidate(source.getId(), target.getId());
    }

    public boolean invalidate(long sourcePlaceId, long targetPlaceId) {
        return cache.invalidate(routeKey(sourcePlaceId, targetPlaceId));
    }

    public RouteStats stats() {
        return new RouteStats(requests.get(), cacheHits.get(), graphComputations.get(),
                providerCalls.get(), injections.get(), failures.get());
    }

    @Override
    public void close() {
        seedExecutor.shutdown();
        try {
            if (!seedExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                seedExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            seedExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    // ========== Computation ==========

    private RouteRecord compute(Place source, Place target, String key) {
        Optional<GraphPath> path = findPath(source, target);
        if (path.isEmpty()) {
            log.info("No graph path for {} -> {}, asking routing provider", source.getName(), target.getName());
            RoutingResult route = fetchRoute(source, target);
            injector.inject(source.getId(), target.getId(), route);
            injections.incrementAndGet();
            seedPlacesAsync(route.geometry());

            path = findPath(source, target);
            if (path.isEmpty()) {
                throw new NotFoundException("No path from " + source.getName() + " to " + target.getName()
                        + " after injecting the provider route");
            }
        }
        graphComputations.incrementAndGet();

        RouteRecord record = toRecord(source, target, path.get());
        cache.put(key, record, config.getRouteFastTtl(), true);
        log.info("route.computed {} -> {}: {} nodes, {} km, {} h", source.getName(), target.getName(),
                record.nodes().size(), String.format("%.1f", record.distanceKm()),
                String.format("%.2f", record.durationHours()));
        return record;
    }

    private RoutingResult fetchRoute(Place source, Place target) {
        providerCalls.incrementAndGet();
        RoutingResult route = invoker.invoke(routingProvider.getProviderName(),
                () -> routingProvider.route(source.getCoordinate(), target.getCoordinate()));
        if (route.geometry().size() < 2) {
            throw new ProviderUnavailableException("Routing provider returned " + route.geometry().size()
                    + " points for " + source.getName() + " -> " + target.getName());
        }
        return route;
    }

    private Optional<GraphPath> findPath(Place source, Place target) {
        Set<Long> sources = endpoints(source);
        Set<Long> targets = endpoints(target);
        if (sources.isEmpty() || targets.isEmpty()) {
            return Optional.empty();
        }
        targets.removeAll(sources);
        if (targets.isEmpty()) {
            // The provider cannot add a road between places that share every road node.
            throw new NotFoundException("Places " + source.getName() + " and " + target.getName()
                    + " resolve to the same road node; no route between them");
        }
        return pathFinder.shortestPath(sources, targets);
    }

    /**
     * Access nodes of the place, or the nearest node around it when it has none yet.
     */
    private Set<Long> endpoints(Place place) {
        Set<Long> nodes = new LinkedHashSet<>(store.accessNodes(place.getId()));
        if (nodes.isEmpty()) {
            OptionalLong nearest = store.nearestNode(place.getCoordinate(), config.getPlaceSearchRadiusMeters());
            nearest.ifPresent(nodes::add);
        }
        return nodes;
    }

    private RouteRecord toRecord(Place source, Place target, GraphPath path) {
        List<Coordinate> geometry = path.geometry();
        if (geometry.isEmpty()) {
            geometry = new ArrayList<>();
            for (Long nodeId : path.nodes()) {
                store.getNode(nodeId).map(Node::coordinate).ifPresent(geometry::add);
            }
        }
        return new RouteRecord(source.getId(), target.getId(), path.nodes(), geometry,
                path.totalDistanceKm(), path.totalDurationHours());
    }

    // ========== Place seeding ==========

    private void seedPlacesAsync(List<Coordinate> geometry) {
        if (discoveryProvider == null) {
            return;
        }
        try {
            seedExecutor.execute(() -> seedPlaces(geometry));
        } catch (RejectedExecutionException e) {
            log.debug("Place seeding skipped, coordinator is closing");
        }
    }

    private void seedPlaces(List<Coordinate> geometry) {
        try {
            List<DiscoveredPlace> found = invoker.invoke(discoveryProvider.getProviderName(),
                    () -> discoveryProvider.placesAlong(geometry));
            int linked = 0;
            for (DiscoveredPlace discovered : found) {
                Place place = store.upsertPlace(discovered.name(), discovered.type(), discovered.region(),
                        discovered.coordinate(), config.getDefaultZone());
                OptionalLong node = store.nearestNode(discovered.coordinate(), config.getPlaceSearchRadiusMeters());
                if (node.isPresent()) {
                    store.linkNodeToPlace(node.getAsLong(), place.getId());
                    linked++;
                }
            }
            log.info("Seeded {} places along route, {} linked to the graph", found.size(), linked);
        } catch (RuntimeException e) {
            log.warn("Place seeding failed: {}", e.getMessage());
        }
    }
}
