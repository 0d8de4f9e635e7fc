package com.weather.route.graph;

import com.weather.route.core.model.Coordinate;
import com.weather.route.metrics.MetricsService;
import com.weather.route.metrics.NoOpMetricsService;
import com.weather.route.provider.RoutingResult;
import com.weather.route.spatial.GeoDistance;
import com.weather.route.spatial.GeometrySampler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns a provider route into graph nodes and directed edges.
 *
 * <p>The geometry is thinned to one vertex about every {@code sampleKm}; each kept vertex goes
 * through {@link RoadGraphStore#upsertNode}, so it snaps onto an existing node when one is within
 * tolerance. The first node becomes an access point of the source place and the last of the target
 * place. Consecutive nodes are joined by an edge carrying the raw geometry between them.</p>
 */
public class GraphInjector {
    private static final Logger log = LoggerFactory.getLogger(GraphInjector.class);

    private final RoadGraphStore store;
    private final double sampleKm;
    private final double defaultSpeedKmh;
    private final MetricsService metricsService;

    public GraphInjector(RoadGraphStore store, double sampleKm, double defaultSpeedKmh) {
        this(store, sampleKm, defaultSpeedKmh, new NoOpMetricsService());
    }

    public GraphInjector(RoadGraphStore store, double sampleKm, double defaultSpeedKmh,
                         MetricsService metricsService) {
        if (sampleKm <= 0) {
            throw new IllegalArgumentException("sampleKm must be > 0");
        }
        if (defaultSpeedKmh <= 0) {
            throw new IllegalArgumentException("defaultSpeedKmh must be > 0");
        }
        this.store = Objects.requireNonNull(store, "store is required");
        this.sampleKm = sampleKm;
        this.defaultSpeedKmh = defaultSpeedKmh;
        this.metricsService = metricsService;
    }

    /**
     * Outcome of an injection.
     *
     * @param nodePath node handles along the route, consecutive duplicates collapsed
     * @param edges    edges written (new or already present)
     */
    public record InjectionResult(List<Long> nodePath, int edges) {

        public InjectionResult {
            nodePath = List.copyOf(nodePath);
        }
    }

    /**
     * Injects {@code route} between two places.
     *
     * @throws IllegalArgumentException if the route has fewer than two points
     */
    public InjectionResult inject(long sourcePlaceId, long targetPlaceId, RoutingResult route) {
        List<Coordinate> geometry = route.geometry();
        if (geometry.size() < 2) {
            throw new IllegalArgumentException("Route needs at least 2 points, got " + geometry.size());
        }
        int nodesBefore = store.nodeCount();

        List<GeometrySampler.Sample> samples = GeometrySampler.sample(geometry, sampleKm);
        List<Long> nodePath = new ArrayList<>();
        List<Integer> vertexIndex = new ArrayList<>();
        for (int i = 0; i < samples.size(); i++) {
            GeometrySampler.Sample sample = samples.get(i);
            Long place = i == 0 ? Long.valueOf(sourcePlaceId)
                    : i == samples.size() - 1 ? Long.valueOf(targetPlaceId) : null;
            long nodeId = store.upsertNode(sample.coordinate(), place);
            if (!nodePath.isEmpty() && nodePath.get(nodePath.size() - 1) == nodeId) {
                continue;
            }
            nodePath.add(nodeId);
            vertexIndex.add(sample.index());
        }

        double fallbackSpeed = route.averageSpeedKmh() > 0 ? route.averageSpeedKmh() : defaultSpeedKmh;
        int edges = 0;
        for (int i = 0; i + 1 < nodePath.size(); i++) {
            int from = vertexIndex.get(i);
            int to = vertexIndex.get(i + 1);
            List<Coordinate> segment = geometry.subList(from, to + 1);
            double distanceMeters = GeoDistance.lengthMeters(segment);
            if (!(distanceMeters > 0)) {
                log.debug("Skipping zero-length segment between nodes {} and {}", nodePath.get(i), nodePath.get(i + 1));
                continue;
            }
            double speed = segmentSpeed(route, from, to, fallbackSpeed);
            store.upsertEdge(nodePath.get(i), nodePath.get(i + 1), segment, distanceMeters, speed);
            edges++;
        }

        int nodesCreated = Math.max(0, store.nodeCount() - nodesBefore);
        metricsService.recordGraphInjection(nodesCreated, edges);
        log.info("Injected route {} -> {}: {} points sampled to {} nodes ({} new), {} edges",
                sourcePlaceId, targetPlaceId, geometry.size(), nodePath.size(), nodesCreated, edges);
        return new InjectionResult(nodePath, edges);
    }

    private static double segmentSpeed(RoutingResult route, int from, int to, double fallbackSpeed) {
        if (route.roadClasses().isEmpty()) {
            return fallbackSpeed;
        }
        return route.roadClasses().get((from + to) / 2).speedKmh();
    }
}
