package com.weather.route.graph;

import com.weather.route.core.model.Edge;
import com.weather.route.metrics.MetricsService;
import com.weather.route.metrics.NoOpMetricsService;
import it.unimi.dsi.fastutil.longs.Long2DoubleOpenHashMap;
import it.unimi.dsi.fastutil.longs.Long2LongOpenHashMap;
import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.longs.LongArrayList;
import it.unimi.dsi.fastutil.longs.LongOpenHashSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.PriorityQueue;

/**
 * Dijkstra over a {@link RoadGraphStore}, edge cost = duration.
 *
 * <p>Labels are ordered by (duration, distance, node id): among equally fast paths the shorter one
 * wins, then the one reached through the lower node id, so results are reproducible. Uses a binary
 * heap with lazy deletion, O((V + E) log V). Searches are independent and may run concurrently.</p>
 */
public class PathFinder {
    private static final Logger log = LoggerFactory.getLogger(PathFinder.class);

    private static final long NO_PREDECESSOR = Long.MIN_VALUE;

    private final RoadGraphStore store;
    private final MetricsService metricsService;

    public PathFinder(RoadGraphStore store) {
        this(store, new NoOpMetricsService());
    }

    public PathFinder(RoadGraphStore store, MetricsService metricsService) {
        this.store = store;
        this.metricsService = metricsService;
    }

    public Optional<GraphPath> shortestPath(long sourceNodeId, long targetNodeId) {
        return shortestPath(List.of(sourceNodeId), List.of(targetNodeId));
    }

    /**
     * Fastest path from any of {@code sources} to any of {@code targets}.
     *
     * @return the path, or empty if no target is reachable
     */
    public Optional<GraphPath> shortestPath(Collection<Long> sources, Collection<Long> targets) {
        if (sources.isEmpty() || targets.isEmpty()) {
            return Optional.empty();
        }
        long started = System.nanoTime();

        LongOpenHashSet targetSet = new LongOpenHashSet();
        for (Long target : targets) {
            targetSet.add(target.longValue());
        }

        Long2DoubleOpenHashMap cost = new Long2DoubleOpenHashMap();
        cost.defaultReturnValue(Double.POSITIVE_INFINITY);
        Long2DoubleOpenHashMap distance = new Long2DoubleOpenHashMap();
        distance.defaultReturnValue(Double.POSITIVE_INFINITY);
        Long2LongOpenHashMap predecessor = new Long2LongOpenHashMap();
        predecessor.defaultReturnValue(NO_PREDECESSOR);
        Long2ObjectOpenHashMap<Edge> viaEdge = new Long2ObjectOpenHashMap<>();
        LongOpenHashSet settled = new LongOpenHashSet();
        PriorityQueue<Label> queue = new PriorityQueue<>();

        for (Long source : sources) {
            if (store.getNode(source).isEmpty()) {
                continue;
            }
            cost.put(source.longValue(), 0.0);
            distance.put(source.longValue(), 0.0);
            queue.add(new Label(source, 0.0, 0.0));
        }

        long reached = NO_PREDECESSOR;
        while (!queue.isEmpty()) {
            Label label = queue.poll();
            if (!settled.add(label.nodeId())) {
                continue;
            }
            if (targetSet.contains(label.nodeId())) {
                reached = label.nodeId();
                break;
            }
            for (Edge edge : store.outgoingEdges(label.nodeId())) {
                long next = edge.targetId();
                if (settled.contains(next)) {
                    continue;
                }
                double nextCost = label.cost() + edge.durationSeconds();
                double nextDistance = label.distance() + edge.distanceMeters();
                if (improves(nextCost, nextDistance, label.nodeId(),
                        cost.get(next), distance.get(next), predecessor.get(next))) {
                    cost.put(next, nextCost);
                    distance.put(next, nextDistance);
                    predecessor.put(next, label.nodeId());
                    viaEdge.put(next, edge);
                    queue.add(new Label(next, nextCost, nextDistance));
                }
            }
        }

        boolean found = reached != NO_PREDECESSOR;
        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
        metricsService.recordPathSearch(elapsed, settled.size(), found);
        if (!found) {
            log.debug("No path from {} to {} ({} nodes settled)", sources, targets, settled.size());
            return Optional.empty();
        }

        LongArrayList nodePath = new LongArrayList();
        List<Edge> edgePath = new ArrayList<>();
        for (long node = reached; node != NO_PREDECESSOR; node = predecessor.get(node)) {
            nodePath.add(node);
            Edge edge = viaEdge.get(node);
            if (edge != null) {
                edgePath.add(edge);
            }
        }
        List<Long> nodes = new ArrayList<>(nodePath);
        Collections.reverse(nodes);
        Collections.reverse(edgePath);

        log.debug("Path {} -> {}: {} nodes, {} s, {} m, {} settled in {} ms",
                nodes.get(0), reached, nodes.size(), cost.get(reached), distance.get(reached),
                settled.size(), elapsed.toMillis());
        return Optional.of(new GraphPath(nodes, edgePath, distance.get(reached), cost.get(reached), settled.size()));
    }

    private static boolean improves(double cost, double distance, long via,
                                    double bestCost, double bestDistance, long bestVia) {
        if (cost != bestCost) {
            return cost < bestCost;
        }
        if (distance != bestDistance) {
            return distance < bestDistance;
        }
        return bestVia != NO_PREDECESSOR && via < bestVia;
    }

    private record Label(long nodeId, double cost, double distance) implements Comparable<Label> {

        @Override
        public int compareTo(Label other) {
            int byCost = Double.compare(cost, other.cost);
            if (byCost != 0) {
                return byCost;
            }
            int byDistance = Double.compare(distance, other.distance);
            if (byDistance != 0) {
                return byDistance;
            }
            return Long.compare(nodeId, other.nodeId);
        }
    }
}
