package com.weather.route.spatial;

import com.weather.route.core.model.Coordinate;
import com.weather.route.core.model.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Spatial lookup of graph nodes, bucketed on a fine geohash grid.
 *
 * <p>Queries expand ring by ring around the query cell and stop once no unvisited ring can hold a
 * closer node. Updates are lock-free; {@link #rebuild(Collection)} swaps in a freshly built index
 * atomically so readers never observe a half-loaded grid.</p>
 */
public class NearestNodeLocator {
    private static final Logger log = LoggerFactory.getLogger(NearestNodeLocator.class);

    /** Above this many rings a query falls back to a scan over all indexed nodes. */
    static final int MAX_RING_SEARCH = 48;

    private final GeohashCellIndex grid;
    private volatile Index index = new Index();

    public NearestNodeLocator(int gridPrecision) {
        this.grid = new GeohashCellIndex(gridPrecision);
    }

    public int gridPrecision() {
        return grid.resolution();
    }

    /**
     * Adds or moves a node.
     */
    public void add(long nodeId, Coordinate coordinate) {
        Index current = index;
        Coordinate previous = current.positions.put(nodeId, coordinate);
        if (previous != null) {
            removeFromBucket(current, nodeId, previous);
        }
        current.buckets.computeIfAbsent(grid.encode(coordinate), k -> ConcurrentHashMap.newKeySet())
                .add(nodeId);
    }

    public void remove(long nodeId) {
        Index current = index;
        Coordinate previous = current.positions.remove(nodeId);
        if (previous != null) {
            removeFromBucket(current, nodeId, previous);
        }
    }

    /**
     * Replaces the whole index with the given nodes.
     */
    public void rebuild(Collection<Node> nodes) {
        Index fresh = new Index();
        for (Node node : nodes) {
            fresh.positions.put(node.id(), node.coordinate());
            fresh.buckets.computeIfAbsent(grid.encode(node.coordinate()), k -> ConcurrentHashMap.newKeySet())
                    .add(node.id());
        }
        index = fresh;
        log.info("Nearest-node index rebuilt: {} nodes in {} cells", fresh.positions.size(), fresh.buckets.size());
    }

    public int size() {
        return index.positions.size();
    }

    /**
     * Closest node within {@code maxRadiusMeters}; ties go to the lower node id.
     */
    public OptionalLong nearest(Coordinate coordinate, double maxRadiusMeters) {
        List<Candidate> candidates = search(coordinate, maxRadiusMeters, true);
        return candidates.isEmpty() ? OptionalLong.empty() : OptionalLong.of(candidates.get(0).nodeId());
    }

    /**
     * All nodes within {@code maxRadiusMeters}, closest first.
     */
    public List<Long> within(Coordinate coordinate, double maxRadiusMeters) {
        List<Long> ids = new ArrayList<>();
        for (Candidate candidate : search(coordinate, maxRadiusMeters, false)) {
            ids.add(candidate.nodeId());
        }
        return ids;
    }

    private List<Candidate> search(Coordinate coordinate, double maxRadiusMeters, boolean closestOnly) {
        if (maxRadiusMeters < 0) {
            throw new IllegalArgumentException("maxRadiusMeters must be >= 0");
        }
        Index current = index;
        List<Candidate> found = new ArrayList<>();
        if (current.positions.isEmpty()) {
            return found;
        }

        double[] size = grid.cellSizeMeters(coordinate.lat());
        double minCellMeters = Math.max(1.0, Math.min(size[0], size[1]));
        int ringsNeeded = (int) Math.ceil(maxRadiusMeters / minCellMeters) + 1;

        if (ringsNeeded > MAX_RING_SEARCH) {
            for (Map.Entry<Long, Coordinate> entry : current.positions.entrySet()) {
                collect(found, coordinate, entry.getKey(), entry.getValue(), maxRadiusMeters);
            }
        } else {
            String origin = grid.encode(coordinate);
            for (int k = 0; k <= ringsNeeded; k++) {
                for (String cell : grid.ring(origin, k)) {
                    Set<Long> bucket = current.buckets.get(cell);
                    if (bucket == null) {
                        continue;
                    }
                    for (Long nodeId : bucket) {
                        Coordinate position = current.positions.get(nodeId);
                        if (position != null) {
                            collect(found, coordinate, nodeId, position, maxRadiusMeters);
                        }
                    }
                }
                // Every cell in ring k+1 is at least k cell-widths away from the query point.
                if (closestOnly && !found.isEmpty() && minDistance(found) <= k * minCellMeters) {
                    break;
                }
            }
        }

        found.sort(Comparator.comparingDouble(Candidate::distanceMeters).thenComparingLong(Candidate::nodeId));
        return closestOnly && found.size() > 1 ? List.of(found.get(0)) : found;
    }

    private static void collect(List<Candidate> found, Coordinate query, long nodeId, Coordinate position,
                                double maxRadiusMeters) {
        double distance = GeoDistance.haversineMeters(query, position);
        if (distance <= maxRadiusMeters) {
            found.add(new Candidate(nodeId, distance));
        }
    }

    private static double minDistance(List<Candidate> found) {
        double min = Double.MAX_VALUE;
        for (Candidate candidate : found) {
            min = Math.min(min, candidate.distanceMeters());
        }
        return min;
    }

    private void removeFromBucket(Index current, long nodeId, Coordinate position) {
        Set<Long> bucket = current.buckets.get(grid.encode(position));
        if (bucket != null) {
            bucket.remove(nodeId);
        }
    }

    private record Candidate(long nodeId, double distanceMeters) {
    }

    private static final class Index {
        final Map<String, Set<Long>> buckets = new ConcurrentHashMap<>();
        final Map<Long, Coordinate> positions = new ConcurrentHashMap<>();
    }
}
