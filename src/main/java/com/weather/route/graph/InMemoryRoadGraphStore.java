package com.weather.route.graph;

import com.weather.route.core.error.InvalidGraphDataException;
import com.weather.route.core.error.NotFoundException;
import com.weather.route.core.model.Coordinate;
import com.weather.route.core.model.Edge;
import com.weather.route.core.model.Node;
import com.weather.route.core.model.Place;
import com.weather.route.core.model.PlaceType;
import com.weather.route.spatial.NearestNodeLocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Node/edge arena kept in memory. Every uniqueness rule is a {@code computeIfAbsent} on a
 * concurrent map, so identical concurrent inserts resolve to the same handle.
 *
 * <p>Also serves as the read mirror of {@link GraphRoadGraphStore}, which feeds it through the
 * {@code restore*} methods with handles assigned by the database.</p>
 */
public class InMemoryRoadGraphStore implements RoadGraphStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryRoadGraphStore.class);

    private final NearestNodeLocator locator;
    private final double snapToleranceMeters;

    private final AtomicLong placeSequence = new AtomicLong();
    private final AtomicLong nodeSequence = new AtomicLong();
    private final AtomicLong edgeSequence = new AtomicLong();
    private final AtomicInteger edgeCount = new AtomicInteger();

    private final Map<String, Place> placesByIdentity = new ConcurrentHashMap<>();
    private final Map<Long, Place> placesById = new ConcurrentHashMap<>();
    private final Map<Long, Node> nodes = new ConcurrentHashMap<>();
    private final Map<String, Long> nodesByCoordinate = new ConcurrentHashMap<>();
    // source -> (target -> edge)
    private final Map<Long, Map<Long, Edge>> adjacency = new ConcurrentHashMap<>();
    private final Map<Long, Set<Long>> accessPoints = new ConcurrentHashMap<>();

    public InMemoryRoadGraphStore(NearestNodeLocator locator, double snapToleranceMeters) {
        if (snapToleranceMeters < 0) {
            throw new IllegalArgumentException("snapToleranceMeters must be >= 0");
        }
        this.locator = Objects.requireNonNull(locator, "locator is required");
        this.snapToleranceMeters = snapToleranceMeters;
    }

    // ========== Places ==========

    @Override
    public Place upsertPlace(String name, PlaceType type, String region, Coordinate coordinate, ZoneId zoneId) {
        InputSanitizer.validatePlaceName(name, "Place name");
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(coordinate, "coordinate is required");
        String identity = Place.identityKey(name, type, region);

        return placesByIdentity.computeIfAbsent(identity, k -> {
            Place place = Place.builder()
                    .id(placeSequence.incrementAndGet())
                    .name(name.trim())
                    .type(type)
                    .region(region)
                    .coordinate(coordinate)
                    .zoneId(zoneId)
                    .build();
            placesById.put(place.getId(), place);
            log.debug("Created place {}", place);
            return place;
        });
    }

    @Override
    public Optional<Place> findPlace(String name, PlaceType type, String region) {
        return Optional.ofNullable(placesByIdentity.get(Place.identityKey(name, type, region)));
    }

    @Override
    public Optional<Place> getPlace(long placeId) {
        return Optional.ofNullable(placesById.get(placeId));
    }

    // ========== Nodes ==========

    @Override
    public long upsertNode(Coordinate coordinate, Long linkedPlaceId) {
        Objects.requireNonNull(coordinate, "coordinate is required");
        if (linkedPlaceId != null && !placesById.containsKey(linkedPlaceId)) {
            throw new NotFoundException("Unknown place: " + linkedPlaceId);
        }

        OptionalLong snapped = locator.nearest(coordinate, snapToleranceMeters);
        long nodeId;
        if (snapped.isPresent()) {
            nodeId = snapped.getAsLong();
        } else {
            nodeId = nodesByCoordinate.computeIfAbsent(coordinate.key(), k -> {
                long id = nodeSequence.incrementAndGet();
                nodes.put(id, new Node(id, coordinate, null, ""));
                locator.add(id, coordinate);
                return id;
            });
        }

        if (linkedPlaceId != null) {
            linkNodeToPlace(nodeId, linkedPlaceId);
        }
        return nodeId;
    }

    @Override
    public void linkNodeToPlace(long nodeId, long placeId) {
        Place place = placesById.get(placeId);
        if (place == null) {
            throw new NotFoundException("Unknown place: " + placeId);
        }
        Node updated = nodes.computeIfPresent(nodeId, (id, node) ->
                node.isAccessPoint() ? node : node.withPlace(placeId, "access:" + place.getName()));
        if (updated == null) {
            throw new NotFoundException("Unknown node: " + nodeId);
        }
        accessPoints.computeIfAbsent(placeId, k -> ConcurrentHashMap.newKeySet()).add(nodeId);
    }

    @Override
    public Optional<Node> getNode(long nodeId) {
        return Optional.ofNullable(nodes.get(nodeId));
    }

    @Override
    public List<Long> accessNodes(long placeId) {
        Set<Long> ids = accessPoints.get(placeId);
        if (ids == null) {
            return List.of();
        }
        List<Long> sorted = new ArrayList<>(ids);
        Collections.sort(sorted);
        return sorted;
    }

    @Override
    public Collection<Node> allNodes() {
        return Collections.unmodifiableCollection(new ArrayList<>(nodes.values()));
    }

    @Override
    public OptionalLong nearestNode(Coordinate coordinate, double maxRadiusMeters) {
        return locator.nearest(coordinate, maxRadiusMeters);
    }

    @Override
    public List<Long> nodesWithin(Coordinate coordinate, double maxRadiusMeters) {
        return locator.within(coordinate, maxRadiusMeters);
    }

    // ========== Edges ==========

    @Override
    public long upsertEdge(long sourceNodeId, long targetNodeId, List<Coordinate> geometry,
                           double distanceMeters, double speedKmh) {
        RoadGraphStore.validateEdge(sourceNodeId, targetNodeId, distanceMeters, speedKmh);
        requireNode(sourceNodeId);
        requireNode(targetNodeId);

        Edge edge = adjacency.computeIfAbsent(sourceNodeId, k -> new ConcurrentHashMap<>())
                .computeIfAbsent(targetNodeId, k -> {
                    edgeCount.incrementAndGet();
                    return new Edge(edgeSequence.incrementAndGet(), sourceNodeId, targetNodeId,
                            geometry, distanceMeters, speedKmh);
                });
        return edge.id();
    }

    @Override
    public Optional<Edge> getEdge(long sourceNodeId, long targetNodeId) {
        Map<Long, Edge> out = adjacency.get(sourceNodeId);
        return out == null ? Optional.empty() : Optional.ofNullable(out.get(targetNodeId));
    }

    @Override
    public List<Edge> outgoingEdges(long nodeId) {
        Map<Long, Edge> out = adjacency.get(nodeId);
        return out == null ? List.of() : new ArrayList<>(out.values());
    }

    // ========== Maintenance ==========

    @Override
    public void reloadSpatialIndex() {
        locator.rebuild(nodes.values());
    }

    @Override
    public int placeCount() {
        return placesById.size();
    }

    @Override
    public int nodeCount() {
        return nodes.size();
    }

    @Override
    public int edgeCount() {
        return edgeCount.get();
    }

    // ========== Mirror loading ==========

    void restorePlace(Place place) {
        placesByIdentity.put(place.identityKey(), place);
        placesById.put(place.getId(), place);
    }

    void restoreNode(Node node) {
        nodes.put(node.id(), node);
        nodesByCoordinate.putIfAbsent(node.coordinate().key(), node.id());
        if (node.placeId() != null) {
            accessPoints.computeIfAbsent(node.placeId(), k -> ConcurrentHashMap.newKeySet()).add(node.id());
        }
        locator.add(node.id(), node.coordinate());
    }

    void restoreAccess(long nodeId, long placeId) {
        accessPoints.computeIfAbsent(placeId, k -> ConcurrentHashMap.newKeySet()).add(nodeId);
    }

    void restoreEdge(Edge edge) {
        Edge previous = adjacency.computeIfAbsent(edge.sourceId(), k -> new ConcurrentHashMap<>())
                .putIfAbsent(edge.targetId(), edge);
        if (previous == null) {
            edgeCount.incrementAndGet();
        }
    }

    private void requireNode(long nodeId) {
        if (!nodes.containsKey(nodeId)) {
            throw new InvalidGraphDataException("Edge references unknown node: " + nodeId);
        }
    }
}
