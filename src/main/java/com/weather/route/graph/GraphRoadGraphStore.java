package com.weather.route.graph;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
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
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.ThreadLocalRandom;

/**
 * FalkorDB-backed {@link RoadGraphStore}.
 *
 * <p>Writes go through Cypher MERGE on a unique property ({@code identity} for places,
 * {@code coordKey} for nodes, the ordered node pair for {@code :ROAD} relationships), so
 * concurrent writers from any process converge on one record. The handle the database returns
 * is mirrored into an {@link InMemoryRoadGraphStore} that serves reads and path searches.</p>
 */
public class GraphRoadGraphStore implements RoadGraphStore {
    private static final Logger log = LoggerFactory.getLogger(GraphRoadGraphStore.class);

    private static final TypeReference<List<Coordinate>> GEOMETRY_TYPE = new TypeReference<>() {
    };

    private final GraphConnection connection;
    private final int locatorPrecision;
    private final double snapToleranceMeters;
    private volatile InMemoryRoadGraphStore mirror;
    private final ObjectMapper objectMapper;

    public GraphRoadGraphStore(GraphConnection connection, NearestNodeLocator locator, double snapToleranceMeters,
                               ObjectMapper objectMapper) {
        this.connection = Objects.requireNonNull(connection, "connection is required");
        this.locatorPrecision = locator.gridPrecision();
        this.snapToleranceMeters = snapToleranceMeters;
        this.objectMapper = objectMapper;
        createIndexes();
        this.mirror = load(new InMemoryRoadGraphStore(locator, snapToleranceMeters));
    }

    private void createIndexes() {
        safeExecute("CREATE INDEX FOR (p:Place) ON (p.identity)");
        safeExecute("CREATE INDEX FOR (p:Place) ON (p.id)");
        safeExecute("CREATE INDEX FOR (n:Node) ON (n.coordKey)");
        safeExecute("CREATE INDEX FOR (n:Node) ON (n.id)");
    }

    private void safeExecute(String query) {
        try {
            connection.execute(query);
        } catch (Exception e) {
            log.debug("Index creation query result: {} - {}", query, e.getMessage());
        }
    }

    // ========== Places ==========

    @Override
    public Place upsertPlace(String name, PlaceType type, String region, Coordinate coordinate, ZoneId zoneId) {
        InputSanitizer.validatePlaceName(name, "Place name");
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(coordinate, "coordinate is required");

        Optional<Place> known = mirror.findPlace(name, type, region);
        if (known.isPresent()) {
            return known.get();
        }

        String query = """
                MERGE (p:Place {identity: $identity})
                ON CREATE SET p.id = $id, p.name = $name, p.type = $type, p.region = $region,
                              p.lat = $lat, p.lon = $lon, p.zone = $zone
                RETURN p.id as id, p.name as name, p.type as type, p.region as region,
                       p.lat as lat, p.lon as lon, p.zone as zone
                """;
        Map<String, Object> params = new HashMap<>();
        params.put("identity", Place.identityKey(name, type, region));
        params.put("id", newHandle());
        params.put("name", name.trim());
        params.put("type", type.name());
        params.put("region", region != null ? region : "");
        params.put("lat", coordinate.lat());
        params.put("lon", coordinate.lon());
        params.put("zone", zoneId.getId());

        Place place = mapToPlace(connection.query(query, params).get(0));
        mirror.restorePlace(place);
        log.debug("Upserted place {}", place);
        return place;
    }

    @Override
    public Optional<Place> findPlace(String name, PlaceType type, String region) {
        return mirror.findPlace(name, type, region);
    }

    @Override
    public Optional<Place> getPlace(long placeId) {
        return mirror.getPlace(placeId);
    }

    // ========== Nodes ==========

    @Override
    public long upsertNode(Coordinate coordinate, Long linkedPlaceId) {
        Objects.requireNonNull(coordinate, "coordinate is required");
        if (linkedPlaceId != null && mirror.getPlace(linkedPlaceId).isEmpty()) {
            throw new NotFoundException("Unknown place: " + linkedPlaceId);
        }

        OptionalLong snapped = mirror.nearestNode(coordinate, snapToleranceMeters);
        long nodeId;
        if (snapped.isPresent()) {
            nodeId = snapped.getAsLong();
        } else {
            String query = """
                    MERGE (n:Node {coordKey: $coordKey})
                    ON CREATE SET n.id = $id, n.lat = $lat, n.lon = $lon, n.placeId = -1, n.label = ''
                    RETURN n.id as id, n.lat as lat, n.lon as lon, n.placeId as placeId, n.label as label
                    """;
            Node node = mapToNode(connection.query(query, Map.of(
                    "coordKey", coordinate.key(),
                    "id", newHandle(),
                    "lat", coordinate.lat(),
                    "lon", coordinate.lon()
            )).get(0));
            mirror.restoreNode(node);
            nodeId = node.id();
        }

        if (linkedPlaceId != null) {
            linkNodeToPlace(nodeId, linkedPlaceId);
        }
        return nodeId;
    }

    @Override
    public void linkNodeToPlace(long nodeId, long placeId) {
        Place place = mirror.getPlace(placeId)
                .orElseThrow(() -> new NotFoundException("Unknown place: " + placeId));
        String query = """
                MATCH (n:Node {id: $nodeId}), (p:Place {id: $placeId})
                MERGE (n)-[:ACCESS_FOR]->(p)
                SET n.label = CASE WHEN n.placeId = -1 THEN $label ELSE n.label END
                SET n.placeId = CASE WHEN n.placeId = -1 THEN $placeId ELSE n.placeId END
                """;
        connection.execute(query, Map.of(
                "nodeId", nodeId,
                "placeId", placeId,
                "label", "access:" + place.getName()
        ));
        mirror.linkNodeToPlace(nodeId, placeId);
    }

    @Override
    public Optional<Node> getNode(long nodeId) {
        return mirror.getNode(nodeId);
    }

    @Override
    public List<Long> accessNodes(long placeId) {
        return mirror.accessNodes(placeId);
    }

    @Override
    public Collection<Node> allNodes() {
        return mirror.allNodes();
    }

    @Override
    public OptionalLong nearestNode(Coordinate coordinate, double maxRadiusMeters) {
        return mirror.nearestNode(coordinate, maxRadiusMeters);
    }

    @Override
    public List<Long> nodesWithin(Coordinate coordinate, double maxRadiusMeters) {
        return mirror.nodesWithin(coordinate, maxRadiusMeters);
    }

    // ========== Edges ==========

    @Override
    public long upsertEdge(long sourceNodeId, long targetNodeId, List<Coordinate> geometry,
                           double distanceMeters, double speedKmh) {
        RoadGraphStore.validateEdge(sourceNodeId, targetNodeId, distanceMeters, speedKmh);
        Optional<Edge> known = mirror.getEdge(sourceNodeId, targetNodeId);
        if (known.isPresent()) {
            return known.get().id();
        }

        String query = """
                MATCH (a:Node {id: $sourceId}), (b:Node {id: $targetId})
                MERGE (a)-[r:ROAD]->(b)
                ON CREATE SET r.id = $id, r.distance = $distance, r.speed = $speed, r.geometry = $geometry
                RETURN r.id as id, r.distance as distance, r.speed as speed, r.geometry as geometry
                """;
        Map<String, Object> params = new HashMap<>();
        params.put("sourceId", sourceNodeId);
        params.put("targetId", targetNodeId);
        params.put("id", newHandle());
        params.put("distance", distanceMeters);
        params.put("speed", speedKmh);
        params.put("geometry", writeGeometry(geometry));

        List<Map<String, Object>> rows = connection.query(query, params);
        if (rows.isEmpty()) {
            throw new InvalidGraphDataException(
                    "Edge references unknown node: " + sourceNodeId + " or " + targetNodeId);
        }
        Edge edge = mapToEdge(sourceNodeId, targetNodeId, rows.get(0));
        mirror.restoreEdge(edge);
        return edge.id();
    }

    @Override
    public Optional<Edge> getEdge(long sourceNodeId, long targetNodeId) {
        return mirror.getEdge(sourceNodeId, targetNodeId);
    }

    @Override
    public List<Edge> outgoingEdges(long nodeId) {
        return mirror.outgoingEdges(nodeId);
    }

    // ========== Maintenance ==========

    /**
     * Reloads places, nodes and edges from the database into a fresh mirror with its own
     * nearest-node index, and swaps it in once fully loaded. Picks up edits made outside this
     * process. On failure the current mirror stays in place and the error propagates.
     */
    @Override
    public synchronized void reloadSpatialIndex() {
        mirror = load(new InMemoryRoadGraphStore(new NearestNodeLocator(locatorPrecision), snapToleranceMeters));
    }

    @Override
    public int placeCount() {
        return mirror.placeCount();
    }

    @Override
    public int nodeCount() {
        return mirror.nodeCount();
    }

    @Override
    public int edgeCount() {
        return mirror.edgeCount();
    }

    private InMemoryRoadGraphStore load(InMemoryRoadGraphStore target) {
        for (Map<String, Object> row : connection.query("""
                MATCH (p:Place)
                RETURN p.id as id, p.name as name, p.type as type, p.region as region,
                       p.lat as lat, p.lon as lon, p.zone as zone
                """)) {
            target.restorePlace(mapToPlace(row));
        }
        for (Map<String, Object> row : connection.query("""
                MATCH (n:Node)
                RETURN n.id as id, n.lat as lat, n.lon as lon, n.placeId as placeId, n.label as label
                """)) {
            target.restoreNode(mapToNode(row));
        }
        for (Map<String, Object> row : connection.query("""
                MATCH (n:Node)-[:ACCESS_FOR]->(p:Place)
                RETURN n.id as nodeId, p.id as placeId
                """)) {
            target.restoreAccess(toLong(row.get("nodeId")), toLong(row.get("placeId")));
        }
        for (Map<String, Object> row : connection.query("""
                MATCH (a:Node)-[r:ROAD]->(b:Node)
                RETURN a.id as sourceId, b.id as targetId, r.id as id,
                       r.distance as distance, r.speed as speed, r.geometry as geometry
                """)) {
            target.restoreEdge(mapToEdge(toLong(row.get("sourceId")), toLong(row.get("targetId")), row));
        }
        log.info("Road graph loaded from {}: {} places, {} nodes, {} edges",
                connection.getGraphName(), target.placeCount(), target.nodeCount(), target.edgeCount());
        return target;
    }

    // ========== Row mapping ==========

    private Place mapToPlace(Map<String, Object> row) {
        String zone = (String) row.get("zone");
        return Place.builder()
                .id(toLong(row.get("id")))
                .name((String) row.get("name"))
                .type(PlaceType.fromString((String) row.get("type")))
                .region((String) row.get("region"))
                .coordinate(new Coordinate(toDouble(row.get("lat")), toDouble(row.get("lon"))))
                .zoneId(zone == null || zone.isEmpty() ? ZoneOffset.UTC : ZoneId.of(zone))
                .build();
    }

    private Node mapToNode(Map<String, Object> row) {
        long placeId = row.get("placeId") != null ? toLong(row.get("placeId")) : -1L;
        return new Node(
                toLong(row.get("id")),
                new Coordinate(toDouble(row.get("lat")), toDouble(row.get("lon"))),
                placeId < 0 ? null : placeId,
                (String) row.get("label")
        );
    }

    private Edge mapToEdge(long sourceId, long targetId, Map<String, Object> row) {
        return new Edge(
                toLong(row.get("id")),
                sourceId,
                targetId,
                readGeometry((String) row.get("geometry")),
                toDouble(row.get("distance")),
                toDouble(row.get("speed"))
        );
    }

    private String writeGeometry(List<Coordinate> geometry) {
        try {
            return objectMapper.writeValueAsString(geometry != null ? geometry : List.of());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize edge geometry", e);
        }
    }

    private List<Coordinate> readGeometry(String json) {
        if (json == null || json.isEmpty()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, GEOMETRY_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable edge geometry, using empty polyline: {}", e.getMessage());
            return List.of();
        }
    }

    private static long toLong(Object value) {
        return ((Number) value).longValue();
    }

    private static double toDouble(Object value) {
        return ((Number) value).doubleValue();
    }

    private static long newHandle() {
        return ThreadLocalRandom.current().nextLong(1, Long.MAX_VALUE);
    }
}
