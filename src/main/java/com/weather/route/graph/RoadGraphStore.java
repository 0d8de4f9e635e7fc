package com.weather.route.graph;

import com.weather.route.core.error.InvalidGraphDataException;
import com.weather.route.core.model.Coordinate;
import com.weather.route.core.model.Edge;
import com.weather.route.core.model.Node;
import com.weather.route.core.model.Place;
import com.weather.route.core.model.PlaceType;

import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Place/Node/Edge graph with idempotent incremental writes. Nodes and edges are addressed by
 * integer handles. Uniqueness is enforced by the store, so concurrent identical writes collapse
 * to one record without caller-side locking.
 */
public interface RoadGraphStore {

    // ========== Places ==========

    /**
     * Returns the place identified by (name, type, region), creating it on first use.
     * Coordinate and zone of an existing place are left untouched.
     */
    Place upsertPlace(String name, PlaceType type, String region, Coordinate coordinate, ZoneId zoneId);

    default Place upsertPlace(String name, PlaceType type, String region, Coordinate coordinate) {
        return upsertPlace(name, type, region, coordinate, ZoneOffset.UTC);
    }

    Optional<Place> findPlace(String name, PlaceType type, String region);

    Optional<Place> getPlace(long placeId);

    // ========== Nodes ==========

    /**
     * Reuses a node within snap tolerance of {@code coordinate}, or creates one.
     *
     * @param linkedPlaceId place the node is an access point for, or {@code null}
     * @return the node handle
     */
    long upsertNode(Coordinate coordinate, Long linkedPlaceId);

    /**
     * Marks a node as an access point of a place. Idempotent.
     */
    void linkNodeToPlace(long nodeId, long placeId);

    Optional<Node> getNode(long nodeId);

    List<Long> accessNodes(long placeId);

    Collection<Node> allNodes();

    /**
     * Closest node within {@code maxRadiusMeters}.
     */
    OptionalLong nearestNode(Coordinate coordinate, double maxRadiusMeters);

    /**
     * Nodes within {@code maxRadiusMeters}, closest first.
     */
    List<Long> nodesWithin(Coordinate coordinate, double maxRadiusMeters);

    // ========== Edges ==========

    /**
     * Inserts the directed edge source to target, or returns the existing one for that ordered pair.
     *
     * @throws InvalidGraphDataException for non-positive distance or speed, a self loop, or unknown nodes
     */
    long upsertEdge(long sourceNodeId, long targetNodeId, List<Coordinate> geometry,
                    double distanceMeters, double speedKmh);

    Optional<Edge> getEdge(long sourceNodeId, long targetNodeId);

    List<Edge> outgoingEdges(long nodeId);

    // ========== Maintenance ==========

    /**
     * Rebuilds the nearest-node index from the stored nodes.
     */
    void reloadSpatialIndex();

    int placeCount();

    int nodeCount();

    int edgeCount();

    /**
     * Shared edge constraints: strictly positive finite distance and speed, distinct endpoints.
     */
    static void validateEdge(long sourceNodeId, long targetNodeId, double distanceMeters, double speedKmh) {
        if (!(distanceMeters > 0) || Double.isInfinite(distanceMeters)) {
            throw new InvalidGraphDataException("Edge " + sourceNodeId + "->" + targetNodeId
                    + " must have a positive distance, got: " + distanceMeters);
        }
        if (!(speedKmh > 0) || Double.isInfinite(speedKmh)) {
            throw new InvalidGraphDataException("Edge " + sourceNodeId + "->" + targetNodeId
                    + " must have a positive speed, got: " + speedKmh);
        }
        if (sourceNodeId == targetNodeId) {
            throw new InvalidGraphDataException("Edge must connect two distinct nodes, got self loop on "
                    + sourceNodeId);
        }
    }
}
