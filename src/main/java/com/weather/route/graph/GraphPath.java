package com.weather.route.graph;

import com.weather.route.core.model.Coordinate;
import com.weather.route.core.model.Edge;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of a shortest-path search.
 *
 * @param nodes                ordered node handles from source to target
 * @param edges                traversed edges, one fewer than nodes
 * @param totalDistanceMeters  summed edge distance
 * @param totalDurationSeconds summed edge duration (the search cost)
 * @param settledNodes         nodes settled by the search, for diagnostics
 */
public record GraphPath(List<Long> nodes, List<Edge> edges, double totalDistanceMeters,
                        double totalDurationSeconds, int settledNodes) {

    public GraphPath {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
    }

    public double totalDistanceKm() {
        return totalDistanceMeters / 1000.0;
    }

    public double totalDurationHours() {
        return totalDurationSeconds / 3600.0;
    }

    /**
     * Concatenated edge geometry without repeating shared end points.
     */
    public List<Coordinate> geometry() {
        List<Coordinate> points = new ArrayList<>();
        for (Edge edge : edges) {
            for (Coordinate point : edge.geometry()) {
                if (points.isEmpty() || !points.get(points.size() - 1).equals(point)) {
                    points.add(point);
                }
            }
        }
        return points;
    }
}
