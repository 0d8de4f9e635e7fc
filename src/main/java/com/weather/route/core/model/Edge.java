package com.weather.route.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Directed road segment between two nodes. Duration is always derived from
 * distance and speed, never stored on its own.
 *
 * @param id             handle assigned by the store
 * @param sourceId       source node handle
 * @param targetId       target node handle
 * @param geometry       polyline from source to target
 * @param distanceMeters length in meters, strictly positive
 * @param speedKmh       maximum speed in km/h, strictly positive
 */
public record Edge(long id, long sourceId, long targetId, List<Coordinate> geometry,
                   double distanceMeters, double speedKmh) {

    public Edge {
        geometry = geometry != null ? List.copyOf(geometry) : List.of();
        Objects.requireNonNull(geometry);
    }

    /**
     * Travel time in seconds: distance / (speed / 3.6).
     */
    public double durationSeconds() {
        return durationSeconds(distanceMeters, speedKmh);
    }

    public static double durationSeconds(double distanceMeters, double speedKmh) {
        return distanceMeters / (speedKmh / 3.6);
    }
}
