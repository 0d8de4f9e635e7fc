package com.weather.route.core.model;

import java.util.List;

/**
 * Computed route between an ordered pair of places. Immutable once cached.
 *
 * @param sourcePlaceId source place handle
 * @param targetPlaceId target place handle
 * @param nodes         ordered node path
 * @param geometry      polyline along the node path
 * @param distanceKm    total distance in kilometers
 * @param durationHours total travel time in hours
 */
public record RouteRecord(long sourcePlaceId, long targetPlaceId, List<Long> nodes,
                          List<Coordinate> geometry, double distanceKm, double durationHours) {

    public RouteRecord {
        nodes = nodes != null ? List.copyOf(nodes) : List.of();
        geometry = geometry != null ? List.copyOf(geometry) : List.of();
    }

    public double averageSpeedKmh() {
        return durationHours > 0 ? distanceKm / durationHours : 0.0;
    }
}
