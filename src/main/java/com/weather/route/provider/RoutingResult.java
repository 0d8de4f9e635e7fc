package com.weather.route.provider;

import com.weather.route.core.model.Coordinate;
import com.weather.route.graph.RoadClass;

import java.util.List;

/**
 * Route returned by a {@link RoutingProvider}.
 *
 * @param geometry      polyline from origin to destination, at least two points
 * @param distanceKm    provider-reported length
 * @param durationHours provider-reported travel time
 * @param roadClasses   road class per geometry vertex, or empty when the provider gives none
 */
public record RoutingResult(List<Coordinate> geometry, double distanceKm, double durationHours,
                            List<RoadClass> roadClasses) {

    public RoutingResult {
        geometry = geometry != null ? List.copyOf(geometry) : List.of();
        roadClasses = roadClasses != null ? List.copyOf(roadClasses) : List.of();
        if (!roadClasses.isEmpty() && roadClasses.size() != geometry.size()) {
            throw new IllegalArgumentException("roadClasses must match geometry size: "
                    + roadClasses.size() + " vs " + geometry.size());
        }
    }

    public RoutingResult(List<Coordinate> geometry, double distanceKm, double durationHours) {
        this(geometry, distanceKm, durationHours, List.of());
    }

    /**
     * Average speed implied by the provider totals, or 0 if the totals are unusable.
     */
    public double averageSpeedKmh() {
        if (distanceKm > 0 && durationHours > 0 && Double.isFinite(distanceKm / durationHours)) {
            return distanceKm / durationHours;
        }
        return 0.0;
    }
}
