package com.weather.route.spatial;

import com.weather.route.core.model.Coordinate;

import java.util.List;

/**
 * Great-circle distance helpers.
 */
public final class GeoDistance {

    public static final double EARTH_RADIUS_METERS = 6_371_000.0;
    public static final double METERS_PER_DEGREE_LAT = 111_320.0;

    private GeoDistance() {
        // utility class
    }

    /**
     * Haversine distance in meters.
     */
    public static double haversineMeters(Coordinate a, Coordinate b) {
        double phi1 = Math.toRadians(a.lat());
        double phi2 = Math.toRadians(b.lat());
        double dPhi = Math.toRadians(b.lat() - a.lat());
        double dLambda = Math.toRadians(b.lon() - a.lon());

        double h = Math.sin(dPhi / 2) * Math.sin(dPhi / 2)
                + Math.cos(phi1) * Math.cos(phi2) * Math.sin(dLambda / 2) * Math.sin(dLambda / 2);
        return 2 * EARTH_RADIUS_METERS * Math.atan2(Math.sqrt(h), Math.sqrt(1 - h));
    }

    /**
     * Sum of haversine distances along a polyline, in meters.
     */
    public static double lengthMeters(List<Coordinate> polyline) {
        double total = 0.0;
        for (int i = 1; i < polyline.size(); i++) {
            total += haversineMeters(polyline.get(i - 1), polyline.get(i));
        }
        return total;
    }
}
