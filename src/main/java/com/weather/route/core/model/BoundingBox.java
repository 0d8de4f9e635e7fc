package com.weather.route.core.model;

/**
 * Latitude/longitude rectangle covered by a spatial cell.
 */
public record BoundingBox(double minLat, double minLon, double maxLat, double maxLon) {

    public BoundingBox {
        if (minLat > maxLat || minLon > maxLon) {
            throw new IllegalArgumentException("Bounding box minimum must not exceed maximum");
        }
    }

    public Coordinate center() {
        return new Coordinate((minLat + maxLat) / 2.0, (minLon + maxLon) / 2.0);
    }

    public boolean contains(Coordinate coordinate) {
        return coordinate.lat() >= minLat && coordinate.lat() <= maxLat
                && coordinate.lon() >= minLon && coordinate.lon() <= maxLon;
    }

    public double latSpan() {
        return maxLat - minLat;
    }

    public double lonSpan() {
        return maxLon - minLon;
    }
}
