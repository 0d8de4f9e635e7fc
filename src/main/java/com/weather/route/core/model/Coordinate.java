package com.weather.route.core.model;

/**
 * WGS84 point in decimal degrees.
 *
 * @param lat latitude, -90..90
 * @param lon longitude, -180..180
 */
public record Coordinate(double lat, double lon) {

    public Coordinate {
        if (!Double.isFinite(lat) || lat < -90.0 || lat > 90.0) {
            throw new IllegalArgumentException("Latitude must be within [-90, 90], got: " + lat);
        }
        if (!Double.isFinite(lon) || lon < -180.0 || lon > 180.0) {
            throw new IllegalArgumentException("Longitude must be within [-180, 180], got: " + lon);
        }
    }

    public static Coordinate of(double lat, double lon) {
        return new Coordinate(lat, lon);
    }

    /**
     * Stable textual key rounded to 1e-6 degrees (about 11 cm), used for store-level uniqueness.
     */
    public String key() {
        return String.format(java.util.Locale.ROOT, "%.6f,%.6f", lat, lon);
    }
}
