package com.weather.route.graph;

import java.util.Locale;

/**
 * OSM highway classes with the speed assumed when a provider gives no better figure.
 */
public enum RoadClass {
    MOTORWAY(100),
    TRUNK(90),
    PRIMARY(80),
    SECONDARY(60),
    TERTIARY(50),
    RESIDENTIAL(30),
    SERVICE(20),
    UNCLASSIFIED(50);

    private final double speedKmh;

    RoadClass(double speedKmh) {
        this.speedKmh = speedKmh;
    }

    public double speedKmh() {
        return speedKmh;
    }

    /**
     * Maps an OSM {@code highway=*} tag; link roads take their parent class, unknown tags are unclassified.
     */
    public static RoadClass fromHighwayTag(String tag) {
        if (tag == null || tag.isBlank()) {
            return UNCLASSIFIED;
        }
        String normalized = tag.trim().toUpperCase(Locale.ROOT);
        if (normalized.endsWith("_LINK")) {
            normalized = normalized.substring(0, normalized.length() - "_LINK".length());
        }
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            return UNCLASSIFIED;
        }
    }
}
