package com.weather.route.core.model;

import java.util.Locale;

/**
 * Settlement classification of a {@link Place}, as reported by the geocoder.
 */
public enum PlaceType {
    CITY,
    TOWN,
    VILLAGE,
    HAMLET,
    LOCALITY;

    /**
     * Lenient parse: case-insensitive, unknown values map to {@link #LOCALITY}.
     */
    public static PlaceType fromString(String value) {
        if (value == null || value.isBlank()) {
            return LOCALITY;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return LOCALITY;
        }
    }
}
