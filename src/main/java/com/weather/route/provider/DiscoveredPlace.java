package com.weather.route.provider;

import com.weather.route.core.model.Coordinate;
import com.weather.route.core.model.PlaceType;

import java.util.Objects;

/**
 * A settlement reported by a {@link PlaceDiscoveryProvider}.
 */
public record DiscoveredPlace(String name, Coordinate coordinate, PlaceType type, String region) {

    public DiscoveredPlace {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(coordinate, "coordinate is required");
        type = type != null ? type : PlaceType.LOCALITY;
        region = region != null ? region : "";
    }

    public static DiscoveredPlace of(String name, Coordinate coordinate) {
        return new DiscoveredPlace(name, coordinate, PlaceType.LOCALITY, "");
    }
}
