package com.weather.route.provider;

import com.weather.route.core.model.Coordinate;

import java.util.List;

/**
 * Finds named settlements along a route geometry. Used only to seed places off the critical path.
 */
public interface PlaceDiscoveryProvider {

    List<DiscoveredPlace> placesAlong(List<Coordinate> geometry);

    default String getProviderName() {
        return "places";
    }
}
