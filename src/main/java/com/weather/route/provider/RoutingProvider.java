package com.weather.route.provider;

import com.weather.route.core.model.Coordinate;

/**
 * Upstream road router (OSRM, Mapbox, ...). Consulted only when the local graph cannot connect two places.
 */
public interface RoutingProvider {

    RoutingResult route(Coordinate origin, Coordinate destination);

    default String getProviderName() {
        return "routing";
    }
}
