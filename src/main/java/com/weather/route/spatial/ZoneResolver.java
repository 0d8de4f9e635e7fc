package com.weather.route.spatial;

import com.weather.route.core.model.Coordinate;

import java.time.ZoneId;

/**
 * Looks up the IANA time zone for a coordinate. Used only to place local hour boundaries.
 */
@FunctionalInterface
public interface ZoneResolver {

    ZoneId zoneAt(Coordinate coordinate);

    /**
     * Resolver that answers the same zone everywhere.
     */
    static ZoneResolver fixed(ZoneId zoneId) {
        return coordinate -> zoneId;
    }
}
