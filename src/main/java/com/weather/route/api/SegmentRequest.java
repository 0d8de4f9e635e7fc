package com.weather.route.api;

import com.weather.route.core.model.Coordinate;

import java.time.Instant;
import java.util.Objects;

/**
 * One position and time to look up weather for.
 */
public record SegmentRequest(Coordinate coordinate, Instant timestamp) {

    public SegmentRequest {
        Objects.requireNonNull(coordinate, "coordinate is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
    }
}
