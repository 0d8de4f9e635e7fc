package com.weather.route.core.model;

import java.util.Objects;

/**
 * Road graph vertex addressed by an integer handle.
 *
 * @param id      handle assigned by the store
 * @param coordinate position
 * @param placeId id of the place this node is an access point for, or {@code null}
 * @param label   free-form label (e.g. "access:Tehran", "sample")
 */
public record Node(long id, Coordinate coordinate, Long placeId, String label) {

    public Node {
        Objects.requireNonNull(coordinate, "coordinate is required");
        label = label != null ? label : "";
    }

    public boolean isAccessPoint() {
        return placeId != null;
    }

    public Node withPlace(long newPlaceId, String newLabel) {
        return new Node(id, coordinate, newPlaceId, newLabel);
    }
}
