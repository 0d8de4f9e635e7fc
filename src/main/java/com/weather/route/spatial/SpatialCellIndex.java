package com.weather.route.spatial;

import com.weather.route.core.model.BoundingBox;
import com.weather.route.core.model.Coordinate;

import java.util.Set;

/**
 * Maps coordinates to fixed-resolution cell identifiers.
 * Cache keys depend on both the scheme and the resolution, so a deployment uses exactly one of each.
 */
public interface SpatialCellIndex {

    /**
     * Resolution this index was configured with.
     */
    int resolution();

    /**
     * Encodes a coordinate at an explicit resolution. Pure and deterministic.
     *
     * @throws IllegalArgumentException if the coordinate or resolution is out of range
     */
    String encode(double lat, double lon, int resolution);

    /**
     * Encodes a coordinate at the configured resolution.
     */
    default String encode(double lat, double lon) {
        return encode(lat, lon, resolution());
    }

    default String encode(Coordinate coordinate) {
        return encode(coordinate.lat(), coordinate.lon(), resolution());
    }

    /**
     * Cells at exactly Chebyshev distance {@code k} from {@code cellId}, same resolution.
     * {@code ring(cellId, 0)} is the cell itself.
     */
    Set<String> ring(String cellId, int k);

    /**
     * The k-ring around {@code cellId}: all cells at distance 1..k, excluding the cell itself.
     */
    Set<String> neighbors(String cellId, int k);

    /**
     * Rectangle covered by the cell.
     *
     * @throws IllegalArgumentException if the identifier is malformed
     */
    BoundingBox bounds(String cellId);

    default Coordinate center(String cellId) {
        return bounds(cellId).center();
    }
}
