package com.weather.route.spatial;

import com.weather.route.core.model.BoundingBox;
import com.weather.route.core.model.Coordinate;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Geohash implementation of {@link SpatialCellIndex}.
 *
 * <p>Approximate cell sizes at the equator: precision 5 is 4.9 km x 4.9 km (weather cells),
 * precision 6 is 1.2 km x 0.6 km, precision 7 is 153 m x 153 m (node grid).</p>
 */
public class GeohashCellIndex implements SpatialCellIndex {

    public static final int MIN_PRECISION = 1;
    public static final int MAX_PRECISION = 12;

    private static final String BASE32 = "0123456789bcdefghjkmnpqrstuvwxyz";

    private final int precision;

    public GeohashCellIndex(int precision) {
        validatePrecision(precision);
        this.precision = precision;
    }

    @Override
    public int resolution() {
        return precision;
    }

    @Override
    public String encode(double lat, double lon, int resolution) {
        validatePrecision(resolution);
        // Validates ranges
        new Coordinate(lat, lon);

        double minLat = -90.0, maxLat = 90.0;
        double minLon = -180.0, maxLon = 180.0;
        StringBuilder hash = new StringBuilder(resolution);
        boolean evenBit = true;
        int bit = 0;
        int ch = 0;

        while (hash.length() < resolution) {
            if (evenBit) {
                double mid = (minLon + maxLon) / 2;
                if (lon >= mid) {
                    ch = (ch << 1) | 1;
                    minLon = mid;
                } else {
                    ch = ch << 1;
                    maxLon = mid;
                }
            } else {
                double mid = (minLat + maxLat) / 2;
                if (lat >= mid) {
                    ch = (ch << 1) | 1;
                    minLat = mid;
                } else {
                    ch = ch << 1;
                    maxLat = mid;
                }
            }
            evenBit = !evenBit;
            if (++bit == 5) {
                hash.append(BASE32.charAt(ch));
                bit = 0;
                ch = 0;
            }
        }
        return hash.toString();
    }

    @Override
    public BoundingBox bounds(String cellId) {
        validateCellId(cellId);
        double minLat = -90.0, maxLat = 90.0;
        double minLon = -180.0, maxLon = 180.0;
        boolean evenBit = true;

        for (int i = 0; i < cellId.length(); i++) {
            int value = BASE32.indexOf(cellId.charAt(i));
            for (int mask = 16; mask > 0; mask >>= 1) {
                boolean set = (value & mask) != 0;
                if (evenBit) {
                    double mid = (minLon + maxLon) / 2;
                    if (set) {
                        minLon = mid;
                    } else {
                        maxLon = mid;
                    }
                } else {
                    double mid = (minLat + maxLat) / 2;
                    if (set) {
                        minLat = mid;
                    } else {
                        maxLat = mid;
                    }
                }
                evenBit = !evenBit;
            }
        }
        return new BoundingBox(minLat, minLon, maxLat, maxLon);
    }

    @Override
    public Set<String> ring(String cellId, int k) {
        if (k < 0) {
            throw new IllegalArgumentException("k must be >= 0");
        }
        BoundingBox box = bounds(cellId);
        Set<String> cells = new LinkedHashSet<>();
        if (k == 0) {
            cells.add(cellId);
            return cells;
        }
        Coordinate center = box.center();
        for (int dy = -k; dy <= k; dy++) {
            for (int dx = -k; dx <= k; dx++) {
                if (Math.max(Math.abs(dx), Math.abs(dy)) != k) {
                    continue;
                }
                double lat = center.lat() + dy * box.latSpan();
                if (lat <= -90.0 || lat >= 90.0) {
                    continue;
                }
                double lon = wrapLongitude(center.lon() + dx * box.lonSpan());
                String cell = encode(lat, lon, cellId.length());
                if (!cell.equals(cellId)) {
                    cells.add(cell);
                }
            }
        }
        return cells;
    }

    @Override
    public Set<String> neighbors(String cellId, int k) {
        if (k < 0) {
            throw new IllegalArgumentException("k must be >= 0");
        }
        Set<String> cells = new LinkedHashSet<>();
        for (int ring = 1; ring <= k; ring++) {
            cells.addAll(ring(cellId, ring));
        }
        cells.remove(cellId);
        return cells;
    }

    /**
     * Approximate cell height and width in meters at the given latitude.
     */
    public double[] cellSizeMeters(double lat) {
        BoundingBox box = bounds(encode(lat, 0.0));
        double height = box.latSpan() * GeoDistance.METERS_PER_DEGREE_LAT;
        double width = box.lonSpan() * GeoDistance.METERS_PER_DEGREE_LAT * Math.cos(Math.toRadians(lat));
        return new double[]{height, width};
    }

    static double wrapLongitude(double lon) {
        double wrapped = ((lon + 180.0) % 360.0 + 360.0) % 360.0 - 180.0;
        return wrapped == 180.0 ? -180.0 : wrapped;
    }

    private static void validatePrecision(int precision) {
        if (precision < MIN_PRECISION || precision > MAX_PRECISION) {
            throw new IllegalArgumentException("Geohash precision must be within ["
                    + MIN_PRECISION + ", " + MAX_PRECISION + "], got: " + precision);
        }
    }

    private static void validateCellId(String cellId) {
        if (cellId == null || cellId.isEmpty() || cellId.length() > MAX_PRECISION) {
            throw new IllegalArgumentException("Invalid geohash: '" + cellId + "'");
        }
        for (int i = 0; i < cellId.length(); i++) {
            if (BASE32.indexOf(cellId.charAt(i)) < 0) {
                throw new IllegalArgumentException("Invalid geohash character '" + cellId.charAt(i)
                        + "' in '" + cellId + "'");
            }
        }
    }
}
