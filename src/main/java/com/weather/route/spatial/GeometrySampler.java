package com.weather.route.spatial;

import com.weather.route.core.model.Coordinate;

import java.util.ArrayList;
import java.util.List;

/**
 * Thins a polyline to vertices roughly {@code intervalKm} apart.
 * The first and last vertex are always kept.
 */
public final class GeometrySampler {

    /**
     * A kept vertex with the distance travelled from the start of the polyline.
     *
     * @param coordinate        vertex position
     * @param index             index in the original polyline
     * @param cumulativeMeters  distance along the polyline up to this vertex
     */
    public record Sample(Coordinate coordinate, int index, double cumulativeMeters) {
    }

    private GeometrySampler() {
        // utility class
    }

    public static List<Sample> sample(List<Coordinate> polyline, double intervalKm) {
        if (intervalKm <= 0) {
            throw new IllegalArgumentException("intervalKm must be > 0");
        }
        List<Sample> samples = new ArrayList<>();
        if (polyline == null || polyline.isEmpty()) {
            return samples;
        }

        double intervalMeters = intervalKm * 1000.0;
        double cumulative = 0.0;
        double sinceLast = 0.0;
        samples.add(new Sample(polyline.get(0), 0, 0.0));

        for (int i = 1; i < polyline.size(); i++) {
            double step = GeoDistance.haversineMeters(polyline.get(i - 1), polyline.get(i));
            cumulative += step;
            sinceLast += step;
            boolean last = i == polyline.size() - 1;
            if (sinceLast >= intervalMeters || last) {
                samples.add(new Sample(polyline.get(i), i, cumulative));
                sinceLast = 0.0;
            }
        }
        return samples;
    }
}
