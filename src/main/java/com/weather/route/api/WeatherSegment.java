package com.weather.route.api;

import com.weather.route.core.model.Coordinate;
import com.weather.route.core.model.WeatherPayload;

import java.time.Instant;

/**
 * Weather at one sampled point of a route.
 *
 * @param coordinate          sampled route position
 * @param cellId              weather cell of the position
 * @param estimatedArrival    when the traveller is expected to reach the position
 * @param distanceFromStartKm distance along the route
 * @param weather             forecast for the cell and arrival hour
 */
public record WeatherSegment(Coordinate coordinate, String cellId, Instant estimatedArrival,
                             double distanceFromStartKm, WeatherPayload weather) {
}
