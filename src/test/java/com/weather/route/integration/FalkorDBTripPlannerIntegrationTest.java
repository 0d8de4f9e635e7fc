package com.weather.route.integration;

import com.weather.route.api.EngineConfig;
import com.weather.route.api.TripPlanner;
import com.weather.route.core.model.Coordinate;
import com.weather.route.core.model.Place;
import com.weather.route.core.model.PlaceType;
import com.weather.route.core.model.RouteRecord;
import com.weather.route.core.model.WeatherPayload;
import com.weather.route.fakes.FakeRoutingProvider;
import com.weather.route.fakes.FakeWeatherProvider;
import com.weather.route.graph.FalkorDBConnection;
import com.weather.route.graph.GraphConnection;
import com.weather.route.health.HealthStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end runs against a FalkorDB container. Each test gets its own graph.
 */
@Tag("integration")
@Testcontainers
class FalkorDBTripPlannerIntegrationTest {

    private static final int FALKORDB_PORT = 6379;
    private static final Coordinate TEHRAN = Coordinate.of(35.6892, 51.3890);
    private static final Coordinate MASHHAD = Coordinate.of(36.2605, 59.6168);

    @SuppressWarnings("resource")
    @Container
    static final GenericContainer<?> falkorDB = new GenericContainer<>("falkordb/falkordb:latest")
            .withExposedPorts(FALKORDB_PORT);

    private String graphName;
    private FakeWeatherProvider weatherProvider;
    private FakeRoutingProvider routingProvider;

    @BeforeEach
    void setUp() {
        graphName = "route-it-" + UUID.randomUUID().toString().substring(0, 8);
        weatherProvider = new FakeWeatherProvider();
        routingProvider = new FakeRoutingProvider(40);
    }

    private GraphConnection connect() {
        return new FalkorDBConnection(falkorDB.getHost(), falkorDB.getMappedPort(FALKORDB_PORT), graphName);
    }

    private TripPlanner planner(GraphConnection connection) {
        return TripPlanner.builder()
                .config(EngineConfig.builder().followerPollInterval(Duration.ofMillis(50)).build())
                .graphConnection(connection)
                .weatherProvider(weatherProvider)
                .routingProvider(routingProvider)
                .build();
    }

    @Test
    @DisplayName("Should persist routes and the road graph across planner restarts")
    void routesSurviveRestart() {
        RouteRecord first;
        long tehranId;
        long mashhadId;
        try (GraphConnection connection = connect(); TripPlanner planner = planner(connection)) {
            Place tehran = planner.upsertPlace("Tehran", PlaceType.CITY, "Tehran", TEHRAN);
            Place mashhad = planner.upsertPlace("Mashhad", PlaceType.CITY, "Razavi Khorasan", MASHHAD);
            tehranId = tehran.getId();
            mashhadId = mashhad.getId();
            first = planner.getRoute(tehran, mashhad);
            assertTrue(planner.stats().edges() > 0);
        }

        try (GraphConnection connection = connect(); TripPlanner planner = planner(connection)) {
            RouteRecord cached = planner.getRoute(tehranId, mashhadId);
            assertEquals(first.nodes(), cached.nodes());
            assertEquals(1, routingProvider.calls());

            planner.invalidate("route:" + tehranId + ":" + mashhadId);
            RouteRecord recomputed = planner.getRoute(tehranId, mashhadId);
            assertEquals(first.nodes(), recomputed.nodes());
            assertEquals(1, routingProvider.calls());
        }
    }

    @Test
    @DisplayName("Should persist forecasts in the durable layer")
    void forecastsArePersisted() {
        Instant nextHour = Instant.now().plus(1, ChronoUnit.HOURS);
        try (GraphConnection connection = connect(); TripPlanner planner = planner(connection)) {
            planner.weather(TEHRAN, nextHour);
            WeatherPayload payload = planner.weather(TEHRAN, nextHour);
            assertEquals(35.69, payload.temperature());
            assertEquals(1, weatherProvider.calls());
        }
        try (GraphConnection connection = connect(); TripPlanner planner = planner(connection)) {
            assertEquals(1, planner.stats().durableLayer().size());
            assertEquals(0, planner.purgeExpired());
        }
    }

    @Test
    @DisplayName("Should report the graph store as healthy")
    void healthIncludesGraphStore() {
        try (GraphConnection connection = connect(); TripPlanner planner = planner(connection)) {
            HealthStatus health = planner.health();
            assertTrue(health.isUp(), health.message());
            assertTrue(health.details().containsKey("graphStore"));
        }
    }
}
