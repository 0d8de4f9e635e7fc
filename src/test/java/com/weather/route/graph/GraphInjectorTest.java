package com.weather.route.graph;

import com.weather.route.core.model.Coordinate;
import com.weather.route.core.model.Edge;
import com.weather.route.core.model.Place;
import com.weather.route.core.model.PlaceType;
import com.weather.route.fakes.FakeRoutingProvider;
import com.weather.route.provider.RoutingResult;
import com.weather.route.spatial.NearestNodeLocator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GraphInjectorTest {

    private static final Coordinate TEHRAN = Coordinate.of(35.6892, 51.3890);
    private static final Coordinate MASHHAD = Coordinate.of(36.2605, 59.6168);

    private InMemoryRoadGraphStore store;
    private GraphInjector injector;
    private Place tehran;
    private Place mashhad;

    @BeforeEach
    void setUp() {
        store = new InMemoryRoadGraphStore(new NearestNodeLocator(7), 50.0);
        injector = new GraphInjector(store, 1.0, 50.0);
        tehran = store.upsertPlace("Tehran", PlaceType.CITY, "Tehran", TEHRAN);
        mashhad = store.upsertPlace("Mashhad", PlaceType.CITY, "Razavi Khorasan", MASHHAD);
    }

    private RoutingResult straightRoute(int points) {
        return new FakeRoutingProvider(points).route(TEHRAN, MASHHAD);
    }

    @Test
    @DisplayName("Should turn every sampled vertex into a node joined by directed edges")
    void shouldInjectRoute() {
        GraphInjector.InjectionResult result = injector.inject(tehran.getId(), mashhad.getId(), straightRoute(120));

        assertEquals(120, result.nodePath().size());
        assertEquals(119, result.edges());
        assertEquals(120, store.nodeCount());
        assertEquals(119, store.edgeCount());

        long first = result.nodePath().get(0);
        long last = result.nodePath().get(119);
        assertEquals(List.of(first), store.accessNodes(tehran.getId()));
        assertEquals(List.of(last), store.accessNodes(mashhad.getId()));
        assertTrue(store.getEdge(first, result.nodePath().get(1)).isPresent());
        assertTrue(store.getEdge(result.nodePath().get(1), first).isEmpty());
    }

    @Test
    @DisplayName("Should use the provider's average speed when no road classes are given")
    void shouldUseAverageSpeed() {
        GraphInjector.InjectionResult result = injector.inject(tehran.getId(), mashhad.getId(), straightRoute(10));

        Edge edge = store.getEdge(result.nodePath().get(0), result.nodePath().get(1)).orElseThrow();
        assertEquals(FakeRoutingProvider.SPEED_KMH, edge.speedKmh(), 1e-6);
        assertEquals(2, edge.geometry().size());
    }

    @Test
    @DisplayName("Should take edge speed from the road class of the segment")
    void shouldUseRoadClassSpeed() {
        List<Coordinate> geometry = FakeRoutingProvider.straightLine(TEHRAN, MASHHAD, 4);
        RoutingResult route = new RoutingResult(geometry, 740, 8,
                List.of(RoadClass.MOTORWAY, RoadClass.MOTORWAY, RoadClass.PRIMARY, RoadClass.PRIMARY));

        GraphInjector.InjectionResult result = injector.inject(tehran.getId(), mashhad.getId(), route);

        List<Long> nodes = result.nodePath();
        assertEquals(100, store.getEdge(nodes.get(0), nodes.get(1)).orElseThrow().speedKmh());
        assertEquals(80, store.getEdge(nodes.get(2), nodes.get(3)).orElseThrow().speedKmh());
    }

    @Test
    @DisplayName("Should reuse nodes and edges when the same route is injected twice")
    void shouldBeIdempotent() {
        GraphInjector.InjectionResult first = injector.inject(tehran.getId(), mashhad.getId(), straightRoute(50));
        GraphInjector.InjectionResult second = injector.inject(tehran.getId(), mashhad.getId(), straightRoute(50));

        assertEquals(first.nodePath(), second.nodePath());
        assertEquals(50, store.nodeCount());
        assertEquals(49, store.edgeCount());
    }

    @Test
    @DisplayName("Should collapse consecutive vertices that snap onto one node")
    void shouldCollapseSnappedVertices() {
        GraphInjector fine = new GraphInjector(store, 0.001, 50.0);
        Coordinate nearTehran = Coordinate.of(35.6893, 51.3891);
        RoutingResult route = new RoutingResult(List.of(TEHRAN, nearTehran, MASHHAD), 740, 8);

        GraphInjector.InjectionResult result = fine.inject(tehran.getId(), mashhad.getId(), route);

        assertEquals(2, result.nodePath().size());
        assertEquals(1, result.edges());
    }

    @Test
    @DisplayName("Should reject a route with fewer than two points")
    void shouldRejectShortRoute() {
        RoutingResult route = new RoutingResult(List.of(TEHRAN), 0, 0);

        assertThrows(IllegalArgumentException.class, () -> injector.inject(tehran.getId(), mashhad.getId(), route));
        assertEquals(0, store.nodeCount());
    }
}
