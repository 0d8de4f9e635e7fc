package com.weather.route.spatial;

import com.weather.route.core.model.Coordinate;
import com.weather.route.core.model.Node;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.*;

class NearestNodeLocatorTest {

    private NearestNodeLocator locator;

    @BeforeEach
    void setUp() {
        locator = new NearestNodeLocator(7);
        locator.add(1L, Coordinate.of(35.7000, 51.4000));
        locator.add(2L, Coordinate.of(35.7010, 51.4000));   // ~111 m north
        locator.add(3L, Coordinate.of(35.7100, 51.4000));   // ~1.1 km north
    }

    @Test
    @DisplayName("Should find the closest node within the radius")
    void shouldFindClosest() {
        OptionalLong nearest = locator.nearest(Coordinate.of(35.7008, 51.4000), 500);
        assertEquals(2L, nearest.getAsLong());
    }

    @Test
    @DisplayName("Should return empty when nothing is within the radius")
    void shouldReturnEmptyOutsideRadius() {
        assertTrue(locator.nearest(Coordinate.of(35.8000, 51.4000), 1000).isEmpty());
    }

    @Test
    @DisplayName("Should list nodes within the radius closest first")
    void shouldListWithinRadius() {
        List<Long> within = locator.within(Coordinate.of(35.7000, 51.4000), 2000);
        assertEquals(List.of(1L, 2L, 3L), within);
    }

    @Test
    @DisplayName("Should fall back to a full scan for very large radii")
    void shouldScanForLargeRadius() {
        OptionalLong nearest = locator.nearest(Coordinate.of(36.5, 52.0), 200_000);
        assertEquals(3L, nearest.getAsLong());
    }

    @Test
    @DisplayName("Should break distance ties by lower node id")
    void shouldBreakTiesByNodeId() {
        NearestNodeLocator tied = new NearestNodeLocator(7);
        tied.add(9L, Coordinate.of(10.001, 20.0));
        tied.add(4L, Coordinate.of(10.001, 20.0));

        assertEquals(4L, tied.nearest(Coordinate.of(10.0, 20.0), 1000).getAsLong());
    }

    @Test
    @DisplayName("Should move, remove and rebuild nodes")
    void shouldMaintainIndex() {
        locator.add(1L, Coordinate.of(40.0, 40.0));
        assertNotEquals(1L, locator.nearest(Coordinate.of(35.7000, 51.4000), 50).orElse(-1));

        locator.remove(2L);
        assertEquals(2, locator.size());

        locator.rebuild(List.of(new Node(7L, Coordinate.of(1.0, 1.0), null, "")));
        assertEquals(1, locator.size());
        assertEquals(7L, locator.nearest(Coordinate.of(1.0, 1.0), 10).getAsLong());
    }
}
