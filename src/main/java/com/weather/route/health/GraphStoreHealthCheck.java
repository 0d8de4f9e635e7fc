package com.weather.route.health;

import com.weather.route.graph.GraphConnection;

/**
 * Round-trips a trivial query to FalkorDB and reports its latency.
 */
public class GraphStoreHealthCheck implements HealthCheck {

    private final GraphConnection connection;

    public GraphStoreHealthCheck(GraphConnection connection) {
        this.connection = connection;
    }

    @Override
    public String getName() {
        return "graphStore";
    }

    @Override
    public HealthStatus check() {
        if (!connection.isConnected()) {
            return HealthStatus.down("Graph store connection closed")
                    .withDetail("graphName", connection.getGraphName());
        }
        long started = System.nanoTime();
        try {
            connection.query("RETURN 1");
        } catch (RuntimeException e) {
            return HealthStatus.down("Graph store query failed: " + e.getMessage())
                    .withDetail("graphName", connection.getGraphName())
                    .withDetail("error", e.getClass().getSimpleName());
        }
        return HealthStatus.up()
                .withDetail("graphName", connection.getGraphName())
                .withDetail("latencyMs", (System.nanoTime() - started) / 1_000_000);
    }
}
