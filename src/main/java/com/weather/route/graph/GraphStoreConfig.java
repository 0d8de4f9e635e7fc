package com.weather.route.graph;

/**
 * FalkorDB connection settings.
 */
public class GraphStoreConfig {

    private static final String DEFAULT_HOST = "localhost";
    private static final int DEFAULT_PORT = 6379;
    private static final String DEFAULT_GRAPH_NAME = "weather-route";

    private final String host;
    private final int port;
    private final String graphName;

    private GraphStoreConfig(Builder builder) {
        this.host = builder.host;
        this.port = builder.port;
        this.graphName = builder.graphName;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public String getGraphName() {
        return graphName;
    }

    public static GraphStoreConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String host = DEFAULT_HOST;
        private int port = DEFAULT_PORT;
        private String graphName = DEFAULT_GRAPH_NAME;

        public Builder host(String host) {
            if (host == null || host.isBlank()) {
                throw new IllegalArgumentException("host must not be blank");
            }
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            if (port <= 0 || port > 65535) {
                throw new IllegalArgumentException("port must be within [1, 65535]");
            }
            this.port = port;
            return this;
        }

        public Builder graphName(String graphName) {
            InputSanitizer.validateIdentifier(graphName, "graphName");
            this.graphName = graphName;
            return this;
        }

        public GraphStoreConfig build() {
            return new GraphStoreConfig(this);
        }
    }
}
