package com.weather.route.graph;

import java.util.List;
import java.util.Map;

/**
 * Connection to the graph database that backs the durable layer, the road graph and the
 * distributed leader lock.
 */
public interface GraphConnection extends AutoCloseable {

    /**
     * Executes a Cypher statement that modifies the graph.
     *
     * @param query  the Cypher query, parameters written as {@code $name}
     * @param params query parameters
     */
    void execute(String query, Map<String, Object> params);

    default void execute(String query) {
        execute(query, Map.of());
    }

    /**
     * Executes a Cypher query and returns its rows keyed by column alias.
     */
    List<Map<String, Object>> query(String query, Map<String, Object> params);

    default List<Map<String, Object>> query(String query) {
        return query(query, Map.of());
    }

    boolean isConnected();

    String getGraphName();

    @Override
    void close();
}
