package com.weather.route.graph;

import com.falkordb.Driver;
import com.falkordb.FalkorDB;
import com.falkordb.Graph;
import com.falkordb.Record;
import com.falkordb.ResultSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * FalkorDB implementation using the JFalkorDB client. The driver pools its own
 * sockets, so one instance is shared by every store component.
 */
public class FalkorDBConnection implements GraphConnection {
    private static final Logger log = LoggerFactory.getLogger(FalkorDBConnection.class);

    private static final Pattern PLACEHOLDER = Pattern.compile("\\$([A-Za-z_][A-Za-z0-9_]*)");

    private final Driver driver;
    private final Graph graph;
    private final String graphName;

    public FalkorDBConnection(GraphStoreConfig config) {
        this(config.getHost(), config.getPort(), config.getGraphName());
    }

    public FalkorDBConnection(String host, int port, String graphName) {
        this.driver = FalkorDB.driver(host, port);
        this.graphName = graphName;
        this.graph = driver.graph(graphName);
        log.info("FalkorDB connection initialized: {}:{} graph={}", host, port, graphName);
    }

    @Override
    public void execute(String query, Map<String, Object> params) {
        String processedQuery = processParams(query, params);
        log.debug("Executing: {}", processedQuery);
        graph.query(processedQuery);
    }

    @Override
    public List<Map<String, Object>> query(String query, Map<String, Object> params) {
        String processedQuery = processParams(query, params);
        log.debug("Querying: {}", processedQuery);

        ResultSet resultSet = graph.query(processedQuery);
        List<Map<String, Object>> rows = new ArrayList<>();
        for (Record record : resultSet) {
            Map<String, Object> row = new HashMap<>();
            for (String key : record.keys()) {
                row.put(key, record.getValue(key));
            }
            rows.add(row);
        }
        log.debug("Query returned {} rows", rows.size());
        return rows;
    }

    @Override
    public boolean isConnected() {
        try {
            graph.query("RETURN 1");
            return true;
        } catch (Exception e) {
            log.warn("Connection check failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public String getGraphName() {
        return graphName;
    }

    /**
     * Inlines {@code $param} placeholders in one pass over the query text, so inlined values are
     * never scanned again. Placeholders without a parameter are left as they are.
     */
    static String processParams(String query, Map<String, Object> params) {
        if (params.isEmpty()) {
            return query;
        }
        Matcher matcher = PLACEHOLDER.matcher(query);
        StringBuilder result = new StringBuilder(query.length());
        while (matcher.find()) {
            String name = matcher.group(1);
            String replacement = params.containsKey(name) ? formatValue(params.get(name)) : matcher.group();
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    static String formatValue(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        if (value instanceof List<?> list) {
            List<String> items = new ArrayList<>(list.size());
            for (Object item : list) {
                items.add(formatValue(item));
            }
            return "[" + String.join(", ", items) + "]";
        }
        return "'" + value.toString().replace("\\", "\\\\").replace("'", "\\'") + "'";
    }

    @Override
    public void close() {
        try {
            driver.close();
        } catch (Exception e) {
            log.warn("Error closing FalkorDB connection", e);
        }
        log.info("FalkorDB connection closed");
    }
}
