package com.story.knowledge.graph;

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
 * FalkorDB connection using the JFalkorDB client.
 */
public class FalkorDBConnection implements GraphConnection {
    private static final Logger log = LoggerFactory.getLogger(FalkorDBConnection.class);

    private static final List<String> INDEXES = List.of(
            "CREATE INDEX FOR (n:StoryElement) ON (n.id)",
            "CREATE INDEX FOR (n:StoryElement) ON (n.type)",
            "CREATE INDEX FOR (k:EntityKey) ON (k.naturalKey)",
            "CREATE INDEX FOR (c:ChangeEvent) ON (c.entityId)",
            "CREATE INDEX FOR (c:ChangeEvent) ON (c.transactionId)",
            "CREATE INDEX FOR (c:ChangeEvent) ON (c.status)"
    );

    private static final Pattern PLACEHOLDER = Pattern.compile("\\$([A-Za-z_][A-Za-z0-9_]*)");

    private final Driver driver;
    private final Graph graph;
    private final String graphName;

    public FalkorDBConnection(String host, int port, String graphName) {
        this.driver = FalkorDB.driver(host, port);
        this.graphName = graphName;
        this.graph = driver.graph(graphName);
        log.debug("FalkorDB connection opened to {}:{} graph {}", host, port, graphName);
    }

    @Override
    public void execute(String query, Map<String, Object> params) {
        String processedQuery = processParams(query, params);
        log.trace("Executing: {}", processedQuery);
        graph.query(processedQuery);
    }

    @Override
    public List<Map<String, Object>> query(String query, Map<String, Object> params) {
        String processedQuery = processParams(query, params);
        log.trace("Querying: {}", processedQuery);

        ResultSet resultSet = graph.query(processedQuery);
        List<Map<String, Object>> results = new ArrayList<>();
        for (Record record : resultSet) {
            Map<String, Object> row = new HashMap<>();
            for (String key : record.keys()) {
                row.put(key, record.getValue(key));
            }
            results.add(row);
        }
        return results;
    }

    @Override
    public boolean isConnected() {
        try {
            graph.query("RETURN 1");
            return true;
        } catch (Exception e) {
            log.warn("FalkorDB connectivity check failed for graph {}: {}", graphName, e.getMessage());
            return false;
        }
    }

    @Override
    public String getGraphName() {
        return graphName;
    }

    @Override
    public void ensureIndexes() {
        for (String statement : INDEXES) {
            try {
                graph.query(statement);
            } catch (Exception e) {
                // FalkorDB rejects re-creating an existing index
                log.debug("Index statement '{}' skipped: {}", statement, e.getMessage());
            }
        }
        log.info("Indexes ensured on graph {}", graphName);
    }

    /**
     * Inlines {@code $param} placeholders in a single left-to-right pass. Inlined
     * values are never scanned again, so text such as {@code "$id"} inside a value
     * stays as written. Placeholders without a parameter are left untouched.
     */
    static String processParams(String query, Map<String, Object> params) {
        Matcher matcher = PLACEHOLDER.matcher(query);
        StringBuilder result = new StringBuilder(query.length());
        while (matcher.find()) {
            String name = matcher.group(1);
            String replacement = params.containsKey(name)
                    ? formatValue(params.get(name))
                    : matcher.group();
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
        return "'" + value.toString()
                .replace("\\", "\\\\")
                .replace("'", "\\'")
                .replace("\n", "\\n")
                .replace("\r", "\\r") + "'";
    }

    @Override
    public void close() {
        try {
            driver.close();
        } catch (Exception e) {
            log.warn("Error closing FalkorDB connection to graph {}", graphName, e);
        }
    }
}
