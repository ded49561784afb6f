package com.dataset.matching.store;

import com.falkordb.Driver;
import com.falkordb.FalkorDB;
import com.falkordb.Graph;
import com.falkordb.Record;
import com.falkordb.ResultSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * {@link GraphConnection} backed by the JFalkorDB client.
 *
 * <p>Parameters are inlined into the query text as Cypher literals. Strings are escaped and
 * collections become list literals so that {@code IN $param} predicates work.</p>
 */
public class FalkorDBConnection implements GraphConnection {
    private static final Logger log = LoggerFactory.getLogger(FalkorDBConnection.class);

    static final int MAX_LITERAL_LENGTH = 4000;

    private final Driver driver;
    private final Graph graph;
    private final String graphName;

    public FalkorDBConnection(String host, int port, String graphName) {
        this.driver = FalkorDB.driver(host, port);
        this.graphName = graphName;
        this.graph = driver.graph(graphName);
        log.info("FalkorDB connection initialized: host={} port={} graph={}", host, port, graphName);
    }

    @Override
    public void execute(String query, Map<String, Object> params) {
        String statement = inline(query, params);
        log.debug("Executing: {}", statement);
        graph.query(statement);
    }

    @Override
    public List<Map<String, Object>> query(String query, Map<String, Object> params) {
        String statement = inline(query, params);
        log.debug("Querying: {}", statement);

        ResultSet resultSet = graph.query(statement);
        List<Map<String, Object>> rows = new ArrayList<>();
        for (Record record : resultSet) {
            Map<String, Object> row = new LinkedHashMap<>();
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
            log.warn("FalkorDB connection check failed for graph {}", graphName, e);
            return false;
        }
    }

    @Override
    public String getGraphName() {
        return graphName;
    }

    @Override
    public void createIndexes() {
        createIndex("CREATE INDEX FOR (d:Dataset) ON (d.id)");
        createIndex("CREATE INDEX FOR (d:Dataset) ON (d.isActive)");
        createIndex("CREATE INDEX FOR (e:ReferenceEntity) ON (e.nameLower)");
        createIndex("CREATE INDEX FOR (e:ReferenceEntity) ON (e.datasetId)");
        createIndex("CREATE INDEX FOR (a:Alias) ON (a.valueLower)");
        createIndex("CREATE INDEX FOR (k:BlockingKey) ON (k.value)");
        log.info("Reference indexes ensured for graph {}", graphName);
    }

    private void createIndex(String statement) {
        try {
            graph.query(statement);
        } catch (Exception e) {
            // FalkorDB rejects re-creating an existing index
            log.debug("Index statement skipped: {} - {}", statement, e.getMessage());
        }
    }

    /**
     * Replaces {@code $name} placeholders with literals, longest names first so that
     * {@code $names} is never clobbered by {@code $name}.
     */
    static String inline(String query, Map<String, Object> params) {
        List<String> names = new ArrayList<>(params.keySet());
        names.sort(Comparator.comparingInt(String::length).reversed());
        String result = query;
        for (String name : names) {
            result = result.replace("$" + name, literal(params.get(name)));
        }
        return result;
    }

    static String literal(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        if (value instanceof Collection<?> values) {
            return values.stream().map(FalkorDBConnection::literal).collect(Collectors.joining(", ", "[", "]"));
        }
        String text = value.toString();
        if (text.length() > MAX_LITERAL_LENGTH) {
            throw new IllegalArgumentException("Cypher literal exceeds " + MAX_LITERAL_LENGTH
                    + " characters (was " + text.length() + ")");
        }
        return "'" + text.replace("\\", "\\\\").replace("'", "\\'") + "'";
    }

    @Override
    public void close() {
        try {
            driver.close();
        } catch (Exception e) {
            log.warn("Error closing FalkorDB connection for graph {}", graphName, e);
        }
        log.info("FalkorDB connection closed: graph={}", graphName);
    }
}
