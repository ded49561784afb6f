package com.dataset.matching.store;

import java.util.List;
import java.util.Map;

/**
 * Connection to a Cypher-speaking graph database holding the reference datasets.
 */
public interface GraphConnection extends AutoCloseable {

    /**
     * Executes a write or schema statement.
     */
    void execute(String query, Map<String, Object> params);

    default void execute(String query) {
        execute(query, Map.of());
    }

    /**
     * Executes a read query.
     *
     * @return one map per result record, keyed by the returned column aliases
     */
    List<Map<String, Object>> query(String query, Map<String, Object> params);

    default List<Map<String, Object>> query(String query) {
        return query(query, Map.of());
    }

    boolean isConnected();

    String getGraphName();

    /**
     * Creates the indexes the reference lookups rely on, if missing.
     */
    void createIndexes();

    @Override
    void close();
}
