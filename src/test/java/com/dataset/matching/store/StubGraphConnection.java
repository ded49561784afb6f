package com.dataset.matching.store;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Records statements and answers every read with {@link #queryResults}.
 */
class StubGraphConnection implements GraphConnection {
    final List<String> executedQueries = new ArrayList<>();
    final List<String> readQueries = new ArrayList<>();
    final List<Map<String, Object>> readParams = new ArrayList<>();
    List<Map<String, Object>> queryResults = List.of();
    boolean indexesCreated;

    @Override
    public void execute(String query, Map<String, Object> params) {
        executedQueries.add(query);
    }

    @Override
    public List<Map<String, Object>> query(String query, Map<String, Object> params) {
        readQueries.add(query);
        readParams.add(params);
        return queryResults;
    }

    @Override
    public boolean isConnected() {
        return true;
    }

    @Override
    public String getGraphName() {
        return "stub";
    }

    @Override
    public void createIndexes() {
        indexesCreated = true;
    }

    @Override
    public void close() {
    }
}
