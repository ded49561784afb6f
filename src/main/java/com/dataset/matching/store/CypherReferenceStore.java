package com.dataset.matching.store;

import com.dataset.matching.core.model.Dataset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * {@link ReferenceStore} over a graph database.
 *
 * <p>Graph layout:</p>
 * <pre>
 * (:Dataset {id, name, isActive, entryCount})
 * (:ReferenceEntity {organizationName, nameLower, category, countries, aliases, datasetId})
 * (:Alias {value, valueLower})-[:ALIAS_OF]->(:ReferenceEntity)
 * (:ReferenceEntity)-[:HAS_BLOCKING_KEY]->(:BlockingKey {value})
 * </pre>
 * Name, alias and blocking-key lookups are {@code IN} predicates over indexed properties.
 */
public class CypherReferenceStore implements ReferenceStore {
    private static final Logger log = LoggerFactory.getLogger(CypherReferenceStore.class);

    private static final String ENTITY_COLUMNS = """
            e.datasetId AS dataset_id, e.organizationName AS organization_name, e.aliases AS aliases,
            e.category AS category, e.countries AS countries""";

    private final GraphConnection connection;

    public CypherReferenceStore(GraphConnection connection) {
        this.connection = connection;
    }

    /**
     * Ensures the indexes backing the lookups exist.
     */
    public void initializeSchema() {
        connection.createIndexes();
    }

    @Override
    public List<Dataset> findActiveDatasets() {
        String query = """
                MATCH (d:Dataset)
                WHERE d.isActive = true
                RETURN d.id AS id, d.name AS name, d.entryCount AS entryCount
                ORDER BY d.id
                """;
        List<Dataset> datasets = new ArrayList<>();
        for (Map<String, Object> row : connection.query(query)) {
            Object id = row.get("id");
            if (id == null) {
                log.warn("Skipping dataset row without id: {}", row);
                continue;
            }
            Object name = row.get("name");
            long entryCount = row.get("entryCount") instanceof Number n ? n.longValue() : 0L;
            datasets.add(new Dataset(id.toString(), name != null ? name.toString() : null, true, entryCount));
        }
        return datasets;
    }

    @Override
    public List<Map<String, Object>> findByOrganizationNames(Set<String> lowerNames, Set<String> datasetIds) {
        if (lowerNames.isEmpty() || datasetIds.isEmpty()) {
            return List.of();
        }
        String query = """
                MATCH (e:ReferenceEntity)
                WHERE e.nameLower IN $names
                  AND e.datasetId IN $datasetIds
                RETURN %s
                ORDER BY e.datasetId, e.organizationName
                """.formatted(ENTITY_COLUMNS);
        return connection.query(query, Map.of(
                "names", sorted(lowerNames),
                "datasetIds", sorted(datasetIds)
        ));
    }

    @Override
    public List<Map<String, Object>> findByAliases(Set<String> lowerAliases, Set<String> datasetIds) {
        if (lowerAliases.isEmpty() || datasetIds.isEmpty()) {
            return List.of();
        }
        String query = """
                MATCH (a:Alias)-[:ALIAS_OF]->(e:ReferenceEntity)
                WHERE a.valueLower IN $aliases
                  AND e.datasetId IN $datasetIds
                WITH DISTINCT e
                RETURN %s
                ORDER BY e.datasetId, e.organizationName
                """.formatted(ENTITY_COLUMNS);
        return connection.query(query, Map.of(
                "aliases", sorted(lowerAliases),
                "datasetIds", sorted(datasetIds)
        ));
    }

    @Override
    public List<Map<String, Object>> findCandidateWindow(Set<String> blockingKeys, Set<String> datasetIds, int limit) {
        if (blockingKeys.isEmpty() || datasetIds.isEmpty()) {
            return List.of();
        }
        String query = """
                MATCH (e:ReferenceEntity)-[:HAS_BLOCKING_KEY]->(k:BlockingKey)
                WHERE k.value IN $keys
                  AND e.datasetId IN $datasetIds
                WITH e, count(k) AS shared
                RETURN %s
                ORDER BY shared DESC, e.datasetId, e.organizationName
                LIMIT $limit
                """.formatted(ENTITY_COLUMNS);
        return connection.query(query, Map.of(
                "keys", sorted(blockingKeys),
                "datasetIds", sorted(datasetIds),
                "limit", limit
        ));
    }

    @Override
    public String getName() {
        return "falkordb:" + connection.getGraphName();
    }

    private static List<String> sorted(Set<String> values) {
        return List.copyOf(new TreeSet<>(values));
    }
}
