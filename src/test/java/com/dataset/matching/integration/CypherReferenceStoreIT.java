package com.dataset.matching.integration;

import com.dataset.matching.core.model.Dataset;
import com.dataset.matching.core.model.ReferenceEntity;
import com.dataset.matching.store.CypherReferenceStore;
import com.dataset.matching.store.FalkorDBConnection;
import org.junit.jupiter.api.*;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the reference store's Cypher lookups against a live FalkorDB instance.
 */
@Tag("integration")
class CypherReferenceStoreIT extends AbstractFalkorDBIntegrationTest {

    private FalkorDBConnection connection;
    private CypherReferenceStore store;

    @BeforeEach
    void setUp() {
        connection = createConnection("reference-store");
        store = new CypherReferenceStore(connection);
        store.initializeSchema();

        seed(connection, new Dataset("ds-entity-list", "Entity List", true, 0), List.of(
                new ReferenceEntity("National University of Defense Technology", List.of("NUDT"),
                        "university", Set.of("CN"), "ds-entity-list"),
                new ReferenceEntity("Harbin Institute of Technology", List.of("HIT"),
                        "university", Set.of("CN"), "ds-entity-list")));
        seed(connection, new Dataset("ds-archived", "Archived", false, 0), List.of(
                new ReferenceEntity("National University of Defense Technology", List.of("NUDT"),
                        "university", Set.of("CN"), "ds-archived")));
    }

    @AfterEach
    void tearDown() {
        if (connection != null) {
            connection.close();
        }
    }

    @Test
    @DisplayName("Only active datasets are listed")
    void activeDatasets() {
        List<Dataset> active = store.findActiveDatasets();

        assertEquals(1, active.size());
        assertEquals("ds-entity-list", active.get(0).id());
        assertEquals(2, active.get(0).entryCount());
    }

    @Test
    @DisplayName("Exact lookup is case-insensitive and restricted to the given datasets")
    void exactLookup() {
        List<Map<String, Object>> rows = store.findByOrganizationNames(
                Set.of("national university of defense technology"), Set.of("ds-entity-list"));

        assertEquals(1, rows.size());
        assertEquals("ds-entity-list", rows.get(0).get("dataset_id"));
        assertEquals("National University of Defense Technology", rows.get(0).get("organization_name"));
    }

    @Test
    @DisplayName("Alias lookup follows ALIAS_OF edges")
    void aliasLookup() {
        List<Map<String, Object>> rows = store.findByAliases(Set.of("hit"), Set.of("ds-entity-list"));

        assertEquals(1, rows.size());
        assertEquals("Harbin Institute of Technology", rows.get(0).get("organization_name"));
    }

    @Test
    @DisplayName("Candidate window honours the limit")
    void candidateWindowLimit() {
        List<Map<String, Object>> rows = store.findCandidateWindow(
                Set.of("tok:technology", "tok:defense", "tok:harbin", "pfx:nat", "pfx:har"),
                Set.of("ds-entity-list"), 1);

        assertTrue(rows.size() <= 1);
    }

    @Test
    @DisplayName("Connection reports itself connected")
    void connected() {
        assertTrue(connection.isConnected());
        assertEquals("falkordb:" + connection.getGraphName(), store.getName());
    }
}
