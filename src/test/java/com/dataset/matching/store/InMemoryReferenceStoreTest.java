package com.dataset.matching.store;

import com.dataset.matching.ReferenceFixtures;
import com.dataset.matching.core.model.Dataset;
import com.dataset.matching.core.model.ReferenceEntity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryReferenceStoreTest {

    private static final Set<String> ACTIVE = Set.of("ds-entity-list", "ds-sanctions");

    private InMemoryReferenceStore store;

    @BeforeEach
    void setUp() {
        store = ReferenceFixtures.loadStore();
    }

    @Test
    @DisplayName("Only active datasets are listed")
    void activeDatasets() {
        List<Dataset> active = store.findActiveDatasets();

        assertEquals(List.of("ds-entity-list", "ds-sanctions"), active.stream().map(Dataset::id).toList());
        assertEquals(5, active.get(0).entryCount());
    }

    @Nested
    @DisplayName("Lookups")
    class LookupTests {

        @Test
        void nameLookupRespectsDatasetFilter() {
            Set<String> names = Set.of("national university of defense technology");

            assertEquals(1, store.findByOrganizationNames(names, ACTIVE).size());
            assertEquals(2, store.findByOrganizationNames(names,
                    Set.of("ds-entity-list", "ds-archived")).size());
        }

        @Test
        void aliasLookupIsCaseInsensitiveOnStoredSide() {
            List<Map<String, Object>> rows = store.findByAliases(Set.of("nudt"), ACTIVE);

            assertEquals(1, rows.size());
            assertEquals(ReferenceFixtures.NUDT, rows.get(0).get(ReferenceColumns.ORGANIZATION_NAME));
            assertEquals("ds-entity-list", rows.get(0).get(ReferenceColumns.DATASET_ID));
        }

        @Test
        void malformedAliasesAreNotIndexed() {
            assertTrue(store.findByAliases(Set.of("mrb"), ACTIVE).isEmpty());
            assertEquals(1, store.findByOrganizationNames(Set.of("malformed research bureau"), ACTIVE).size());
        }

        @Test
        void candidateWindowOrdersByOverlapAndHonoursLimit() {
            List<Map<String, Object>> window = store.findCandidateWindow(
                    Set.of("tok:harbin", "tok:technology", "pfx:har"), ACTIVE, 2);

            assertEquals(2, window.size());
            assertEquals("Harbin Institute of Technology", window.get(0).get(ReferenceColumns.ORGANIZATION_NAME));
        }

        @Test
        void lookupsAreCounted() {
            long before = store.getLookupCount();
            store.findByAliases(Set.of("hit"), ACTIVE);
            store.findActiveDatasets();
            assertEquals(before + 2, store.getLookupCount());
        }
    }

    @Test
    void deactivatingDatasetHidesIt() {
        store.setDatasetActive("ds-sanctions", false);

        assertEquals(List.of("ds-entity-list"), store.findActiveDatasets().stream().map(Dataset::id).toList());
        assertThrows(IllegalArgumentException.class, () -> store.setDatasetActive("unknown", true));
    }

    @Test
    void addEntitiesIndexesAliases() {
        InMemoryReferenceStore fresh = new InMemoryReferenceStore();
        fresh.addEntities(new Dataset("ds-x", "Extra", true, 0), List.of(
                new ReferenceEntity("Acme Holdings", List.of("ACME"), "manufacturer", Set.of("US"), "ignored")));

        List<Map<String, Object>> rows = fresh.findByAliases(Set.of("acme"), Set.of("ds-x"));
        assertEquals(1, rows.size());
        assertEquals("ds-x", rows.get(0).get(ReferenceColumns.DATASET_ID));
        assertEquals(List.of("US"), rows.get(0).get(ReferenceColumns.COUNTRIES));
    }
}
