package com.dataset.matching.health;

import com.dataset.matching.ReferenceFixtures;
import com.dataset.matching.cache.CacheStats;
import com.dataset.matching.cache.MatchCache;
import com.dataset.matching.store.InMemoryReferenceStore;
import com.dataset.matching.store.ReferenceStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("Health Check Tests")
class HealthCheckTest {

    @Nested
    @DisplayName("ReferenceStoreHealthCheck")
    class ReferenceStoreTests {

        @Test
        void upWithActiveDatasets() {
            HealthStatus status = new ReferenceStoreHealthCheck(ReferenceFixtures.loadStore()).check();

            assertEquals(HealthStatus.State.UP, status.state());
            assertEquals(2, status.details().get("activeDatasets"));
            assertEquals("in-memory", status.details().get("store"));
        }

        @Test
        void degradedWithoutActiveDatasets() {
            InMemoryReferenceStore store = ReferenceFixtures.loadStore();
            store.setDatasetActive("ds-entity-list", false);
            store.setDatasetActive("ds-sanctions", false);

            assertEquals(HealthStatus.State.DEGRADED, new ReferenceStoreHealthCheck(store).check().state());
        }

        @Test
        void downWhenStoreFails() {
            ReferenceStore store = mock(ReferenceStore.class);
            when(store.getName()).thenReturn("falkordb:reference");
            when(store.findActiveDatasets()).thenThrow(new IllegalStateException("connection refused"));

            HealthStatus status = new ReferenceStoreHealthCheck(store).check();

            assertEquals(HealthStatus.State.DOWN, status.state());
            assertTrue(status.message().contains("connection refused"));
        }
    }

    @Test
    @DisplayName("MatchCacheHealthCheck reports counters")
    void cacheCheck() {
        MatchCache cache = mock(MatchCache.class);
        when(cache.getStats()).thenReturn(new CacheStats(3, 1, 0, 2));

        HealthStatus status = new MatchCacheHealthCheck(cache).check();

        assertTrue(status.isUp());
        assertEquals(0.75, (double) status.details().get("hitRate"), 1e-9);
    }

    @Nested
    @DisplayName("HealthCheckRegistry")
    class RegistryTests {

        private static HealthCheck check(String name, HealthStatus status) {
            return new HealthCheck() {
                @Override
                public String getName() {
                    return name;
                }

                @Override
                public HealthStatus check() {
                    return status;
                }
            };
        }

        @Test
        void allUp() {
            HealthCheckRegistry registry = new HealthCheckRegistry();
            registry.register(check("a", HealthStatus.up("fine")));
            registry.register(check("b", HealthStatus.up("fine")));

            HealthStatus status = registry.checkAll();

            assertTrue(status.isUp());
            assertEquals(2, registry.size());
            assertEquals("UP", ((Map<?, ?>) status.details().get("a")).get("state"));
        }

        @Test
        @DisplayName("Worst state wins")
        void worstWins() {
            HealthCheckRegistry registry = new HealthCheckRegistry();
            registry.register(check("a", HealthStatus.degraded("slow")));
            registry.register(check("b", HealthStatus.down("gone")));
            registry.register(check("c", HealthStatus.up("fine")));

            HealthStatus status = registry.checkAll();

            assertEquals(HealthStatus.State.DOWN, status.state());
            assertEquals("b: gone", status.message());
        }

        @Test
        @DisplayName("A throwing check counts as DOWN")
        void throwingCheck() {
            HealthCheckRegistry registry = new HealthCheckRegistry();
            registry.register(new HealthCheck() {
                @Override
                public String getName() {
                    return "broken";
                }

                @Override
                public HealthStatus check() {
                    throw new IllegalStateException("boom");
                }
            });

            assertEquals(HealthStatus.State.DOWN, registry.checkAll().state());
        }
    }
}
