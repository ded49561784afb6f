package com.dataset.matching.api;

import com.dataset.matching.ReferenceFixtures;
import com.dataset.matching.cache.CacheConfig;
import com.dataset.matching.cache.LruMatchCache;
import com.dataset.matching.cache.MatchCache;
import com.dataset.matching.cache.NoOpMatchCache;
import com.dataset.matching.core.model.Dataset;
import com.dataset.matching.core.model.DatasetMatch;
import com.dataset.matching.core.model.MatchType;
import com.dataset.matching.core.model.ReferenceEntity;
import com.dataset.matching.core.model.RelationshipSource;
import com.dataset.matching.geo.CountryNormalizer;
import com.dataset.matching.geo.GeographicConfig;
import com.dataset.matching.metrics.NoOpMetricsService;
import com.dataset.matching.quality.QualityAssessor;
import com.dataset.matching.retrieval.CandidateRetriever;
import com.dataset.matching.rules.NameNormalizer;
import com.dataset.matching.similarity.MatchTypeClassifier;
import com.dataset.matching.similarity.SimilarityScorer;
import com.dataset.matching.store.InMemoryReferenceStore;
import com.dataset.matching.store.ReferenceStore;
import com.dataset.matching.tracing.NoOpTracingService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

@DisplayName("DatasetMatchingService Tests")
class DatasetMatchingServiceTest {

    private ExecutorService executor;
    private InMemoryReferenceStore store;
    private CandidateRetriever retriever;
    private DatasetMatchingService service;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(2);
        store = ReferenceFixtures.loadStore();
        retriever = spy(new CandidateRetriever(store, executor));
        service = newService(retriever, new LruMatchCache(CacheConfig.defaults()));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static DatasetMatchingService newService(CandidateRetriever retriever, MatchCache cache) {
        NameNormalizer normalizer = new NameNormalizer();
        return new DatasetMatchingService(normalizer, retriever,
                new MatchTypeClassifier(new SimilarityScorer(normalizer)), new QualityAssessor(normalizer),
                cache, new NoOpMetricsService(), new NoOpTracingService());
    }

    private static DatasetMatchingService newService(CandidateRetriever retriever, MatchCache cache,
                                                     QualityAssessor assessor, GeographicConfig geographicConfig) {
        NameNormalizer normalizer = new NameNormalizer();
        return new DatasetMatchingService(normalizer, retriever,
                new MatchTypeClassifier(new SimilarityScorer(normalizer)), assessor,
                cache, new NoOpMetricsService(), new NoOpTracingService(),
                CountryNormalizer.loadDefault(), geographicConfig);
    }

    /**
     * The same organization name listed in two datasets under different countries.
     */
    private static InMemoryReferenceStore twoCountryStore() {
        InMemoryReferenceStore twoCountries = new InMemoryReferenceStore();
        twoCountries.addEntities(new Dataset("ds-alpha", "Alpha List", true, 1), List.of(
                new ReferenceEntity("Orion Precision Instruments", List.of(), "manufacturer",
                        Set.of("DE"), "ds-alpha")));
        twoCountries.addEntities(new Dataset("ds-beta", "Beta List", true, 1), List.of(
                new ReferenceEntity("Orion Precision Instruments", List.of(), "manufacturer",
                        Set.of("CN"), "ds-beta")));
        return twoCountries;
    }

    private static MatchQuery located(String entity, String location) {
        return new MatchQuery(entity, List.of(), new MatchContext(location, null), MatchOptions.defaults());
    }

    @Nested
    @DisplayName("Scenarios")
    class ScenarioTests {

        @Test
        @DisplayName("Bare acronym matches through its alias")
        void acronymOnly() {
            MatchOutcome outcome = service.match(MatchQuery.of("NUDT"));

            assertEquals(1, outcome.matches().size());
            DatasetMatch match = outcome.matches().get(0);
            assertEquals(ReferenceFixtures.NUDT, match.getOrganizationName());
            assertEquals(MatchType.ALIAS, match.getMatchType());
            assertEquals(0.95, match.getConfidenceScore(), 1e-9);
            assertEquals("Entity List", match.getDatasetName());
            assertEquals(RelationshipSource.DIRECT, match.getRelationshipSource());
        }

        @Test
        @DisplayName("Name with bracketed acronym is an exact match reported once")
        void parentheticalAcronym() {
            MatchOutcome outcome = service.match(MatchQuery.of("National University of Defense Technology (NUDT)"));

            assertEquals(1, outcome.matches().size());
            DatasetMatch match = outcome.matches().get(0);
            assertEquals(MatchType.EXACT, match.getMatchType());
            assertEquals(1.0, match.getConfidenceScore());
            assertEquals(1.0, match.getCoverage());
            assertEquals("National University of Defense Technology", match.getMatchedVariant());
        }

        @Test
        @DisplayName("Known variant spelling matches through its alias")
        void variantSpelling() {
            MatchOutcome outcome = service.match(MatchQuery.of("Beijing Computing Science Research Centre"));

            DatasetMatch match = outcome.matches().get(0);
            assertEquals(ReferenceFixtures.BEIJING_CSRC, match.getOrganizationName());
            assertEquals(MatchType.ALIAS, match.getMatchType());
            assertEquals(0.95, match.getConfidenceScore(), 1e-9);
            assertEquals(0.85, match.getCoverage(), 1e-9);
        }

        @Test
        @DisplayName("Malformed rows are skipped and reported")
        void malformedRow() {
            MatchOutcome outcome = service.match(MatchQuery.of(ReferenceFixtures.MALFORMED));

            assertTrue(outcome.matches().isEmpty());
            assertTrue(outcome.diagnostics().contains("1 malformed reference rows skipped"));
            assertFalse(outcome.degraded());
        }

        @Test
        @DisplayName("Generic queries return no matches without a store call")
        void genericQuerySkipped() {
            long before = store.getLookupCount();

            MatchOutcome outcome = service.match(MatchQuery.of("Inc"));

            assertTrue(outcome.matches().isEmpty());
            assertEquals(0, outcome.storeQueries());
            assertEquals(before, store.getLookupCount());
        }
    }

    @Nested
    @DisplayName("Caching")
    class CachingTests {

        @Test
        @DisplayName("Repeated query is served from the cache with identical matches")
        void repeatedQueryHitsCache() {
            MatchOutcome first = service.match(MatchQuery.of("NUDT"));
            MatchOutcome second = service.match(MatchQuery.of("NUDT"));

            assertFalse(first.cacheHit());
            assertTrue(second.cacheHit());
            assertEquals(first.matches(), second.matches());
            assertEquals(0, second.storeQueries());
            verify(retriever, times(1)).retrieve(anyList(), any(AtomicInteger.class));
        }

        @Test
        @DisplayName("forceRefresh bypasses the cache but refreshes it")
        void forceRefresh() {
            service.match(MatchQuery.of("NUDT"));
            MatchOutcome refreshed = service.match(MatchQuery.of("NUDT",
                    MatchOptions.builder().forceRefresh(true).build()));
            MatchOutcome cached = service.match(MatchQuery.of("NUDT"));

            assertFalse(refreshed.cacheHit());
            assertTrue(cached.cacheHit());
            verify(retriever, times(2)).retrieve(anyList(), any(AtomicInteger.class));
        }

        @Test
        @DisplayName("Different options are cached separately")
        void optionsPartOfKey() {
            service.match(MatchQuery.of("NUDT"));
            MatchOutcome other = service.match(MatchQuery.of("NUDT", MatchOptions.builder().maxResults(5).build()));

            assertFalse(other.cacheHit());
        }

        @Test
        @DisplayName("Identical queries yield identical results without a cache")
        void deterministic() {
            DatasetMatchingService uncached = newService(retriever, new NoOpMatchCache());

            List<DatasetMatch> first = uncached.match(MatchQuery.of("Harbin Technological Works")).matches();
            List<DatasetMatch> second = uncached.match(MatchQuery.of("Harbin Technological Works")).matches();

            assertEquals(first, second);
        }
    }

    @Nested
    @DisplayName("Failures")
    class FailureTests {

        @Test
        @DisplayName("Store outage degrades to an empty result that is not cached")
        void storeOutage() {
            ReferenceStore broken = mock(ReferenceStore.class);
            when(broken.getName()).thenReturn("broken");
            when(broken.findActiveDatasets()).thenThrow(new IllegalStateException("connection refused"));
            CandidateRetriever failing = spy(new CandidateRetriever(broken, executor));
            DatasetMatchingService degradedService = newService(failing, new LruMatchCache(CacheConfig.defaults()));

            MatchOutcome first = degradedService.match(MatchQuery.of("NUDT"));
            MatchOutcome second = degradedService.match(MatchQuery.of("NUDT"));

            assertTrue(first.degraded());
            assertTrue(first.matches().isEmpty());
            assertTrue(first.diagnostics().get(0).startsWith("store unavailable"));
            assertFalse(second.cacheHit());
            verify(failing, times(2)).retrieve(anyList(), any(AtomicInteger.class));
        }

        @Test
        @DisplayName("Structurally invalid queries are rejected")
        void invalidQuery() {
            assertThrows(InputValidationException.class, () -> service.match(MatchQuery.of("  ")));
            assertThrows(InputValidationException.class, () -> service.match(null));
            assertThrows(InputValidationException.class, () -> service.match(MatchQuery.of("x".repeat(301))));
            verifyNoInteractions(retriever);
        }
    }

    @Nested
    @DisplayName("Geography")
    class GeographyTests {

        private DatasetMatchingService geoService;

        @BeforeEach
        void setUp() {
            CandidateRetriever geoRetriever = new CandidateRetriever(twoCountryStore(), executor);
            geoService = newService(geoRetriever, new LruMatchCache(CacheConfig.defaults()),
                    new QualityAssessor(new NameNormalizer()), GeographicConfig.defaults());
        }

        @Test
        @DisplayName("Without a location, equal scores rank by dataset name")
        void noLocation() {
            List<DatasetMatch> matches = geoService.match(MatchQuery.of("Orion Precision Instruments")).matches();

            assertEquals(List.of("Alpha List", "Beta List"), matches.stream().map(DatasetMatch::getDatasetName).toList());
            assertNull(matches.get(0).getGeographicBoost());
            assertEquals(1.0, matches.get(0).getConfidenceScore());
        }

        @Test
        @DisplayName("Same-country candidate outranks the foreign one")
        void sameCountryOutranksForeign() {
            List<DatasetMatch> matches = geoService.match(located("Orion Precision Instruments", "China")).matches();

            assertEquals(2, matches.size());
            DatasetMatch local = matches.get(0);
            DatasetMatch foreign = matches.get(1);
            assertEquals("Beta List", local.getDatasetName());
            assertEquals(1.0, local.getConfidenceScore());
            assertEquals(1.2, local.getGeographicBoost(), 1e-9);
            assertEquals("Alpha List", foreign.getDatasetName());
            assertEquals(0.9, foreign.getConfidenceScore(), 1e-9);
            assertEquals(0.9, foreign.getGeographicBoost(), 1e-9);
        }

        @Test
        @DisplayName("A neighbouring country gets the regional factor")
        void sameRegion() {
            List<DatasetMatch> matches = geoService.match(located("Orion Precision Instruments", "Hong Kong")).matches();

            assertEquals("Beta List", matches.get(0).getDatasetName());
            assertEquals(1.1, matches.get(0).getGeographicBoost(), 1e-9);
        }

        @Test
        @DisplayName("Penalized candidates can fall below the confidence floor")
        void foreignFilteredByFloor() {
            MatchQuery query = new MatchQuery("Orion Precision Instruments", List.of(),
                    new MatchContext("CN", null), MatchOptions.builder().minConfidence(0.95).build());

            List<DatasetMatch> matches = geoService.match(query).matches();

            assertEquals(1, matches.size());
            assertEquals("ds-beta", matches.get(0).getDatasetId());
        }

        @Test
        @DisplayName("Unrecognized location leaves confidence untouched")
        void unknownLocation() {
            List<DatasetMatch> matches = geoService.match(located("Orion Precision Instruments", "Atlantis")).matches();

            assertEquals(List.of(1.0, 1.0), matches.stream().map(DatasetMatch::getConfidenceScore).toList());
            assertNull(matches.get(0).getGeographicBoost());
        }

        @Test
        @DisplayName("Spellings of the same country share a cache entry, other countries do not")
        void locationInCacheKey() {
            MatchOutcome byName = geoService.match(located("Orion Precision Instruments", "China"));
            MatchOutcome byCode = geoService.match(located("Orion Precision Instruments", "CN"));
            MatchOutcome elsewhere = geoService.match(located("Orion Precision Instruments", "Germany"));
            MatchOutcome noLocation = geoService.match(MatchQuery.of("Orion Precision Instruments"));

            assertFalse(byName.cacheHit());
            assertTrue(byCode.cacheHit());
            assertFalse(elsewhere.cacheHit());
            assertFalse(noLocation.cacheHit());
            assertEquals("Alpha List", elsewhere.matches().get(0).getDatasetName());
        }

        @Test
        @DisplayName("Disabled geography ignores the location")
        void disabled() {
            DatasetMatchingService plain = newService(new CandidateRetriever(twoCountryStore(), executor),
                    new NoOpMatchCache(), new QualityAssessor(new NameNormalizer()), GeographicConfig.disabled());

            List<DatasetMatch> matches = plain.match(located("Orion Precision Instruments", "China")).matches();

            assertEquals("Alpha List", matches.get(0).getDatasetName());
            assertNull(matches.get(0).getGeographicBoost());
        }
    }

    @Nested
    @DisplayName("Quality metrics")
    class QualityMetricsTests {

        @Test
        @DisplayName("Metrics are computed for returned matches only")
        void onlyForRankedMatches() {
            QualityAssessor assessor = spy(new QualityAssessor(new NameNormalizer()));
            DatasetMatchingService metered = newService(new CandidateRetriever(twoCountryStore(), executor),
                    new NoOpMatchCache(), assessor, GeographicConfig.defaults());

            List<DatasetMatch> matches = metered.match(MatchQuery.of("Orion Precision Instruments",
                    MatchOptions.builder().maxResults(1).build())).matches();

            assertEquals(1, matches.size());
            assertNotNull(matches.get(0).getQualityMetrics());
            verify(assessor, times(1)).metrics(any(), any(), anyDouble());
        }
    }
}
