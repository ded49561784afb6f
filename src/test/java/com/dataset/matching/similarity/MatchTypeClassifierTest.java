package com.dataset.matching.similarity;

import com.dataset.matching.core.model.MatchType;
import com.dataset.matching.core.model.ReferenceEntity;
import com.dataset.matching.rules.NameNormalizer;
import com.dataset.matching.rules.SearchVariant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MatchTypeClassifier Tests")
class MatchTypeClassifierTest {

    private NameNormalizer normalizer;
    private MatchTypeClassifier classifier;

    @BeforeEach
    void setUp() {
        normalizer = new NameNormalizer();
        classifier = new MatchTypeClassifier(new SimilarityScorer(normalizer));
    }

    private SearchVariant variant(String text) {
        return normalizer.searchVariants(text, List.of()).get(0);
    }

    private PreparedCandidate candidate(String name, String... aliases) {
        return PreparedCandidate.of(new ReferenceEntity(name, List.of(aliases), "test", Set.of(), "ds-1"), normalizer);
    }

    private Classification classify(String query, PreparedCandidate candidate) {
        Optional<Classification> result = classifier.classify(variant(query), candidate);
        assertTrue(result.isPresent(), "expected a classification for '" + query + "'");
        return result.get();
    }

    @Nested
    @DisplayName("Precedence")
    class PrecedenceTests {

        @Test
        @DisplayName("Identical names are exact with full confidence and coverage")
        void exact() {
            Classification result = classify("Harbin Institute of Technology", candidate("Harbin Institute of Technology", "HIT"));

            assertEquals(MatchType.EXACT, result.matchType());
            assertEquals(1.0, result.confidence());
            assertEquals(1.0, result.coverage());
        }

        @Test
        @DisplayName("Exact match differing only in case has reduced coverage")
        void exactDifferentCase() {
            Classification result = classify("harbin institute of technology", candidate("Harbin Institute of Technology"));

            assertEquals(MatchType.EXACT, result.matchType());
            assertEquals(0.9, result.coverage());
        }

        @Test
        @DisplayName("Query equal to an alias is an alias match")
        void alias() {
            Classification result = classify("HIT", candidate("Harbin Institute of Technology", "HIT"));

            assertEquals(MatchType.ALIAS, result.matchType());
            assertEquals(0.95, result.confidence(), 1e-9);
            assertEquals(0.85, result.coverage(), 1e-9);
        }

        @Test
        @DisplayName("Query containing an alias is a partial alias match")
        void aliasPartial() {
            Classification result = classify("Tengden Technology",
                    candidate("Sichuan Tengden Technology Co., Ltd.", "Tengden"));

            assertEquals(MatchType.ALIAS_PARTIAL, result.matchType());
            assertEquals(0.8, result.confidence(), 1e-9);
        }

        @Test
        @DisplayName("Equal core forms are a core match")
        void coreMatch() {
            Classification result = classify("Acme Corporation", candidate("The Acme Corp"));

            assertEquals(MatchType.CORE_MATCH, result.matchType());
            assertEquals(0.85, result.confidence(), 1e-9);
        }

        @Test
        @DisplayName("Core forms of three characters or fewer never core-match")
        void shortCoreNotCoreMatch() {
            Optional<Classification> result = classifier.classify(variant("Abc Ltd"), candidate("Abc Limited"));

            assertTrue(result.isEmpty() || result.get().matchType() != MatchType.CORE_MATCH);
        }

        @Test
        @DisplayName("A misspelling is a fuzzy match below 0.8 confidence")
        void fuzzy() {
            Classification result = classify("Rosoboronexprot", candidate("Rosoboronexport"));

            assertEquals(MatchType.FUZZY, result.matchType());
            assertTrue(result.confidence() > 0.6 && result.confidence() < 0.8,
                    "fuzzy confidence was " + result.confidence());
        }

        @Test
        @DisplayName("A contained fragment is a partial match")
        void partial() {
            Classification result = classify("Polytechnical", candidate("Northwestern Polytechnical University"));

            assertEquals(MatchType.PARTIAL, result.matchType());
            assertEquals(0.6 * 13.0 / 37.0, result.confidence(), 1e-9);
        }

        @Test
        @DisplayName("Unrelated names are dropped")
        void unrelated() {
            assertTrue(classifier.classify(variant("Zzyzx"), candidate("Harbin Institute of Technology")).isEmpty());
        }
    }

    @Nested
    @DisplayName("Best classification across variants")
    class BestTests {

        @Test
        @DisplayName("Base name exact match beats acronym alias match")
        void bestVariantWins() {
            List<SearchVariant> variants = normalizer.searchVariants(
                    "National University of Defense Technology (NUDT)", List.of());
            PreparedCandidate nudt = candidate("National University of Defense Technology", "NUDT");

            Classification best = classifier.classifyBest(variants, nudt).orElseThrow();

            assertEquals(MatchType.EXACT, best.matchType());
            assertEquals(SearchVariant.Kind.BASE_NAME, best.variant().kind());
        }

        @Test
        void noVariantsNoClassification() {
            assertTrue(classifier.classifyBest(List.of(), candidate("Acme")).isEmpty());
        }
    }
}
