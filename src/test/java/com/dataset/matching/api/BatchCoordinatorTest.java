package com.dataset.matching.api;

import com.dataset.matching.ReferenceFixtures;
import com.dataset.matching.cache.NoOpMatchCache;
import com.dataset.matching.metrics.NoOpMetricsService;
import com.dataset.matching.quality.QualityAssessor;
import com.dataset.matching.retrieval.CandidateRetriever;
import com.dataset.matching.rules.NameNormalizer;
import com.dataset.matching.similarity.MatchTypeClassifier;
import com.dataset.matching.similarity.SimilarityScorer;
import com.dataset.matching.tracing.NoOpTracingService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class BatchCoordinatorTest {

    private final List<AutoCloseable> resources = new ArrayList<>();
    private ExecutorService storeExecutor;

    @AfterEach
    void tearDown() throws Exception {
        for (AutoCloseable resource : resources) {
            resource.close();
        }
        if (storeExecutor != null) {
            storeExecutor.shutdownNow();
        }
    }

    private BatchCoordinator coordinator(MatchPipeline pipeline) {
        BatchCoordinator coordinator = new BatchCoordinator(pipeline);
        resources.add(coordinator);
        return coordinator;
    }

    private MatchPipeline referencePipeline() {
        storeExecutor = Executors.newFixedThreadPool(4);
        NameNormalizer normalizer = new NameNormalizer();
        return new DatasetMatchingService(normalizer,
                new CandidateRetriever(ReferenceFixtures.loadStore(), storeExecutor),
                new MatchTypeClassifier(new SimilarityScorer(normalizer)), new QualityAssessor(normalizer),
                new NoOpMatchCache(), new NoOpMetricsService(), new NoOpTracingService());
    }

    private static MatchOutcome empty() {
        return new MatchOutcome(List.of(), false, false, List.of(), 1, 0);
    }

    @Test
    @DisplayName("An invalid item fails alone and the rest succeed")
    void partialFailure() {
        BatchResult result = coordinator(referencePipeline()).process(List.of(
                MatchQuery.of("NUDT"),
                MatchQuery.of(""),
                MatchQuery.of("Harbin Institute of Technology")));

        assertEquals(3, result.results().size());
        assertEquals(3, result.stats().totalProcessed());
        assertEquals(2, result.stats().successCount());
        assertEquals(1, result.stats().failureCount());

        BatchItemResult failed = result.results().get(1);
        assertEquals(BatchItemResult.Status.FAILED, failed.status());
        assertEquals(InputValidationException.CODE, failed.errorCode());
        assertTrue(result.results().get(0).isSuccess());
        assertEquals(1, result.results().get(0).matches().size());
        assertEquals("Harbin Institute of Technology",
                result.results().get(2).matches().get(0).getOrganizationName());
    }

    @Test
    @DisplayName("Results keep input order whatever the completion order")
    void preservesOrder() {
        MatchPipeline pipeline = query -> {
            try {
                Thread.sleep(query.entity().length() * 5L);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return empty();
        };
        List<MatchQuery> queries = new ArrayList<>();
        for (int i = 10; i > 0; i--) {
            queries.add(MatchQuery.of("q".repeat(i)));
        }

        BatchResult result = coordinator(pipeline).process(queries);

        for (int i = 0; i < queries.size(); i++) {
            assertEquals(i, result.results().get(i).index());
            assertEquals(queries.get(i).entity(), result.results().get(i).entity());
        }
        assertEquals(10, result.stats().storeQueries());
    }

    @Test
    @DisplayName("Unexpected exceptions are recorded as internal errors")
    void unexpectedException() {
        MatchPipeline pipeline = query -> {
            if (query.entity().equals("boom")) {
                throw new IllegalStateException("exploded");
            }
            return empty();
        };

        BatchResult result = coordinator(pipeline).process(List.of(MatchQuery.of("ok"), MatchQuery.of("boom")));

        BatchItemResult failed = result.results().get(1);
        assertEquals(BatchCoordinator.INTERNAL_ERROR, failed.errorCode());
        assertEquals("exploded", failed.errorMessage());
        assertTrue(result.results().get(0).isSuccess());
    }

    @Test
    @DisplayName("Items not started before cancellation are reported cancelled")
    void cancelled() {
        CancellationToken token = new CancellationToken();
        token.cancel();

        BatchResult result = coordinator(query -> empty())
                .process(List.of(MatchQuery.of("a"), MatchQuery.of("b")), token);

        assertTrue(result.cancelled());
        assertEquals(2, result.stats().cancelledCount());
        assertEquals(0, result.stats().totalProcessed());
        assertTrue(result.results().stream().allMatch(r -> r.status() == BatchItemResult.Status.CANCELLED));
    }

    @Test
    @DisplayName("Cancelling mid-batch lets running items finish and counts their store queries")
    void cancelledMidBatch() throws Exception {
        CountDownLatch started = new CountDownLatch(2);
        CountDownLatch release = new CountDownLatch(1);
        MatchPipeline gated = query -> {
            started.countDown();
            try {
                if (!release.await(5, TimeUnit.SECONDS)) {
                    throw new IllegalStateException("never released");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return new MatchOutcome(List.of(), false, false, List.of(), 3, 0);
        };
        BatchCoordinator coordinator = new BatchCoordinator(gated, 2, BatchCoordinator.DEFAULT_MAX_BATCH_SIZE,
                new NoOpMetricsService(), new NoOpTracingService());
        resources.add(coordinator);
        List<MatchQuery> queries = List.of(MatchQuery.of("a"), MatchQuery.of("b"), MatchQuery.of("c"),
                MatchQuery.of("d"), MatchQuery.of("e"), MatchQuery.of("f"));
        CancellationToken token = new CancellationToken();

        CompletableFuture<BatchResult> pending = CompletableFuture.supplyAsync(() -> coordinator.process(queries, token));
        assertTrue(started.await(5, TimeUnit.SECONDS));
        token.cancel();
        release.countDown();
        BatchResult result = pending.get(5, TimeUnit.SECONDS);

        assertTrue(result.cancelled());
        assertEquals(BatchItemResult.Status.SUCCESS, result.results().get(0).status());
        assertEquals(BatchItemResult.Status.SUCCESS, result.results().get(1).status());
        assertTrue(result.results().subList(2, 6).stream()
                .allMatch(r -> r.status() == BatchItemResult.Status.CANCELLED));
        assertEquals(2, result.stats().totalProcessed());
        assertEquals(4, result.stats().cancelledCount());
        assertEquals(6, result.stats().storeQueries());
    }

    @Test
    @DisplayName("Cache hits and misses are aggregated")
    void cacheStats() {
        MatchPipeline pipeline = query -> new MatchOutcome(List.of(), query.entity().startsWith("hit"),
                false, List.of(), 0, 0);

        BatchResult result = coordinator(pipeline).process(List.of(
                MatchQuery.of("hit-1"), MatchQuery.of("miss-1"), MatchQuery.of("hit-2")));

        assertEquals(2, result.stats().cacheHits());
        assertEquals(1, result.stats().cacheMisses());
    }

    @Test
    void rejectsEmptyOrOversizedBatch() {
        BatchCoordinator coordinator = coordinator(query -> empty());

        assertThrows(InputValidationException.class, () -> coordinator.process(List.of()));
        assertThrows(InputValidationException.class, () -> coordinator.process(null));
        assertThrows(InputValidationException.class, () -> coordinator.process(
                Collections.nCopies(BatchCoordinator.DEFAULT_MAX_BATCH_SIZE + 1, MatchQuery.of("x"))));
    }
}
