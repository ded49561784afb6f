package com.dataset.matching.api;

import com.dataset.matching.core.DatasetMatchingException;
import com.dataset.matching.logging.LogContext;
import com.dataset.matching.metrics.MetricsService;
import com.dataset.matching.metrics.NoOpMetricsService;
import com.dataset.matching.tracing.NoOpTracingService;
import com.dataset.matching.tracing.Span;
import com.dataset.matching.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs independent queries through a {@link MatchPipeline} on a fixed-size worker pool.
 *
 * <p>Every item is isolated: a validation error, store failure or unexpected exception is
 * recorded on that item only. Results keep input order.</p>
 */
public class BatchCoordinator implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(BatchCoordinator.class);

    public static final int DEFAULT_MAX_BATCH_SIZE = 100;
    public static final int DEFAULT_PARALLELISM = 5;
    static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    private final MatchPipeline pipeline;
    private final int maxBatchSize;
    private final ExecutorService executor;
    private final MetricsService metricsService;
    private final TracingService tracingService;

    public BatchCoordinator(MatchPipeline pipeline) {
        this(pipeline, DEFAULT_PARALLELISM, DEFAULT_MAX_BATCH_SIZE, new NoOpMetricsService(), new NoOpTracingService());
    }

    public BatchCoordinator(MatchPipeline pipeline, int parallelism, int maxBatchSize,
                            MetricsService metricsService, TracingService tracingService) {
        if (parallelism <= 0) {
            throw new IllegalArgumentException("parallelism must be > 0");
        }
        if (maxBatchSize <= 0) {
            throw new IllegalArgumentException("maxBatchSize must be > 0");
        }
        this.pipeline = pipeline;
        this.maxBatchSize = maxBatchSize;
        this.executor = Executors.newFixedThreadPool(parallelism, namedThreads("dataset-batch"));
        this.metricsService = metricsService;
        this.tracingService = tracingService;
    }

    public BatchResult process(List<MatchQuery> queries) {
        return process(queries, CancellationToken.none());
    }

    /**
     * Processes the batch and waits for every started item to finish.
     *
     * @throws InputValidationException if the batch is null, empty or larger than the maximum size
     */
    public BatchResult process(List<MatchQuery> queries, CancellationToken token) {
        if (queries == null || queries.isEmpty()) {
            throw new InputValidationException("batch must contain at least one query");
        }
        if (queries.size() > maxBatchSize) {
            throw new InputValidationException("batch size " + queries.size() + " exceeds maximum of " + maxBatchSize);
        }
        CancellationToken signal = token != null ? token : CancellationToken.none();
        String batchId = UUID.randomUUID().toString();
        long start = System.nanoTime();

        try (LogContext ignored = LogContext.forBatch(batchId);
             Span span = tracingService.startSpan("match.batch", Map.of("batchId", batchId))) {
            log.info("batch.started batchId={} items={}", batchId, queries.size());
            metricsService.recordBatchSize(queries.size());

            List<CompletableFuture<BatchItemResult>> futures = new ArrayList<>(queries.size());
            for (int i = 0; i < queries.size(); i++) {
                int index = i;
                MatchQuery query = queries.get(i);
                futures.add(CompletableFuture.supplyAsync(() -> processItem(batchId, index, query, signal), executor));
            }
            List<BatchItemResult> results = futures.stream().map(CompletableFuture::join).toList();

            long totalMs = (System.nanoTime() - start) / 1_000_000;
            BatchStats stats = aggregate(results, totalMs);
            span.setAttribute("processed", stats.totalProcessed());
            span.setAttribute("failures", stats.failureCount());
            span.setStatus(Span.SpanStatus.OK);
            log.info("batch.completed batchId={} processed={} success={} failed={} cancelled={} cacheHits={} matches={} timeMs={}",
                    batchId, stats.totalProcessed(), stats.successCount(), stats.failureCount(),
                    stats.cancelledCount(), stats.cacheHits(), stats.totalMatches(), totalMs);
            return new BatchResult(batchId, results, stats, signal.isCancelled());
        }
    }

    private BatchItemResult processItem(String batchId, int index, MatchQuery query, CancellationToken token) {
        String entity = query != null ? query.entity() : null;
        if (token.isCancelled()) {
            return BatchItemResult.cancelled(index, entity);
        }
        long start = System.nanoTime();
        try (LogContext ignored = LogContext.forBatch(batchId).with("itemIndex", String.valueOf(index))) {
            MatchOutcome outcome = pipeline.match(query);
            return BatchItemResult.success(index, entity, outcome);
        } catch (DatasetMatchingException e) {
            log.warn("batch.item.failed index={} code={} message={}", index, e.getCode(), e.getMessage());
            return BatchItemResult.failure(index, entity, e.getCode(), e.getMessage(), elapsedMs(start));
        } catch (RuntimeException e) {
            log.error("batch.item.failed index={} unexpected error", index, e);
            return BatchItemResult.failure(index, entity, INTERNAL_ERROR, e.getMessage(), elapsedMs(start));
        }
    }

    private static BatchStats aggregate(List<BatchItemResult> results, long totalMs) {
        int success = 0;
        int failed = 0;
        int cancelled = 0;
        int cacheHits = 0;
        int cacheMisses = 0;
        int matches = 0;
        int storeQueries = 0;
        long itemTime = 0;
        for (BatchItemResult result : results) {
            switch (result.status()) {
                case SUCCESS -> {
                    success++;
                    if (result.cacheHit()) {
                        cacheHits++;
                    } else {
                        cacheMisses++;
                    }
                }
                case FAILED -> failed++;
                case CANCELLED -> cancelled++;
            }
            matches += result.matches().size();
            storeQueries += result.storeQueries();
            itemTime += result.processingTimeMs();
        }
        int processed = success + failed;
        double average = processed == 0 ? 0.0 : (double) itemTime / processed;
        return new BatchStats(results.size(), processed, success, failed, cancelled, cacheHits, cacheMisses,
                matches, storeQueries, average, totalMs);
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
