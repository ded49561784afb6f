package com.dataset.matching.retrieval;

import com.dataset.matching.core.model.Dataset;
import com.dataset.matching.core.model.ReferenceEntity;
import com.dataset.matching.metrics.MetricsService;
import com.dataset.matching.metrics.NoOpMetricsService;
import com.dataset.matching.rules.SearchVariant;
import com.dataset.matching.similarity.BlockingKeyStrategy;
import com.dataset.matching.similarity.DefaultBlockingKeyStrategy;
import com.dataset.matching.store.ReferenceStore;
import com.dataset.matching.store.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fetches the candidate set for a query from the {@link ReferenceStore}.
 *
 * <p>Exact-name and alias lookups run first. Only when both come back empty is a bounded
 * window fetched through blocking keys. Each store call runs on the store executor and
 * is abandoned after the configured timeout, surfacing as {@link StoreUnavailableException}.</p>
 */
public class CandidateRetriever {
    private static final Logger log = LoggerFactory.getLogger(CandidateRetriever.class);

    public static final int DEFAULT_WINDOW_SIZE = 50;
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(3);

    private static final int MIN_CORE_LOOKUP_LENGTH = 4;

    private final ReferenceStore store;
    private final BlockingKeyStrategy blockingKeyStrategy;
    private final ReferenceRecordMapper mapper;
    private final ExecutorService storeExecutor;
    private final Duration timeout;
    private final int windowSize;
    private final MetricsService metricsService;

    public CandidateRetriever(ReferenceStore store, ExecutorService storeExecutor) {
        this(store, new DefaultBlockingKeyStrategy(), storeExecutor, DEFAULT_TIMEOUT, DEFAULT_WINDOW_SIZE,
                new NoOpMetricsService());
    }

    public CandidateRetriever(ReferenceStore store,
                              BlockingKeyStrategy blockingKeyStrategy,
                              ExecutorService storeExecutor,
                              Duration timeout,
                              int windowSize,
                              MetricsService metricsService) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        if (windowSize <= 0) {
            throw new IllegalArgumentException("windowSize must be > 0");
        }
        this.store = store;
        this.blockingKeyStrategy = blockingKeyStrategy;
        this.mapper = new ReferenceRecordMapper();
        this.storeExecutor = storeExecutor;
        this.timeout = timeout;
        this.windowSize = windowSize;
        this.metricsService = metricsService;
    }

    /**
     * Retrieves candidates for the given variants.
     *
     * @param variants     query variants, in priority order
     * @param storeQueries incremented once per store call issued, including failed ones
     * @throws StoreUnavailableException if a store call fails or exceeds the timeout
     */
    public RetrievalResult retrieve(List<SearchVariant> variants, AtomicInteger storeQueries) {
        if (variants.isEmpty()) {
            return RetrievalResult.empty();
        }

        List<Dataset> active = call("active-datasets", store::findActiveDatasets, storeQueries);
        if (active.isEmpty()) {
            log.debug("No active reference dataset, nothing to match against");
            return RetrievalResult.empty();
        }
        Map<String, Dataset> datasets = new LinkedHashMap<>();
        active.forEach(dataset -> datasets.put(dataset.id(), dataset));
        Set<String> datasetIds = datasets.keySet();

        Set<String> names = lookupValues(variants, true);
        Set<String> aliases = lookupValues(variants, false);

        List<Map<String, Object>> rows = new ArrayList<>(
                call("exact-name", () -> store.findByOrganizationNames(names, datasetIds), storeQueries));
        rows.addAll(call("alias", () -> store.findByAliases(aliases, datasetIds), storeQueries));

        boolean widened = false;
        if (rows.isEmpty()) {
            Set<String> keys = new LinkedHashSet<>();
            variants.forEach(variant -> keys.addAll(blockingKeyStrategy.generateKeys(variant.normalized())));
            if (!keys.isEmpty()) {
                rows.addAll(call("candidate-window",
                        () -> store.findCandidateWindow(keys, datasetIds, windowSize), storeQueries));
                widened = true;
            }
        }

        Map<String, ReferenceEntity> candidates = new LinkedHashMap<>();
        int skipped = 0;
        for (Map<String, Object> row : rows) {
            ReferenceEntity entity;
            try {
                entity = mapper.toEntity(row);
            } catch (RecordParseException e) {
                skipped++;
                metricsService.incrementRecordParseFailure();
                log.warn("record.skipped store={} reason={}", store.getName(), e.getMessage());
                continue;
            }
            if (datasets.containsKey(entity.datasetId())) {
                candidates.putIfAbsent(entity.dedupKey(), entity);
            }
        }

        log.debug("candidates.retrieved count={} widened={} skipped={}", candidates.size(), widened, skipped);
        return new RetrievalResult(List.copyOf(candidates.values()), Map.copyOf(datasets), skipped, widened);
    }

    /**
     * Lower-cased forms of every variant. Name lookups also try core forms long enough to
     * be distinctive.
     */
    private static Set<String> lookupValues(List<SearchVariant> variants, boolean includeCore) {
        Set<String> values = new LinkedHashSet<>();
        for (SearchVariant variant : variants) {
            values.add(variant.text().trim().toLowerCase(Locale.ROOT));
            values.add(variant.normalized());
            if (includeCore && variant.core().length() >= MIN_CORE_LOOKUP_LENGTH) {
                values.add(variant.core());
            }
        }
        values.remove("");
        return values;
    }

    private <T> T call(String operation, Callable<T> lookup, AtomicInteger storeQueries) {
        storeQueries.incrementAndGet();
        Future<T> future = storeExecutor.submit(lookup);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            metricsService.incrementStoreFailure(operation);
            throw new StoreUnavailableException("Reference store " + store.getName() + " timed out after "
                    + timeout.toMillis() + "ms on " + operation, e);
        } catch (ExecutionException e) {
            metricsService.incrementStoreFailure(operation);
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new StoreUnavailableException("Reference store " + store.getName() + " failed on "
                    + operation + ": " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new StoreUnavailableException("Interrupted while waiting for " + operation, e);
        }
    }
}
