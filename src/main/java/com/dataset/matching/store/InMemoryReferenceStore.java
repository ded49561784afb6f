package com.dataset.matching.store;

import com.dataset.matching.core.model.Dataset;
import com.dataset.matching.core.model.ReferenceEntity;
import com.dataset.matching.rules.NameNormalizer;
import com.dataset.matching.similarity.BlockingKeyStrategy;
import com.dataset.matching.similarity.DefaultBlockingKeyStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Reference store held in memory with hash indexes on lower-cased names, lower-cased
 * aliases and blocking keys. Suitable for tests, embedded use and small datasets.
 *
 * <p>Rows are kept as loaded, so malformed rows (say, aliases that are not a list) are
 * returned as-is and rejected downstream. Such rows are only reachable through their
 * organization name and blocking keys.</p>
 */
public class InMemoryReferenceStore implements ReferenceStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryReferenceStore.class);

    private static final Comparator<Map<String, Object>> ROW_ORDER = Comparator
            .comparing((Map<String, Object> row) -> String.valueOf(row.get(ReferenceColumns.DATASET_ID)))
            .thenComparing(row -> String.valueOf(row.get(ReferenceColumns.ORGANIZATION_NAME)));

    private final NameNormalizer normalizer;
    private final BlockingKeyStrategy blockingKeyStrategy;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, Dataset> datasets = new LinkedHashMap<>();
    private final Map<String, List<Map<String, Object>>> nameIndex = new HashMap<>();
    private final Map<String, List<Map<String, Object>>> aliasIndex = new HashMap<>();
    private final Map<String, List<Map<String, Object>>> blockingKeyIndex = new HashMap<>();
    private final AtomicLong lookupCount = new AtomicLong();

    public InMemoryReferenceStore() {
        this(new NameNormalizer(), new DefaultBlockingKeyStrategy());
    }

    public InMemoryReferenceStore(NameNormalizer normalizer, BlockingKeyStrategy blockingKeyStrategy) {
        this.normalizer = normalizer;
        this.blockingKeyStrategy = blockingKeyStrategy;
    }

    /**
     * Registers a dataset and indexes its rows. The dataset id is written into every row.
     */
    public void addDataset(Dataset dataset, List<Map<String, Object>> rows) {
        lock.writeLock().lock();
        try {
            datasets.put(dataset.id(), new Dataset(dataset.id(), dataset.name(), dataset.active(), rows.size()));
            for (Map<String, Object> raw : rows) {
                Map<String, Object> row = new LinkedHashMap<>(raw);
                row.put(ReferenceColumns.DATASET_ID, dataset.id());
                index(Collections.unmodifiableMap(row));
            }
        } finally {
            lock.writeLock().unlock();
        }
        log.info("dataset.loaded datasetId={} name={} active={} rows={}",
                dataset.id(), dataset.name(), dataset.active(), rows.size());
    }

    /**
     * Registers a dataset built from well-formed entities.
     */
    public void addEntities(Dataset dataset, List<ReferenceEntity> entities) {
        List<Map<String, Object>> rows = new ArrayList<>(entities.size());
        for (ReferenceEntity entity : entities) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put(ReferenceColumns.ORGANIZATION_NAME, entity.organizationName());
            row.put(ReferenceColumns.ALIASES, entity.aliases());
            row.put(ReferenceColumns.CATEGORY, entity.category());
            row.put(ReferenceColumns.COUNTRIES, List.copyOf(new TreeSet<>(entity.countries())));
            rows.add(row);
        }
        addDataset(dataset, rows);
    }

    public void setDatasetActive(String datasetId, boolean active) {
        lock.writeLock().lock();
        try {
            Dataset current = datasets.get(datasetId);
            if (current == null) {
                throw new IllegalArgumentException("Unknown dataset: " + datasetId);
            }
            datasets.put(datasetId, new Dataset(current.id(), current.name(), active, current.entryCount()));
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<Dataset> findActiveDatasets() {
        lookupCount.incrementAndGet();
        lock.readLock().lock();
        try {
            return datasets.values().stream().filter(Dataset::active).toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Map<String, Object>> findByOrganizationNames(Set<String> lowerNames, Set<String> datasetIds) {
        return lookup(nameIndex, lowerNames, datasetIds);
    }

    @Override
    public List<Map<String, Object>> findByAliases(Set<String> lowerAliases, Set<String> datasetIds) {
        return lookup(aliasIndex, lowerAliases, datasetIds);
    }

    @Override
    public List<Map<String, Object>> findCandidateWindow(Set<String> blockingKeys, Set<String> datasetIds, int limit) {
        lookupCount.incrementAndGet();
        lock.readLock().lock();
        try {
            Map<Map<String, Object>, Integer> shared = new IdentityHashMap<>();
            for (String key : blockingKeys) {
                for (Map<String, Object> row : blockingKeyIndex.getOrDefault(key, List.of())) {
                    if (datasetIds.contains(row.get(ReferenceColumns.DATASET_ID))) {
                        shared.merge(row, 1, Integer::sum);
                    }
                }
            }
            List<Map<String, Object>> window = new ArrayList<>(shared.keySet());
            window.sort(Comparator.comparing((Map<String, Object> row) -> -shared.get(row)).thenComparing(ROW_ORDER));
            return window.size() > limit ? List.copyOf(window.subList(0, limit)) : window;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public String getName() {
        return "in-memory";
    }

    /**
     * Number of lookups served so far, across all lookup methods.
     */
    public long getLookupCount() {
        return lookupCount.get();
    }

    private List<Map<String, Object>> lookup(Map<String, List<Map<String, Object>>> index,
                                             Set<String> values, Set<String> datasetIds) {
        lookupCount.incrementAndGet();
        lock.readLock().lock();
        try {
            Set<Map<String, Object>> found = Collections.newSetFromMap(new IdentityHashMap<>());
            for (String value : values) {
                for (Map<String, Object> row : index.getOrDefault(value, List.of())) {
                    if (datasetIds.contains(row.get(ReferenceColumns.DATASET_ID))) {
                        found.add(row);
                    }
                }
            }
            List<Map<String, Object>> result = new ArrayList<>(found);
            result.sort(ROW_ORDER);
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    private void index(Map<String, Object> row) {
        Object name = row.get(ReferenceColumns.ORGANIZATION_NAME);
        if (name instanceof String organizationName && !organizationName.isBlank()) {
            put(nameIndex, lower(organizationName), row);
            for (String key : blockingKeyStrategy.generateKeys(normalizer.normalize(organizationName))) {
                put(blockingKeyIndex, key, row);
            }
        }
        if (row.get(ReferenceColumns.ALIASES) instanceof Collection<?> aliases) {
            for (Object alias : aliases) {
                if (alias instanceof String value && !value.isBlank()) {
                    put(aliasIndex, lower(value), row);
                }
            }
        }
    }

    private static void put(Map<String, List<Map<String, Object>>> index, String key, Map<String, Object> row) {
        List<Map<String, Object>> rows = index.computeIfAbsent(key, k -> new ArrayList<>());
        if (rows.stream().noneMatch(existing -> existing == row)) {
            rows.add(row);
        }
    }

    private static String lower(String value) {
        return value.trim().toLowerCase(Locale.ROOT);
    }
}
