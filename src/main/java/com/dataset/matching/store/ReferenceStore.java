package com.dataset.matching.store;

import com.dataset.matching.core.model.Dataset;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read-only access to the reference datasets.
 *
 * <p>Lookups return raw rows keyed by {@link ReferenceColumns}; turning them into entities
 * (and rejecting malformed ones) is the caller's job. Every lookup is restricted to the
 * given dataset ids. Implementations must answer the alias lookup with an indexed
 * membership predicate rather than a scan.</p>
 */
public interface ReferenceStore {

    /**
     * Datasets currently flagged active.
     */
    List<Dataset> findActiveDatasets();

    /**
     * Entities whose lower-cased organization name equals one of {@code lowerNames}.
     */
    List<Map<String, Object>> findByOrganizationNames(Set<String> lowerNames, Set<String> datasetIds);

    /**
     * Entities having an alias whose lower-cased value equals one of {@code lowerAliases}.
     */
    List<Map<String, Object>> findByAliases(Set<String> lowerAliases, Set<String> datasetIds);

    /**
     * Entities sharing at least one blocking key with {@code blockingKeys}, strongest overlap
     * first, at most {@code limit} rows.
     */
    List<Map<String, Object>> findCandidateWindow(Set<String> blockingKeys, Set<String> datasetIds, int limit);

    /**
     * Short identifier used in logs and health reports.
     */
    String getName();
}
