package com.dataset.matching.retrieval;

import com.dataset.matching.core.model.Dataset;
import com.dataset.matching.core.model.ReferenceEntity;

import java.util.List;
import java.util.Map;

/**
 * Candidates fetched for one query.
 *
 * @param candidates  deduplicated by dataset and organization name, in store order
 * @param datasets    active datasets by id, for display names
 * @param skippedRows rows rejected as malformed
 * @param widened     whether the candidate window was used because exact and alias lookups found nothing
 */
public record RetrievalResult(List<ReferenceEntity> candidates,
                              Map<String, Dataset> datasets,
                              int skippedRows,
                              boolean widened) {

    public static RetrievalResult empty() {
        return new RetrievalResult(List.of(), Map.of(), 0, false);
    }

    public boolean isEmpty() {
        return candidates.isEmpty();
    }

    public String datasetName(String datasetId) {
        Dataset dataset = datasets.get(datasetId);
        return dataset != null ? dataset.name() : datasetId;
    }
}
