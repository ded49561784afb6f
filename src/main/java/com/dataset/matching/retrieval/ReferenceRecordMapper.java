package com.dataset.matching.retrieval;

import com.dataset.matching.core.model.ReferenceEntity;
import com.dataset.matching.store.ReferenceColumns;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Maps store rows to {@link ReferenceEntity} instances, rejecting malformed rows with a
 * {@link RecordParseException}.
 */
public class ReferenceRecordMapper {

    public ReferenceEntity toEntity(Map<String, Object> row) {
        if (row == null) {
            throw new RecordParseException("Row is null");
        }
        Object datasetId = row.get(ReferenceColumns.DATASET_ID);
        if (datasetId == null) {
            throw new RecordParseException("Row has no dataset_id");
        }
        Object name = row.get(ReferenceColumns.ORGANIZATION_NAME);
        if (!(name instanceof String organizationName) || organizationName.isBlank()) {
            throw new RecordParseException("Row in dataset " + datasetId + " has no organization_name");
        }
        Object category = row.get(ReferenceColumns.CATEGORY);

        return new ReferenceEntity(
                organizationName,
                stringList(row.get(ReferenceColumns.ALIASES), ReferenceColumns.ALIASES, organizationName),
                category != null ? category.toString() : null,
                stringSet(row.get(ReferenceColumns.COUNTRIES), organizationName),
                datasetId.toString());
    }

    private static List<String> stringList(Object value, String column, String organizationName) {
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof Collection<?> values)) {
            throw new RecordParseException(column + " of '" + organizationName + "' is not a list: "
                    + value.getClass().getSimpleName());
        }
        List<String> result = new ArrayList<>(values.size());
        for (Object element : values) {
            if (element == null) {
                continue;
            }
            if (!(element instanceof String text)) {
                throw new RecordParseException(column + " of '" + organizationName + "' contains a non-string element");
            }
            result.add(text);
        }
        return result;
    }

    private static Set<String> stringSet(Object value, String organizationName) {
        return new LinkedHashSet<>(stringList(value, ReferenceColumns.COUNTRIES, organizationName));
    }
}
