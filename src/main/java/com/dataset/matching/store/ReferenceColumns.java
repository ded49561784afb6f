package com.dataset.matching.store;

/**
 * Column names of the rows a {@link ReferenceStore} returns.
 */
public final class ReferenceColumns {

    public static final String DATASET_ID = "dataset_id";
    public static final String ORGANIZATION_NAME = "organization_name";
    public static final String ALIASES = "aliases";
    public static final String CATEGORY = "category";
    public static final String COUNTRIES = "countries";

    private ReferenceColumns() {
    }
}
