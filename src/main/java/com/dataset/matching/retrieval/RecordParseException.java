package com.dataset.matching.retrieval;

import com.dataset.matching.core.DatasetMatchingException;

/**
 * A row returned by the reference store could not be turned into a reference entity.
 */
public class RecordParseException extends DatasetMatchingException {

    public static final String CODE = "RECORD_PARSE_ERROR";

    public RecordParseException(String message) {
        super(CODE, message);
    }
}
