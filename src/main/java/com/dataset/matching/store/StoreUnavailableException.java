package com.dataset.matching.store;

import com.dataset.matching.core.DatasetMatchingException;

/**
 * The reference store timed out or could not be reached. Queries degrade to zero matches.
 */
public class StoreUnavailableException extends DatasetMatchingException {

    public static final String CODE = "STORE_UNAVAILABLE";

    public StoreUnavailableException(String message) {
        super(CODE, message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(CODE, message, cause);
    }
}
