package com.dataset.matching.core;

/**
 * Base class of the failures the matching engine reports.
 */
public class DatasetMatchingException extends RuntimeException {

    private final String code;

    public DatasetMatchingException(String code, String message) {
        super(message);
        this.code = code;
    }

    public DatasetMatchingException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    /**
     * Stable machine-readable error code, e.g. {@code INPUT_VALIDATION_ERROR}.
     */
    public String getCode() {
        return code;
    }
}
