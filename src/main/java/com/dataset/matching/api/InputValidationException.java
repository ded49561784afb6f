package com.dataset.matching.api;

import com.dataset.matching.core.DatasetMatchingException;

/**
 * Thrown when a query is structurally invalid, e.g. the entity is missing or too long.
 * This is the only failure surfaced to the caller as {@code success=false}.
 */
public class InputValidationException extends DatasetMatchingException {

    public static final String CODE = "INPUT_VALIDATION_ERROR";

    public InputValidationException(String message) {
        super(CODE, message);
    }
}
