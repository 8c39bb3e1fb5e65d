package com.flagship.revenue_ledger.exception;

import java.util.Collections;
import java.util.Map;

/**
 * Input is malformed or out of range (e.g. confidence outside [0, 1]).
 */
public class ValidationException extends LedgerException {

    private final Map<String, String> fieldErrors;

    public ValidationException(String message) {
        this(message, Collections.emptyMap());
    }

    public ValidationException(String field, String message) {
        this(message, Map.of(field, message));
    }

    public ValidationException(String message, Map<String, String> fieldErrors) {
        super(message);
        this.fieldErrors = Map.copyOf(fieldErrors);
    }

    public Map<String, String> getFieldErrors() {
        return fieldErrors;
    }

    @Override
    public String getErrorCode() {
        return "VALIDATION_FAILED";
    }
}
