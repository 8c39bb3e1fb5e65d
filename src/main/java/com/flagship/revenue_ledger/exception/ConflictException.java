package com.flagship.revenue_ledger.exception;

/**
 * The request collides with existing state: a double invoice assignment, an illegal
 * invoice status transition, or a concurrent settlement that could not be resolved.
 */
public class ConflictException extends LedgerException {

    public ConflictException(String message) {
        super(message);
    }

    public ConflictException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getErrorCode() {
        return "CONFLICT";
    }
}
