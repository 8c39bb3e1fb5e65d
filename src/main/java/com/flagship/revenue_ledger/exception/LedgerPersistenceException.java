package com.flagship.revenue_ledger.exception;

/**
 * Storage was unavailable, a store call exceeded the caller's timeout, or a write
 * failed. Nothing was committed; the caller should retry with backoff reusing the
 * same external order id.
 */
public class LedgerPersistenceException extends LedgerException {

    public LedgerPersistenceException(String message) {
        super(message);
    }

    public LedgerPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getErrorCode() {
        return "PERSISTENCE_UNAVAILABLE";
    }
}
