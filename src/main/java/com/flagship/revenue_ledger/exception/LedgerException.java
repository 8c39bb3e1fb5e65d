package com.flagship.revenue_ledger.exception;

/**
 * Root of the ledger engine's error taxonomy.
 *
 * Every failure surfaced to a caller is one of:
 * - {@link ValidationException}: malformed or out-of-range input, never retried
 * - {@link NotFoundException}: the referenced client, entry or invoice does not exist
 * - {@link ConflictException}: the request collides with existing state
 * - {@link LedgerPersistenceException}: storage unavailable, timed out or write failed;
 *   the caller may retry with the same idempotency key
 */
public abstract class LedgerException extends RuntimeException {

    protected LedgerException(String message) {
        super(message);
    }

    protected LedgerException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Short machine-readable error code rendered in API responses.
     */
    public abstract String getErrorCode();
}
