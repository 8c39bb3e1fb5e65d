package com.flagship.revenue_ledger.exception;

/**
 * An entry for {@code (clientId, externalOrderId)} already exists.
 *
 * Carries the existing entry's identifiers so retries can be answered with the
 * original result instead of an error.
 */
public class DuplicateOrderException extends ConflictException {

    private final String clientId;
    private final String externalOrderId;
    private final String existingEntryHash;
    private final long existingSequence;

    public DuplicateOrderException(String clientId, String externalOrderId,
                                   String existingEntryHash, long existingSequence) {
        super(String.format("Order %s already recorded for client %s as entry %s",
                externalOrderId, clientId, existingEntryHash));
        this.clientId = clientId;
        this.externalOrderId = externalOrderId;
        this.existingEntryHash = existingEntryHash;
        this.existingSequence = existingSequence;
    }

    public String getClientId() {
        return clientId;
    }

    public String getExternalOrderId() {
        return externalOrderId;
    }

    public String getExistingEntryHash() {
        return existingEntryHash;
    }

    public long getExistingSequence() {
        return existingSequence;
    }

    @Override
    public String getErrorCode() {
        return "DUPLICATE_ORDER";
    }
}
