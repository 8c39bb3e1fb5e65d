package com.flagship.revenue_ledger.exception;

/**
 * No baseline snapshot exists for the client.
 *
 * This is a precondition failure rather than a plain lookup miss: orders cannot be
 * evaluated until the external baseline job has written a snapshot, and retrying
 * before that happens will keep failing.
 */
public class BaselineNotFoundException extends NotFoundException {

    private final String clientId;

    public BaselineNotFoundException(String clientId) {
        super("No baseline snapshot for client " + clientId + "; run the baseline job first");
        this.clientId = clientId;
    }

    public String getClientId() {
        return clientId;
    }

    @Override
    public String getErrorCode() {
        return "BASELINE_MISSING";
    }
}
