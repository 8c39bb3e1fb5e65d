package com.flagship.revenue_ledger.exception;

public class NotFoundException extends LedgerException {

    public NotFoundException(String message) {
        super(message);
    }

    @Override
    public String getErrorCode() {
        return "NOT_FOUND";
    }
}
