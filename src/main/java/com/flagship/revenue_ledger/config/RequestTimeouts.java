package com.flagship.revenue_ledger.config;

import java.time.Duration;

/**
 * Caller-supplied timeout carried by the {@code X-Request-Timeout-Ms} header.
 * Clamping to the configured bounds happens in {@link TransactionRunner}.
 */
public final class RequestTimeouts {

    public static final String HEADER = "X-Request-Timeout-Ms";

    private RequestTimeouts() {
    }

    /**
     * @return null when the header was absent, so the configured default applies
     */
    public static Duration fromHeader(Long timeoutMs) {
        return timeoutMs == null ? null : Duration.ofMillis(timeoutMs);
    }
}
