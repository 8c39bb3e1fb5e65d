package com.flagship.revenue_ledger.client;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Commercial terms applied to a client's orders and invoices.
 */
@Value
public class ClientTerms {
    String clientId;
    BigDecimal feePercentage;
    BigDecimal confidenceThreshold;

    /** False when the configured defaults are in effect. */
    boolean custom;

    Instant updatedAt;
}
