package com.flagship.revenue_ledger.ledger;

import com.flagship.revenue_ledger.attribution.Agent;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * One immutable ledger record per order decision.
 *
 * {@code sequence} is the append position assigned by the store and {@code entryHash}
 * the opaque identity exposed to callers. Both are null until the entry is appended.
 * After that the only changes ever made are setting {@code invoiceId} once and a
 * one-time anonymization of the order identifiers.
 */
@Value
@Builder(toBuilder = true)
public class LedgerEntry {
    Long sequence;
    String entryHash;
    String previousHash;

    String clientId;
    String platform;
    String internalOrderId;
    String externalOrderId;

    BigDecimal orderAmount;
    boolean attributed;
    BigDecimal attributionConfidence;

    BigDecimal baselineRevenue;
    BigDecimal incrementalRevenue;
    BigDecimal upliftPercentage;

    BigDecimal adSpendForOrder;
    BigDecimal baselineAdSpend;
    BigDecimal incrementalAdSpend;
    BigDecimal netProfitUplift;

    BigDecimal feeAmount;
    boolean feeApplicable;

    List<Agent> contributingAgents;
    String explanation;

    String campaignId;
    String creativeId;
    String touchpointId;

    UUID invoiceId;
    Instant anonymizedAt;
    Instant createdAt;

    public boolean isInvoiced() {
        return invoiceId != null;
    }

    public boolean isAnonymized() {
        return anonymizedAt != null;
    }
}
