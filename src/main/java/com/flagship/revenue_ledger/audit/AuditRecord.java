package com.flagship.revenue_ledger.audit;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.revenue_ledger.ledger.EntryHasher;
import com.flagship.revenue_ledger.ledger.LedgerEntry;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One exported ledger entry. Carries the order digest, which the hash covers, next
 * to the order id as stored (the {@code anon:} form once anonymized).
 */
@Value
@Builder
public class AuditRecord {

    @JsonProperty("entry_hash")
    String entryHash;

    @JsonProperty("previous_hash")
    String previousHash;

    @JsonProperty("sequence")
    long sequence;

    @JsonProperty("order_digest")
    String orderDigest;

    @JsonProperty("order_id")
    String orderId;

    @JsonProperty("order_amount")
    BigDecimal orderAmount;

    @JsonProperty("attributed")
    boolean attributed;

    @JsonProperty("incremental_revenue")
    BigDecimal incrementalRevenue;

    @JsonProperty("net_profit_uplift")
    BigDecimal netProfitUplift;

    @JsonProperty("fee_amount")
    BigDecimal feeAmount;

    @JsonProperty("confidence")
    BigDecimal confidence;

    @JsonProperty("timestamp")
    Instant timestamp;

    public static AuditRecord from(LedgerEntry entry) {
        return AuditRecord.builder()
            .entryHash(entry.getEntryHash())
            .previousHash(entry.getPreviousHash())
            .sequence(entry.getSequence())
            .orderDigest(EntryHasher.orderDigest(entry.getExternalOrderId()))
            .orderId(entry.getExternalOrderId())
            .orderAmount(entry.getOrderAmount())
            .attributed(entry.isAttributed())
            .incrementalRevenue(entry.getIncrementalRevenue())
            .netProfitUplift(entry.getNetProfitUplift())
            .feeAmount(entry.getFeeAmount())
            .confidence(entry.getAttributionConfidence())
            .timestamp(entry.getCreatedAt())
            .build();
    }
}
