package com.flagship.revenue_ledger.event;

import com.flagship.revenue_ledger.ledger.EntryHasher;
import com.flagship.revenue_ledger.ledger.LedgerEntry;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Published for every recorded order, attributed or not. Carries the order digest
 * rather than the platform order id.
 */
@Value
public class OrderAttributedEvent implements LedgerEvent {
    public static final String EVENT_TYPE = "OrderAttributed";
    public static final String AGGREGATE_TYPE = "LedgerEntry";

    UUID eventId;
    String clientId;
    String entryHash;
    long sequence;
    String orderDigest;
    BigDecimal orderAmount;
    boolean attributed;
    BigDecimal attributionConfidence;
    BigDecimal incrementalRevenue;
    BigDecimal netProfitUplift;
    BigDecimal feeAmount;
    List<String> contributingAgents;
    Instant occurredAt;

    @Override
    public String getAggregateType() {
        return AGGREGATE_TYPE;
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static OrderAttributedEvent fromEntry(LedgerEntry entry) {
        return new OrderAttributedEvent(
            UUID.randomUUID(),
            entry.getClientId(),
            entry.getEntryHash(),
            entry.getSequence(),
            EntryHasher.orderDigest(entry.getExternalOrderId()),
            entry.getOrderAmount(),
            entry.isAttributed(),
            entry.getAttributionConfidence(),
            entry.getIncrementalRevenue(),
            entry.getNetProfitUplift(),
            entry.getFeeAmount(),
            entry.getContributingAgents().stream().map(Enum::name).toList(),
            entry.getCreatedAt()
        );
    }
}
