package com.flagship.revenue_ledger.event;

import com.flagship.revenue_ledger.settlement.InvoiceStatus;
import com.flagship.revenue_ledger.settlement.SettlementInvoice;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class InvoiceStatusChangedEvent implements LedgerEvent {
    public static final String EVENT_TYPE = "InvoiceStatusChanged";

    UUID eventId;
    String clientId;
    UUID invoiceId;
    InvoiceStatus previousStatus;
    InvoiceStatus status;
    String reason;
    Instant occurredAt;

    @Override
    public String getAggregateType() {
        return SettlementInvoice.AGGREGATE_TYPE;
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static InvoiceStatusChangedEvent of(SettlementInvoice invoice, InvoiceStatus previousStatus) {
        return new InvoiceStatusChangedEvent(
            UUID.randomUUID(),
            invoice.getClientId(),
            invoice.getId(),
            previousStatus,
            invoice.getStatus(),
            invoice.getDisputeReason(),
            invoice.getUpdatedAt()
        );
    }
}
