package com.flagship.revenue_ledger.event;

import com.flagship.revenue_ledger.settlement.SettlementInvoice;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
public class SettlementGeneratedEvent implements LedgerEvent {
    public static final String EVENT_TYPE = "SettlementGenerated";

    UUID eventId;
    String clientId;
    UUID invoiceId;
    int billingYear;
    int billingMonth;
    BigDecimal netProfitUplift;
    BigDecimal feeAmount;
    int ordersAttributed;
    LocalDate dueDate;
    Instant occurredAt;

    @Override
    public String getAggregateType() {
        return SettlementInvoice.AGGREGATE_TYPE;
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static SettlementGeneratedEvent fromInvoice(SettlementInvoice invoice) {
        return new SettlementGeneratedEvent(
            UUID.randomUUID(),
            invoice.getClientId(),
            invoice.getId(),
            invoice.getBillingYear(),
            invoice.getBillingMonth(),
            invoice.getNetProfitUplift(),
            invoice.getFeeAmount(),
            invoice.getOrdersAttributed(),
            invoice.getDueDate(),
            invoice.getCreatedAt()
        );
    }
}
