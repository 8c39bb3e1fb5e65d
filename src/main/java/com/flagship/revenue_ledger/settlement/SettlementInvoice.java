package com.flagship.revenue_ledger.settlement;

import com.flagship.revenue_ledger.exception.ConflictException;
import com.flagship.revenue_ledger.exception.ValidationException;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.UUID;

/**
 * One invoice per (client, billing year, billing month).
 *
 * The figures are fixed when the invoice is generated. Afterwards only the status
 * moves forward, stamping the matching timestamp; each transition returns a new
 * instance.
 */
@Value
@Builder(toBuilder = true)
public class SettlementInvoice {
    public static final String AGGREGATE_TYPE = "SettlementInvoice";

    UUID id;
    String clientId;
    String platform;
    int billingYear;
    int billingMonth;

    BigDecimal baselineRevenue;
    BigDecimal baselineAdSpend;
    BigDecimal actualRevenue;
    BigDecimal actualAdSpend;
    BigDecimal incrementalRevenue;
    BigDecimal incrementalAdSpend;
    BigDecimal netProfitUplift;
    BigDecimal upliftPercentage;

    BigDecimal feePercentage;
    BigDecimal feeAmount;
    BigDecimal clientNetGain;
    BigDecimal clientRoi;

    int ordersReviewed;
    int ordersAttributed;
    int highConfidenceOrders;

    InvoiceStatus status;
    LocalDate dueDate;
    String explanation;
    String generatedBy;

    Instant createdAt;
    Instant updatedAt;
    Instant sentAt;
    Instant paidAt;
    Instant disputedAt;
    String disputeReason;

    public YearMonth getPeriod() {
        return YearMonth.of(billingYear, billingMonth);
    }

    /**
     * DRAFT -> SENT.
     *
     * @throws ConflictException if the invoice is past DRAFT and not already SENT
     */
    public SettlementInvoice markSent(Instant now) {
        if (status == InvoiceStatus.SENT) {
            return this;
        }
        requireStatus(InvoiceStatus.DRAFT, InvoiceStatus.SENT);
        return toBuilder()
                .status(InvoiceStatus.SENT)
                .sentAt(now)
                .updatedAt(now)
                .build();
    }

    /**
     * SENT -> PAID.
     */
    public SettlementInvoice markPaid(Instant now) {
        if (status == InvoiceStatus.PAID) {
            return this;
        }
        requireStatus(InvoiceStatus.SENT, InvoiceStatus.PAID);
        return toBuilder()
                .status(InvoiceStatus.PAID)
                .paidAt(now)
                .updatedAt(now)
                .build();
    }

    /**
     * SENT -> DISPUTED. A repeated dispute keeps the original reason.
     */
    public SettlementInvoice markDisputed(String reason, Instant now) {
        if (reason == null || reason.isBlank()) {
            throw new ValidationException("reason", "Dispute reason is required");
        }
        if (status == InvoiceStatus.DISPUTED) {
            return this;
        }
        requireStatus(InvoiceStatus.SENT, InvoiceStatus.DISPUTED);
        return toBuilder()
                .status(InvoiceStatus.DISPUTED)
                .disputedAt(now)
                .disputeReason(reason.strip())
                .updatedAt(now)
                .build();
    }

    public boolean canTransitionTo(InvoiceStatus target) {
        if (status == target) {
            return true;
        }
        return switch (status) {
            case DRAFT -> target == InvoiceStatus.SENT;
            case SENT -> target == InvoiceStatus.PAID || target == InvoiceStatus.DISPUTED;
            case PAID, DISPUTED -> false;
        };
    }

    private void requireStatus(InvoiceStatus required, InvoiceStatus target) {
        if (status != required) {
            throw new ConflictException(String.format(
                    "Cannot move invoice %s from %s to %s. Only %s invoices can become %s.",
                    id, status, target, required, target));
        }
    }
}
