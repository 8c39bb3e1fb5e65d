package com.flagship.revenue_ledger.settlement;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * JPA entity for {@link SettlementInvoice}.
 *
 * Financial columns are {@code updatable = false}; {@link #applyStatus} can only
 * move the lifecycle columns.
 */
@Entity
@Table(
    name = "settlement_invoices",
    uniqueConstraints = @UniqueConstraint(name = "uq_invoice_period",
            columnNames = {"client_id", "billing_year", "billing_month"})
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SettlementInvoiceEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "client_id", nullable = false, updatable = false, length = 64)
    private String clientId;

    @Column(name = "platform", nullable = false, updatable = false, length = 64)
    private String platform;

    @Column(name = "billing_year", nullable = false, updatable = false)
    private int billingYear;

    @Column(name = "billing_month", nullable = false, updatable = false)
    private int billingMonth;

    @Column(name = "baseline_revenue", nullable = false, updatable = false, precision = 14, scale = 2)
    private BigDecimal baselineRevenue;

    @Column(name = "baseline_ad_spend", nullable = false, updatable = false, precision = 14, scale = 2)
    private BigDecimal baselineAdSpend;

    @Column(name = "actual_revenue", nullable = false, updatable = false, precision = 14, scale = 2)
    private BigDecimal actualRevenue;

    @Column(name = "actual_ad_spend", nullable = false, updatable = false, precision = 14, scale = 2)
    private BigDecimal actualAdSpend;

    @Column(name = "incremental_revenue", nullable = false, updatable = false, precision = 14, scale = 2)
    private BigDecimal incrementalRevenue;

    @Column(name = "incremental_ad_spend", nullable = false, updatable = false, precision = 14, scale = 2)
    private BigDecimal incrementalAdSpend;

    @Column(name = "net_profit_uplift", nullable = false, updatable = false, precision = 14, scale = 2)
    private BigDecimal netProfitUplift;

    @Column(name = "uplift_percentage", nullable = false, updatable = false, precision = 9, scale = 2)
    private BigDecimal upliftPercentage;

    @Column(name = "fee_percentage", nullable = false, updatable = false, precision = 5, scale = 4)
    private BigDecimal feePercentage;

    @Column(name = "fee_amount", nullable = false, updatable = false, precision = 14, scale = 2)
    private BigDecimal feeAmount;

    @Column(name = "client_net_gain", nullable = false, updatable = false, precision = 14, scale = 2)
    private BigDecimal clientNetGain;

    @Column(name = "client_roi", nullable = false, updatable = false, precision = 12, scale = 2)
    private BigDecimal clientRoi;

    @Column(name = "orders_reviewed", nullable = false, updatable = false)
    private int ordersReviewed;

    @Column(name = "orders_attributed", nullable = false, updatable = false)
    private int ordersAttributed;

    @Column(name = "high_confidence_orders", nullable = false, updatable = false)
    private int highConfidenceOrders;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private InvoiceStatus status;

    @Column(name = "due_date", nullable = false, updatable = false)
    private LocalDate dueDate;

    @Column(name = "explanation", nullable = false, updatable = false, length = 4000)
    private String explanation;

    @Column(name = "generated_by", nullable = false, updatable = false, length = 64)
    private String generatedBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "sent_at")
    private Instant sentAt;

    @Column(name = "paid_at")
    private Instant paidAt;

    @Column(name = "disputed_at")
    private Instant disputedAt;

    @Column(name = "dispute_reason", length = 1000)
    private String disputeReason;

    static SettlementInvoiceEntity fromDomain(SettlementInvoice invoice) {
        return new SettlementInvoiceEntity(
            invoice.getId(),
            invoice.getClientId(),
            invoice.getPlatform(),
            invoice.getBillingYear(),
            invoice.getBillingMonth(),
            invoice.getBaselineRevenue(),
            invoice.getBaselineAdSpend(),
            invoice.getActualRevenue(),
            invoice.getActualAdSpend(),
            invoice.getIncrementalRevenue(),
            invoice.getIncrementalAdSpend(),
            invoice.getNetProfitUplift(),
            invoice.getUpliftPercentage(),
            invoice.getFeePercentage(),
            invoice.getFeeAmount(),
            invoice.getClientNetGain(),
            invoice.getClientRoi(),
            invoice.getOrdersReviewed(),
            invoice.getOrdersAttributed(),
            invoice.getHighConfidenceOrders(),
            invoice.getStatus(),
            invoice.getDueDate(),
            invoice.getExplanation(),
            invoice.getGeneratedBy(),
            invoice.getCreatedAt(),
            invoice.getUpdatedAt(),
            invoice.getSentAt(),
            invoice.getPaidAt(),
            invoice.getDisputedAt(),
            invoice.getDisputeReason()
        );
    }

    public SettlementInvoice toDomain() {
        return SettlementInvoice.builder()
            .id(id)
            .clientId(clientId)
            .platform(platform)
            .billingYear(billingYear)
            .billingMonth(billingMonth)
            .baselineRevenue(baselineRevenue)
            .baselineAdSpend(baselineAdSpend)
            .actualRevenue(actualRevenue)
            .actualAdSpend(actualAdSpend)
            .incrementalRevenue(incrementalRevenue)
            .incrementalAdSpend(incrementalAdSpend)
            .netProfitUplift(netProfitUplift)
            .upliftPercentage(upliftPercentage)
            .feePercentage(feePercentage)
            .feeAmount(feeAmount)
            .clientNetGain(clientNetGain)
            .clientRoi(clientRoi)
            .ordersReviewed(ordersReviewed)
            .ordersAttributed(ordersAttributed)
            .highConfidenceOrders(highConfidenceOrders)
            .status(status)
            .dueDate(dueDate)
            .explanation(explanation)
            .generatedBy(generatedBy)
            .createdAt(createdAt)
            .updatedAt(updatedAt)
            .sentAt(sentAt)
            .paidAt(paidAt)
            .disputedAt(disputedAt)
            .disputeReason(disputeReason)
            .build();
    }

    /**
     * Copies the lifecycle columns from a transitioned invoice. Figures are never copied.
     */
    void applyStatus(SettlementInvoice invoice) {
        if (!id.equals(invoice.getId())) {
            throw new IllegalArgumentException("Invoice " + invoice.getId() + " does not match entity " + id);
        }
        this.status = invoice.getStatus();
        this.updatedAt = invoice.getUpdatedAt();
        this.sentAt = invoice.getSentAt();
        this.paidAt = invoice.getPaidAt();
        this.disputedAt = invoice.getDisputedAt();
        this.disputeReason = invoice.getDisputeReason();
    }
}
