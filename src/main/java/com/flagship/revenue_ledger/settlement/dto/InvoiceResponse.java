package com.flagship.revenue_ledger.settlement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.revenue_ledger.settlement.InvoiceStatus;
import com.flagship.revenue_ledger.settlement.SettlementInvoice;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class InvoiceResponse {

    @JsonProperty("invoice_id")
    UUID invoiceId;

    @JsonProperty("client_id")
    String clientId;

    @JsonProperty("platform")
    String platform;

    @JsonProperty("billing_period")
    String billingPeriod;

    @JsonProperty("baseline_revenue")
    BigDecimal baselineRevenue;

    @JsonProperty("baseline_ad_spend")
    BigDecimal baselineAdSpend;

    @JsonProperty("actual_revenue")
    BigDecimal actualRevenue;

    @JsonProperty("actual_ad_spend")
    BigDecimal actualAdSpend;

    @JsonProperty("incremental_revenue")
    BigDecimal incrementalRevenue;

    @JsonProperty("incremental_ad_spend")
    BigDecimal incrementalAdSpend;

    @JsonProperty("net_profit_uplift")
    BigDecimal netProfitUplift;

    @JsonProperty("uplift_percentage")
    BigDecimal upliftPercentage;

    @JsonProperty("fee_percentage")
    BigDecimal feePercentage;

    @JsonProperty("fee_amount")
    BigDecimal feeAmount;

    @JsonProperty("client_net_gain")
    BigDecimal clientNetGain;

    @JsonProperty("client_roi")
    BigDecimal clientRoi;

    @JsonProperty("orders_reviewed")
    int ordersReviewed;

    @JsonProperty("orders_attributed")
    int ordersAttributed;

    @JsonProperty("high_confidence_orders")
    int highConfidenceOrders;

    @JsonProperty("status")
    InvoiceStatus status;

    @JsonProperty("due_date")
    LocalDate dueDate;

    @JsonProperty("explanation")
    String explanation;

    @JsonProperty("generated_by")
    String generatedBy;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("sent_at")
    Instant sentAt;

    @JsonProperty("paid_at")
    Instant paidAt;

    @JsonProperty("disputed_at")
    Instant disputedAt;

    @JsonProperty("dispute_reason")
    String disputeReason;

    public static InvoiceResponse from(SettlementInvoice invoice) {
        return InvoiceResponse.builder()
                .invoiceId(invoice.getId())
                .clientId(invoice.getClientId())
                .platform(invoice.getPlatform())
                .billingPeriod(invoice.getPeriod().toString())
                .baselineRevenue(invoice.getBaselineRevenue())
                .baselineAdSpend(invoice.getBaselineAdSpend())
                .actualRevenue(invoice.getActualRevenue())
                .actualAdSpend(invoice.getActualAdSpend())
                .incrementalRevenue(invoice.getIncrementalRevenue())
                .incrementalAdSpend(invoice.getIncrementalAdSpend())
                .netProfitUplift(invoice.getNetProfitUplift())
                .upliftPercentage(invoice.getUpliftPercentage())
                .feePercentage(invoice.getFeePercentage())
                .feeAmount(invoice.getFeeAmount())
                .clientNetGain(invoice.getClientNetGain())
                .clientRoi(invoice.getClientRoi())
                .ordersReviewed(invoice.getOrdersReviewed())
                .ordersAttributed(invoice.getOrdersAttributed())
                .highConfidenceOrders(invoice.getHighConfidenceOrders())
                .status(invoice.getStatus())
                .dueDate(invoice.getDueDate())
                .explanation(invoice.getExplanation())
                .generatedBy(invoice.getGeneratedBy())
                .createdAt(invoice.getCreatedAt())
                .sentAt(invoice.getSentAt())
                .paidAt(invoice.getPaidAt())
                .disputedAt(invoice.getDisputedAt())
                .disputeReason(invoice.getDisputeReason())
                .build();
    }
}
