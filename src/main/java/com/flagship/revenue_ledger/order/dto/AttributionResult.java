package com.flagship.revenue_ledger.order.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.revenue_ledger.attribution.Agent;
import com.flagship.revenue_ledger.ledger.LedgerEntry;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Ledger entry as returned to callers. {@code duplicate} is true when the order had
 * already been recorded and this is the original result.
 */
@Value
@Builder
public class AttributionResult {

    @JsonProperty("entry_hash")
    String entryHash;

    @JsonProperty("sequence")
    Long sequence;

    @JsonProperty("previous_hash")
    String previousHash;

    @JsonProperty("client_id")
    String clientId;

    @JsonProperty("platform")
    String platform;

    @JsonProperty("internal_order_id")
    String internalOrderId;

    @JsonProperty("external_order_id")
    String externalOrderId;

    @JsonProperty("order_amount")
    BigDecimal orderAmount;

    @JsonProperty("attributed")
    boolean attributed;

    @JsonProperty("attribution_confidence")
    BigDecimal attributionConfidence;

    @JsonProperty("baseline_revenue")
    BigDecimal baselineRevenue;

    @JsonProperty("incremental_revenue")
    BigDecimal incrementalRevenue;

    @JsonProperty("uplift_percentage")
    BigDecimal upliftPercentage;

    @JsonProperty("ad_spend_for_order")
    BigDecimal adSpendForOrder;

    @JsonProperty("baseline_ad_spend")
    BigDecimal baselineAdSpend;

    @JsonProperty("incremental_ad_spend")
    BigDecimal incrementalAdSpend;

    @JsonProperty("net_profit_uplift")
    BigDecimal netProfitUplift;

    @JsonProperty("fee_amount")
    BigDecimal feeAmount;

    @JsonProperty("fee_applicable")
    boolean feeApplicable;

    @JsonProperty("contributing_agents")
    List<Agent> contributingAgents;

    @JsonProperty("explanation")
    String explanation;

    @JsonProperty("campaign_id")
    String campaignId;

    @JsonProperty("creative_id")
    String creativeId;

    @JsonProperty("touchpoint_id")
    String touchpointId;

    @JsonProperty("invoice_id")
    UUID invoiceId;

    @JsonProperty("anonymized_at")
    Instant anonymizedAt;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("duplicate")
    boolean duplicate;

    public static AttributionResult from(LedgerEntry entry) {
        return from(entry, false);
    }

    public static AttributionResult from(LedgerEntry entry, boolean duplicate) {
        return AttributionResult.builder()
            .entryHash(entry.getEntryHash())
            .sequence(entry.getSequence())
            .previousHash(entry.getPreviousHash())
            .clientId(entry.getClientId())
            .platform(entry.getPlatform())
            .internalOrderId(entry.getInternalOrderId())
            .externalOrderId(entry.getExternalOrderId())
            .orderAmount(entry.getOrderAmount())
            .attributed(entry.isAttributed())
            .attributionConfidence(entry.getAttributionConfidence())
            .baselineRevenue(entry.getBaselineRevenue())
            .incrementalRevenue(entry.getIncrementalRevenue())
            .upliftPercentage(entry.getUpliftPercentage())
            .adSpendForOrder(entry.getAdSpendForOrder())
            .baselineAdSpend(entry.getBaselineAdSpend())
            .incrementalAdSpend(entry.getIncrementalAdSpend())
            .netProfitUplift(entry.getNetProfitUplift())
            .feeAmount(entry.getFeeAmount())
            .feeApplicable(entry.isFeeApplicable())
            .contributingAgents(entry.getContributingAgents())
            .explanation(entry.getExplanation())
            .campaignId(entry.getCampaignId())
            .creativeId(entry.getCreativeId())
            .touchpointId(entry.getTouchpointId())
            .invoiceId(entry.getInvoiceId())
            .anonymizedAt(entry.getAnonymizedAt())
            .createdAt(entry.getCreatedAt())
            .duplicate(duplicate)
            .build();
    }
}
