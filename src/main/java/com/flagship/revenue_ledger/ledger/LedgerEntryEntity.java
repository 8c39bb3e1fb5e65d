package com.flagship.revenue_ledger.ledger;

import com.flagship.revenue_ledger.attribution.Agent;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * JPA entity for {@link LedgerEntry}.
 *
 * Insert-only from JPA's point of view: every column is {@code updatable = false}.
 * The two permitted changes (invoice stamping and anonymization) are conditional SQL
 * updates in {@link LedgerStore}, and on PostgreSQL a trigger rejects anything else.
 */
@Entity
@Table(name = "ledger_entries")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LedgerEntryEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "entry_hash", nullable = false, updatable = false, length = 64)
    private String entryHash;

    @Column(name = "previous_hash", nullable = false, updatable = false, length = 64)
    private String previousHash;

    @Column(name = "client_id", nullable = false, updatable = false, length = 64)
    private String clientId;

    @Column(name = "platform", nullable = false, updatable = false, length = 64)
    private String platform;

    @Column(name = "internal_order_id", nullable = false, updatable = false, length = 128)
    private String internalOrderId;

    @Column(name = "external_order_id", nullable = false, updatable = false, length = 128)
    private String externalOrderId;

    @Column(name = "order_amount", nullable = false, updatable = false, precision = 14, scale = 2)
    private BigDecimal orderAmount;

    @Column(name = "attributed", nullable = false, updatable = false)
    private boolean attributed;

    @Column(name = "attribution_confidence", nullable = false, updatable = false, precision = 5, scale = 4)
    private BigDecimal attributionConfidence;

    @Column(name = "baseline_revenue", nullable = false, updatable = false, precision = 14, scale = 2)
    private BigDecimal baselineRevenue;

    @Column(name = "incremental_revenue", nullable = false, updatable = false, precision = 14, scale = 2)
    private BigDecimal incrementalRevenue;

    @Column(name = "uplift_percentage", nullable = false, updatable = false, precision = 9, scale = 2)
    private BigDecimal upliftPercentage;

    @Column(name = "ad_spend_for_order", updatable = false, precision = 14, scale = 2)
    private BigDecimal adSpendForOrder;

    @Column(name = "baseline_ad_spend", nullable = false, updatable = false, precision = 14, scale = 2)
    private BigDecimal baselineAdSpend;

    @Column(name = "incremental_ad_spend", nullable = false, updatable = false, precision = 14, scale = 2)
    private BigDecimal incrementalAdSpend;

    @Column(name = "net_profit_uplift", nullable = false, updatable = false, precision = 14, scale = 2)
    private BigDecimal netProfitUplift;

    @Column(name = "fee_amount", nullable = false, updatable = false, precision = 14, scale = 2)
    private BigDecimal feeAmount;

    @Column(name = "fee_applicable", nullable = false, updatable = false)
    private boolean feeApplicable;

    @Convert(converter = AgentListConverter.class)
    @Column(name = "contributing_agents", nullable = false, updatable = false)
    private List<Agent> contributingAgents;

    @Column(name = "explanation", nullable = false, updatable = false, length = 4000)
    private String explanation;

    @Column(name = "campaign_id", updatable = false, length = 128)
    private String campaignId;

    @Column(name = "creative_id", updatable = false, length = 128)
    private String creativeId;

    @Column(name = "touchpoint_id", updatable = false, length = 128)
    private String touchpointId;

    /** Set once by {@link LedgerStore#assignInvoice}. */
    @Column(name = "invoice_id", updatable = false)
    private UUID invoiceId;

    @Column(name = "anonymized_at", updatable = false)
    private Instant anonymizedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    static LedgerEntryEntity fromDomain(LedgerEntry entry) {
        return new LedgerEntryEntity(
            null, // assigned by the database identity column
            entry.getEntryHash(),
            entry.getPreviousHash(),
            entry.getClientId(),
            entry.getPlatform(),
            entry.getInternalOrderId(),
            entry.getExternalOrderId(),
            entry.getOrderAmount(),
            entry.isAttributed(),
            entry.getAttributionConfidence(),
            entry.getBaselineRevenue(),
            entry.getIncrementalRevenue(),
            entry.getUpliftPercentage(),
            entry.getAdSpendForOrder(),
            entry.getBaselineAdSpend(),
            entry.getIncrementalAdSpend(),
            entry.getNetProfitUplift(),
            entry.getFeeAmount(),
            entry.isFeeApplicable(),
            List.copyOf(entry.getContributingAgents()),
            entry.getExplanation(),
            entry.getCampaignId(),
            entry.getCreativeId(),
            entry.getTouchpointId(),
            null, // not invoiced yet
            null, // not anonymized
            entry.getCreatedAt()
        );
    }

    public LedgerEntry toDomain() {
        return LedgerEntry.builder()
            .sequence(id)
            .entryHash(entryHash)
            .previousHash(previousHash)
            .clientId(clientId)
            .platform(platform)
            .internalOrderId(internalOrderId)
            .externalOrderId(externalOrderId)
            .orderAmount(orderAmount)
            .attributed(attributed)
            .attributionConfidence(attributionConfidence)
            .baselineRevenue(baselineRevenue)
            .incrementalRevenue(incrementalRevenue)
            .upliftPercentage(upliftPercentage)
            .adSpendForOrder(adSpendForOrder)
            .baselineAdSpend(baselineAdSpend)
            .incrementalAdSpend(incrementalAdSpend)
            .netProfitUplift(netProfitUplift)
            .feeAmount(feeAmount)
            .feeApplicable(feeApplicable)
            .contributingAgents(contributingAgents)
            .explanation(explanation)
            .campaignId(campaignId)
            .creativeId(creativeId)
            .touchpointId(touchpointId)
            .invoiceId(invoiceId)
            .anonymizedAt(anonymizedAt)
            .createdAt(createdAt)
            .build();
    }
}
