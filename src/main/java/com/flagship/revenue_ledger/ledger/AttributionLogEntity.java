package com.flagship.revenue_ledger.ledger;

import com.flagship.revenue_ledger.attribution.Agent;
import com.flagship.revenue_ledger.attribution.SignalKind;
import com.flagship.revenue_ledger.attribution.SignalScores;
import jakarta.persistence.Column;
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
import java.util.EnumMap;
import java.util.Map;

/**
 * JPA entity for {@link AttributionLog}. Signals and agent shares are flattened into
 * one column each; the closed enumerations keep the table shape fixed.
 */
@Entity
@Table(name = "attribution_logs")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AttributionLogEntity {

    private static final BigDecimal NO_SHARE = BigDecimal.ZERO.setScale(4);

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "ledger_entry_id", nullable = false, updatable = false, unique = true)
    private Long ledgerEntryId;

    @Column(name = "client_id", nullable = false, updatable = false, length = 64)
    private String clientId;

    @Column(name = "decision_engine", nullable = false, updatable = false, length = 64)
    private String decisionEngine;

    @Column(name = "ad_touchpoint_score", nullable = false, updatable = false, precision = 5, scale = 4)
    private BigDecimal adTouchpointScore;

    @Column(name = "acquisition_score", nullable = false, updatable = false, precision = 5, scale = 4)
    private BigDecimal acquisitionScore;

    @Column(name = "product_promotion_score", nullable = false, updatable = false, precision = 5, scale = 4)
    private BigDecimal productPromotionScore;

    @Column(name = "nurture_engagement_score", nullable = false, updatable = false, precision = 5, scale = 4)
    private BigDecimal nurtureEngagementScore;

    @Column(name = "final_confidence", nullable = false, updatable = false, precision = 5, scale = 4)
    private BigDecimal finalConfidence;

    @Column(name = "threshold_applied", nullable = false, updatable = false, precision = 5, scale = 4)
    private BigDecimal thresholdApplied;

    @Column(name = "bid_optimizer_share", nullable = false, updatable = false, precision = 5, scale = 4)
    private BigDecimal bidOptimizerShare;

    @Column(name = "ltv_targeting_share", nullable = false, updatable = false, precision = 5, scale = 4)
    private BigDecimal ltvTargetingShare;

    @Column(name = "creative_studio_share", nullable = false, updatable = false, precision = 5, scale = 4)
    private BigDecimal creativeStudioShare;

    @Column(name = "nurture_flows_share", nullable = false, updatable = false, precision = 5, scale = 4)
    private BigDecimal nurtureFlowsShare;

    @Column(name = "counterfactual_revenue", nullable = false, updatable = false, precision = 14, scale = 2)
    private BigDecimal counterfactualRevenue;

    @Column(name = "explanation", nullable = false, updatable = false, length = 4000)
    private String explanation;

    @Column(name = "attributed_by", nullable = false, updatable = false, length = 64)
    private String attributedBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    static AttributionLogEntity fromDomain(AttributionLog log, long ledgerEntryId) {
        SignalScores scores = log.getSignalScores();
        Map<Agent, BigDecimal> shares = log.getAgentShares();
        return new AttributionLogEntity(
            null,
            ledgerEntryId,
            log.getClientId(),
            log.getDecisionEngine(),
            scores.get(SignalKind.AD_TOUCHPOINT),
            scores.get(SignalKind.ACQUISITION),
            scores.get(SignalKind.PRODUCT_PROMOTION),
            scores.get(SignalKind.NURTURE_ENGAGEMENT),
            log.getFinalConfidence(),
            log.getThresholdApplied(),
            shares.getOrDefault(Agent.BID_OPTIMIZER, NO_SHARE),
            shares.getOrDefault(Agent.LTV_TARGETING, NO_SHARE),
            shares.getOrDefault(Agent.CREATIVE_STUDIO, NO_SHARE),
            shares.getOrDefault(Agent.NURTURE_FLOWS, NO_SHARE),
            log.getCounterfactualRevenue(),
            log.getExplanation(),
            log.getAttributedBy(),
            log.getCreatedAt()
        );
    }

    public AttributionLog toDomain() {
        Map<SignalKind, BigDecimal> scores = new EnumMap<>(SignalKind.class);
        scores.put(SignalKind.AD_TOUCHPOINT, adTouchpointScore);
        scores.put(SignalKind.ACQUISITION, acquisitionScore);
        scores.put(SignalKind.PRODUCT_PROMOTION, productPromotionScore);
        scores.put(SignalKind.NURTURE_ENGAGEMENT, nurtureEngagementScore);

        Map<Agent, BigDecimal> shares = new EnumMap<>(Agent.class);
        putIfPositive(shares, Agent.BID_OPTIMIZER, bidOptimizerShare);
        putIfPositive(shares, Agent.LTV_TARGETING, ltvTargetingShare);
        putIfPositive(shares, Agent.CREATIVE_STUDIO, creativeStudioShare);
        putIfPositive(shares, Agent.NURTURE_FLOWS, nurtureFlowsShare);

        return AttributionLog.builder()
            .id(id)
            .ledgerEntrySequence(ledgerEntryId)
            .clientId(clientId)
            .decisionEngine(decisionEngine)
            .signalScores(SignalScores.of(scores))
            .finalConfidence(finalConfidence)
            .thresholdApplied(thresholdApplied)
            .agentShares(shares)
            .counterfactualRevenue(counterfactualRevenue)
            .explanation(explanation)
            .attributedBy(attributedBy)
            .createdAt(createdAt)
            .build();
    }

    private static void putIfPositive(Map<Agent, BigDecimal> shares, Agent agent, BigDecimal share) {
        if (share != null && share.signum() > 0) {
            shares.put(agent, share);
        }
    }
}
