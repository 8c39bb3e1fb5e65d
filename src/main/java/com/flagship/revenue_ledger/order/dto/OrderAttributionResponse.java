package com.flagship.revenue_ledger.order.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.revenue_ledger.attribution.Agent;
import com.flagship.revenue_ledger.ledger.AttributionLog;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

/**
 * "Why was this order charged?" view: the ledger entry plus its attribution log.
 */
@Value
@Builder
public class OrderAttributionResponse {

    @JsonProperty("entry")
    AttributionResult entry;

    @JsonProperty("attribution_log")
    LogDetail attributionLog;

    @Value
    @Builder
    public static class LogDetail {

        @JsonProperty("decision_engine")
        String decisionEngine;

        @JsonProperty("signal_scores")
        Map<String, BigDecimal> signalScores;

        @JsonProperty("final_confidence")
        BigDecimal finalConfidence;

        @JsonProperty("threshold_applied")
        BigDecimal thresholdApplied;

        @JsonProperty("agent_shares")
        Map<Agent, BigDecimal> agentShares;

        @JsonProperty("counterfactual_revenue")
        BigDecimal counterfactualRevenue;

        @JsonProperty("explanation")
        String explanation;

        @JsonProperty("attributed_by")
        String attributedBy;

        @JsonProperty("created_at")
        Instant createdAt;

        public static LogDetail from(AttributionLog log) {
            return LogDetail.builder()
                .decisionEngine(log.getDecisionEngine())
                .signalScores(log.getSignalScores().toWire())
                .finalConfidence(log.getFinalConfidence())
                .thresholdApplied(log.getThresholdApplied())
                .agentShares(log.getAgentShares())
                .counterfactualRevenue(log.getCounterfactualRevenue())
                .explanation(log.getExplanation())
                .attributedBy(log.getAttributedBy())
                .createdAt(log.getCreatedAt())
                .build();
        }
    }
}
