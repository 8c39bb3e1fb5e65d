package com.flagship.revenue_ledger.ledger;

import com.flagship.revenue_ledger.attribution.Agent;
import com.flagship.revenue_ledger.attribution.SignalScores;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

/**
 * Explainability detail written together with its {@link LedgerEntry}.
 */
@Value
@Builder
public class AttributionLog {
    Long id;
    Long ledgerEntrySequence;
    String clientId;
    String decisionEngine;
    SignalScores signalScores;
    BigDecimal finalConfidence;
    BigDecimal thresholdApplied;
    Map<Agent, BigDecimal> agentShares;
    BigDecimal counterfactualRevenue;
    String explanation;
    String attributedBy;
    Instant createdAt;
}
