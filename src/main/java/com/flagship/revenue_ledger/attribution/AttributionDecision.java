package com.flagship.revenue_ledger.attribution;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Result of evaluating one order. Immutable and fully determined by its
 * {@link AttributionInput}.
 */
@Value
@Builder
public class AttributionDecision {
    AttributionOutcome outcome;
    boolean attributed;
    boolean feeApplicable;

    BigDecimal orderAmount;
    BigDecimal confidence;
    BigDecimal thresholdApplied;

    /** Baseline average order value the order was compared against. */
    BigDecimal baselineRevenue;
    BigDecimal incrementalRevenue;
    BigDecimal upliftPercentage;

    BigDecimal adSpendForOrder;
    BigDecimal baselineAdSpend;
    BigDecimal incrementalAdSpend;
    BigDecimal netProfitUplift;

    BigDecimal feePercentage;
    BigDecimal feeAmount;
    boolean zeroRiskClamped;

    @Singular
    List<Agent> agents;

    /** Share of credit per agent, summing to 1 over the agents whose signal qualified. */
    @Singular
    Map<Agent, BigDecimal> agentShares;

    /** Revenue the order would have produced without intervention. */
    BigDecimal counterfactualRevenue;

    SignalScores signalScores;
    String explanation;
}
