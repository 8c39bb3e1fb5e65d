package com.flagship.revenue_ledger.attribution;

import com.flagship.revenue_ledger.uplift.UpliftCalculator;
import com.flagship.revenue_ledger.uplift.UpliftResult;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Decides whether a single order is attributed to the platform and prices it.
 *
 * Evaluation order:
 * 1. confidence below the threshold: not attributed, terminal
 * 2. {@code incremental = orderAmount - baselineAvgOrderValue}; not positive: not attributed, terminal
 * 3. otherwise attributed; uplift percentage, contributing agents, per-order net
 *    profit uplift and fee are computed and an explanation is rendered
 *
 * Stateless. Identical inputs always produce identical decisions, including the
 * explanation text.
 */
@Component
public class AttributionDecisionEngine {

    private static final int SHARE_SCALE = 4;

    public AttributionDecision decide(AttributionInput input) {
        BigDecimal confidence = input.getConfidence();
        BigDecimal threshold = input.getConfidenceThreshold();

        AttributionDecision.AttributionDecisionBuilder decision = AttributionDecision.builder()
                .orderAmount(input.getOrderAmount())
                .confidence(confidence)
                .thresholdApplied(threshold)
                .baselineRevenue(input.getBaselineAvgOrderValue())
                .adSpendForOrder(input.getAdSpendForOrder())
                .baselineAdSpend(UpliftCalculator.currency(input.getBaselineAdSpendPerOrder()))
                .feePercentage(input.getFeePercentage())
                .signalScores(input.getSignalScores())
                .upliftPercentage(BigDecimal.ZERO.setScale(UpliftCalculator.PERCENT_SCALE))
                .incrementalAdSpend(UpliftCalculator.ZERO)
                .netProfitUplift(UpliftCalculator.ZERO)
                .feeAmount(UpliftCalculator.ZERO)
                .feeApplicable(false)
                .attributed(false)
                .counterfactualRevenue(input.getOrderAmount());

        if (confidence.compareTo(threshold) < 0) {
            return decision
                    .outcome(AttributionOutcome.BELOW_THRESHOLD)
                    .incrementalRevenue(UpliftCalculator.ZERO)
                    .explanation(ExplanationBuilder.belowThreshold(confidence, threshold))
                    .build();
        }

        BigDecimal incremental = UpliftCalculator.currency(
                input.getOrderAmount().subtract(input.getBaselineAvgOrderValue()));
        decision.incrementalRevenue(incremental);

        if (incremental.signum() <= 0) {
            return decision
                    .outcome(AttributionOutcome.BELOW_BASELINE)
                    .explanation(ExplanationBuilder.belowBaseline(
                            input.getOrderAmount(), input.getBaselineAvgOrderValue()))
                    .build();
        }

        BigDecimal upliftPct = UpliftCalculator.upliftPercentage(incremental, input.getBaselineAvgOrderValue());
        UpliftResult uplift = UpliftCalculator.perOrder(
                incremental,
                input.getAdSpendForOrder(),
                input.getBaselineAdSpendPerOrder(),
                input.getFeePercentage());

        List<SignalKind> causes = qualifyingSignals(input.getSignalScores());
        applyAgents(decision, causes, input.getSignalScores());

        return decision
                .outcome(AttributionOutcome.ATTRIBUTED)
                .attributed(true)
                .upliftPercentage(upliftPct)
                .incrementalAdSpend(uplift.getIncrementalAdSpend())
                .netProfitUplift(uplift.getNetProfitUplift())
                .feeAmount(uplift.getFeeAmount())
                .feeApplicable(uplift.isFeeApplicable())
                .zeroRiskClamped(uplift.isClamped())
                .counterfactualRevenue(input.getBaselineAvgOrderValue())
                .explanation(ExplanationBuilder.attributed(
                        causes,
                        confidence,
                        input.getOrderAmount(),
                        input.getBaselineAvgOrderValue(),
                        incremental,
                        upliftPct,
                        uplift.getNetProfitUplift(),
                        uplift.getFeeAmount()))
                .build();
    }

    static List<SignalKind> qualifyingSignals(SignalScores scores) {
        List<SignalKind> qualifying = new ArrayList<>();
        for (SignalKind kind : SignalKind.values()) {
            if (scores.qualifies(kind)) {
                qualifying.add(kind);
            }
        }
        return qualifying;
    }

    private void applyAgents(AttributionDecision.AttributionDecisionBuilder decision,
                             List<SignalKind> causes,
                             SignalScores scores) {
        if (causes.isEmpty()) {
            decision.agent(Agent.PLATFORM);
            decision.agentShare(Agent.PLATFORM, BigDecimal.ONE.setScale(SHARE_SCALE));
            return;
        }

        BigDecimal total = causes.stream()
                .map(scores::get)
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        for (SignalKind kind : causes) {
            decision.agent(kind.getAgent());
            decision.agentShare(kind.getAgent(),
                    scores.get(kind).divide(total, SHARE_SCALE, RoundingMode.HALF_EVEN));
        }
    }
}
