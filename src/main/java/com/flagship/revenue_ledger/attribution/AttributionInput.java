package com.flagship.revenue_ledger.attribution;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Everything the decision engine needs for one order. Values are already validated.
 */
@Value
@Builder
public class AttributionInput {
    @NonNull BigDecimal orderAmount;
    @NonNull BigDecimal baselineAvgOrderValue;
    @NonNull BigDecimal confidence;
    @NonNull BigDecimal confidenceThreshold;
    @NonNull SignalScores signalScores;
    @NonNull BigDecimal feePercentage;

    /** Acquisition cost reported for the order; null when the order is evaluated pre-ad-spend. */
    BigDecimal adSpendForOrder;

    @NonNull BigDecimal baselineAdSpendPerOrder;
}
