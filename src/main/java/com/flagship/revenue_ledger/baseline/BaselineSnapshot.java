package com.flagship.revenue_ledger.baseline;

import com.flagship.revenue_ledger.uplift.UpliftCalculator;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;

/**
 * Per-client baseline: historical monthly averages plus running totals for the
 * current period. {@code version} increases with every write and guards the
 * additive counter updates.
 */
@Value
public class BaselineSnapshot {
    String clientId;
    String platform;

    BigDecimal baselineRevenue;
    int baselineOrderCount;
    BigDecimal baselineAvgOrderValue;
    BigDecimal baselineAdSpend;
    BigDecimal baselineProfit;

    BigDecimal currentRevenue;
    int currentOrderCount;
    BigDecimal currentAdSpend;

    BigDecimal totalIncrementalRevenue;
    BigDecimal totalIncrementalAdSpend;
    BigDecimal totalNetProfitUplift;
    BigDecimal totalFees;

    DataQuality dataQuality;
    Instant periodStartedAt;
    Instant lastSyncedAt;
    long version;

    /**
     * Historical ad spend per order, or 0.00 when the baseline has no orders.
     */
    public BigDecimal adSpendPerOrder() {
        if (baselineOrderCount <= 0) {
            return UpliftCalculator.ZERO;
        }
        return baselineAdSpend.divide(BigDecimal.valueOf(baselineOrderCount),
                UpliftCalculator.CURRENCY_SCALE, RoundingMode.HALF_EVEN);
    }

    public BigDecimal currentProfit() {
        return currentRevenue.subtract(currentAdSpend);
    }
}
