package com.flagship.revenue_ledger.baseline;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Historical figures written by the external baseline recalculation job.
 */
@Value
@Builder(toBuilder = true)
public class BaselineUpdate {
    String platform;
    BigDecimal baselineRevenue;
    int baselineOrderCount;

    /** Derived from revenue and order count when absent. */
    BigDecimal baselineAvgOrderValue;

    BigDecimal baselineAdSpend;
    int sampleSize;
    int periodDays;
    BigDecimal revenueVariance;

    /** Start a new measurement period: zero the current-period counters. */
    boolean resetCurrentPeriod;
}
