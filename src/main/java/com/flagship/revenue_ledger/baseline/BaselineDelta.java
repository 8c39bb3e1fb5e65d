package com.flagship.revenue_ledger.baseline;

import com.flagship.revenue_ledger.exception.ValidationException;
import com.flagship.revenue_ledger.uplift.UpliftCalculator;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Additive change to a baseline's running totals caused by one recorded order.
 *
 * Current-period counters only grow, so their deltas must be non-negative.
 * Cumulative incremental figures are only touched by attributed orders.
 */
@Value
@Builder
public class BaselineDelta {
    @Builder.Default BigDecimal revenue = UpliftCalculator.ZERO;
    @Builder.Default BigDecimal adSpend = UpliftCalculator.ZERO;
    @Builder.Default int orders = 0;

    @Builder.Default BigDecimal incrementalRevenue = UpliftCalculator.ZERO;
    @Builder.Default BigDecimal incrementalAdSpend = UpliftCalculator.ZERO;
    @Builder.Default BigDecimal netProfitUplift = UpliftCalculator.ZERO;
    @Builder.Default BigDecimal fees = UpliftCalculator.ZERO;

    public void validate() {
        if (revenue.signum() < 0 || adSpend.signum() < 0 || orders < 0) {
            throw new ValidationException("Current-period deltas must be non-negative");
        }
        if (fees.signum() < 0) {
            throw new ValidationException("Fee delta must be non-negative");
        }
    }
}
