package com.flagship.revenue_ledger.uplift;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Outcome of one net-profit uplift computation, either for a single order or for a
 * billing period. All currency values carry scale 2.
 */
@Value
public class UpliftResult {
    BigDecimal incrementalRevenue;
    BigDecimal incrementalAdSpend;
    BigDecimal netProfitUplift;
    BigDecimal feePercentage;
    BigDecimal feeAmount;
    boolean feeApplicable;

    /**
     * True when the zero-risk floor had to override the arithmetic result.
     */
    boolean clamped;

    public BigDecimal getClientNetGain() {
        return netProfitUplift.subtract(feeAmount);
    }

    public BigDecimal getClientRoi() {
        return UpliftCalculator.roi(netProfitUplift, feeAmount);
    }
}
