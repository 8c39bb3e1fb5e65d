package com.flagship.revenue_ledger.settlement;

import com.flagship.revenue_ledger.baseline.BaselineSnapshot;
import com.flagship.revenue_ledger.uplift.UpliftCalculator;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Ad spend of a billing period paired with the baseline spend it is compared to.
 * Both figures always cover the same orders: either every order of the period, or
 * only the orders that reported a spend.
 */
@Value
public class PeriodAdSpend {

    public enum Coverage {
        /** Spend for the whole period; compared to the full monthly baseline. */
        FULL_PERIOD,
        /** Spend reported on individual orders; compared to their per-order baselines. */
        REPORTED_ORDERS
    }

    Coverage coverage;
    int ordersCovered;
    BigDecimal actualAdSpend;
    BigDecimal baselineAdSpend;

    public static PeriodAdSpend fullPeriod(BigDecimal actualAdSpend, BaselineSnapshot baseline) {
        return new PeriodAdSpend(Coverage.FULL_PERIOD, 0,
                UpliftCalculator.currency(actualAdSpend),
                UpliftCalculator.currency(baseline.getBaselineAdSpend()));
    }

    public static PeriodAdSpend reportedOrders(int ordersCovered, BigDecimal actualAdSpend, BigDecimal baselineAdSpend) {
        return new PeriodAdSpend(Coverage.REPORTED_ORDERS, ordersCovered,
                UpliftCalculator.currency(actualAdSpend),
                UpliftCalculator.currency(baselineAdSpend));
    }
}
