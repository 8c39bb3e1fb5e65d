package com.flagship.revenue_ledger.uplift;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Net-profit uplift and performance fee arithmetic.
 *
 * The same rule applies per order and per billing period:
 * <pre>
 *   netProfitUplift = incrementalRevenue - incrementalAdSpend
 *   fee             = netProfitUplift > 0 ? round_half_even(netProfitUplift * feePct, 2) : 0.00
 * </pre>
 * followed by {@link #applyZeroRiskFloor}, which runs after every formula and forces
 * the fee to exactly 0.00 when the uplift is not positive or the computed value is
 * negative.
 *
 * Pure functions over {@link BigDecimal}; no state, no clock.
 */
public final class UpliftCalculator {

    public static final int CURRENCY_SCALE = 2;
    public static final int PERCENT_SCALE = 2;
    public static final RoundingMode ROUNDING = RoundingMode.HALF_EVEN;

    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(CURRENCY_SCALE);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private UpliftCalculator() {
    }

    /**
     * Per-order uplift.
     *
     * @param incrementalRevenue       order amount minus the baseline average order value
     * @param adSpendForOrder          acquisition cost reported for this order, or null when unknown
     * @param baselineAdSpendPerOrder  historical ad spend per order
     * @param feePercentage            client fee percentage in (0, 1]
     */
    public static UpliftResult perOrder(BigDecimal incrementalRevenue,
                                        BigDecimal adSpendForOrder,
                                        BigDecimal baselineAdSpendPerOrder,
                                        BigDecimal feePercentage) {
        BigDecimal incrementalAdSpend = adSpendForOrder == null
                ? ZERO
                : currency(adSpendForOrder.subtract(baselineAdSpendPerOrder));
        return compute(currency(incrementalRevenue), incrementalAdSpend, feePercentage);
    }

    /**
     * Per-period uplift for a settlement.
     */
    public static UpliftResult perPeriod(BigDecimal actualRevenue,
                                         BigDecimal baselineRevenue,
                                         BigDecimal actualAdSpend,
                                         BigDecimal baselineAdSpend,
                                         BigDecimal feePercentage) {
        BigDecimal incrementalRevenue = currency(actualRevenue.subtract(baselineRevenue));
        BigDecimal incrementalAdSpend = currency(actualAdSpend.subtract(baselineAdSpend));
        return compute(incrementalRevenue, incrementalAdSpend, feePercentage);
    }

    /**
     * Result for a period in which nothing may be charged (e.g. no attributed orders).
     * The uplift figures are still reported, the fee is not.
     */
    public static UpliftResult withoutFee(UpliftResult computed) {
        return new UpliftResult(
                computed.getIncrementalRevenue(),
                computed.getIncrementalAdSpend(),
                computed.getNetProfitUplift(),
                computed.getFeePercentage(),
                ZERO,
                false,
                computed.isClamped()
        );
    }

    private static UpliftResult compute(BigDecimal incrementalRevenue,
                                        BigDecimal incrementalAdSpend,
                                        BigDecimal feePercentage) {
        requireFeePercentage(feePercentage);

        BigDecimal netProfitUplift = currency(incrementalRevenue.subtract(incrementalAdSpend));
        BigDecimal computedFee = fee(netProfitUplift, feePercentage);
        BigDecimal finalFee = applyZeroRiskFloor(netProfitUplift, computedFee);

        return new UpliftResult(
                incrementalRevenue,
                incrementalAdSpend,
                netProfitUplift,
                feePercentage,
                finalFee,
                netProfitUplift.signum() > 0,
                finalFee.compareTo(computedFee) != 0
        );
    }

    /**
     * {@code round_half_even(netProfitUplift * feePercentage, 2)} when the uplift is
     * positive, otherwise 0.00.
     */
    public static BigDecimal fee(BigDecimal netProfitUplift, BigDecimal feePercentage) {
        if (netProfitUplift.signum() <= 0) {
            return ZERO;
        }
        return netProfitUplift.multiply(feePercentage).setScale(CURRENCY_SCALE, ROUNDING);
    }

    /**
     * Final clamp. Independent of how {@code computedFee} was produced: a non-positive
     * uplift or a negative fee always yields exactly 0.00.
     */
    public static BigDecimal applyZeroRiskFloor(BigDecimal netProfitUplift, BigDecimal computedFee) {
        if (netProfitUplift == null || netProfitUplift.signum() <= 0) {
            return ZERO;
        }
        if (computedFee == null || computedFee.signum() < 0) {
            return ZERO;
        }
        return computedFee.setScale(CURRENCY_SCALE, ROUNDING);
    }

    /**
     * Client ROI in percent: {@code (net - fee) / fee * 100}, or 0 when no fee was charged.
     */
    public static BigDecimal roi(BigDecimal netProfitUplift, BigDecimal feeAmount) {
        if (feeAmount.signum() <= 0) {
            return BigDecimal.ZERO.setScale(PERCENT_SCALE);
        }
        return netProfitUplift.subtract(feeAmount)
                .multiply(HUNDRED)
                .divide(feeAmount, PERCENT_SCALE, ROUNDING);
    }

    /**
     * {@code incremental / base * 100}, or 0 when the base is not positive.
     */
    public static BigDecimal upliftPercentage(BigDecimal incremental, BigDecimal base) {
        if (base == null || base.signum() <= 0) {
            return BigDecimal.ZERO.setScale(PERCENT_SCALE);
        }
        return incremental.multiply(HUNDRED).divide(base, PERCENT_SCALE, ROUNDING);
    }

    public static BigDecimal currency(BigDecimal value) {
        return value.setScale(CURRENCY_SCALE, ROUNDING);
    }

    private static void requireFeePercentage(BigDecimal feePercentage) {
        if (feePercentage == null
                || feePercentage.signum() <= 0
                || feePercentage.compareTo(BigDecimal.ONE) > 0) {
            throw new IllegalArgumentException("Fee percentage must be in (0, 1], got " + feePercentage);
        }
    }
}
