package com.flagship.revenue_ledger.attribution;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Builds the human-readable explanation stored with every ledger entry.
 *
 * Output depends only on the arguments: numbers are rendered with
 * {@link BigDecimal#toPlainString()} at fixed scale, never through a locale-sensitive
 * formatter, so replaying an entry reproduces its text byte for byte.
 */
final class ExplanationBuilder {

    private ExplanationBuilder() {
    }

    static String belowThreshold(BigDecimal confidence, BigDecimal threshold) {
        return "Attribution confidence " + twoPlaces(confidence)
                + " below threshold " + twoPlaces(threshold)
                + ". Order not attributed; no fee charged.";
    }

    static String belowBaseline(BigDecimal orderAmount, BigDecimal baselineAvgOrderValue) {
        return "Order value " + money(orderAmount)
                + " below baseline " + money(baselineAvgOrderValue)
                + " (negative uplift). Order not attributed; no fee charged.";
    }

    static String attributed(List<SignalKind> causes,
                             BigDecimal confidence,
                             BigDecimal orderAmount,
                             BigDecimal baselineAvgOrderValue,
                             BigDecimal incrementalRevenue,
                             BigDecimal upliftPercentage,
                             BigDecimal netProfitUplift,
                             BigDecimal feeAmount) {
        StringBuilder text = new StringBuilder();
        if (causes.isEmpty()) {
            text.append("Attributed to ").append(Agent.PLATFORM.getLabel())
                    .append(" with ").append(percent(confidence)).append(" confidence. ")
                    .append("Order value ").append(money(orderAmount))
                    .append(" exceeded baseline ").append(money(baselineAvgOrderValue))
                    .append(" by ").append(money(incrementalRevenue)).append('.');
        } else {
            text.append(joinCauses(causes)).append('.');
        }
        text.append(" Incremental revenue: ").append(money(incrementalRevenue))
                .append(" (").append(twoPlaces(upliftPercentage)).append("% uplift).")
                .append(" Net profit uplift: ").append(money(netProfitUplift)).append('.');
        if (netProfitUplift.signum() <= 0) {
            text.append(" Zero-risk policy: net profit uplift not positive, no fee charged.");
        } else {
            text.append(" Performance fee: ").append(money(feeAmount)).append('.');
        }
        return text.toString();
    }

    /**
     * "A", "A and B", "A, B, and C".
     */
    static String joinCauses(List<SignalKind> causes) {
        int size = causes.size();
        if (size == 1) {
            return causes.get(0).getCause();
        }
        if (size == 2) {
            return causes.get(0).getCause() + " and " + causes.get(1).getCause();
        }
        StringBuilder joined = new StringBuilder();
        for (int i = 0; i < size - 1; i++) {
            joined.append(causes.get(i).getCause()).append(", ");
        }
        return joined.append("and ").append(causes.get(size - 1).getCause()).toString();
    }

    static String money(BigDecimal amount) {
        BigDecimal scaled = amount.setScale(2, RoundingMode.HALF_EVEN);
        return scaled.signum() < 0
                ? "-$" + scaled.negate().toPlainString()
                : "$" + scaled.toPlainString();
    }

    static String twoPlaces(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_EVEN).toPlainString();
    }

    static String percent(BigDecimal fraction) {
        return fraction.movePointRight(2).setScale(0, RoundingMode.HALF_EVEN).toPlainString() + "%";
    }
}
