package com.flagship.revenue_ledger.settlement;

import com.flagship.revenue_ledger.uplift.UpliftResult;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.YearMonth;

/**
 * Deterministic invoice text. Same figures, same text.
 */
final class InvoiceExplanation {

    private InvoiceExplanation() {
    }

    static String render(YearMonth period,
                         int ordersReviewed,
                         int ordersAttributed,
                         int highConfidenceOrders,
                         BigDecimal actualRevenue,
                         BigDecimal baselineRevenue,
                         BigDecimal upliftPercentage,
                         PeriodAdSpend adSpend,
                         UpliftResult uplift) {
        StringBuilder text = new StringBuilder();
        text.append("Settlement for ").append(period).append(": ")
                .append(ordersReviewed).append(" orders reviewed, ")
                .append(ordersAttributed).append(" attributed (")
                .append(highConfidenceOrders).append(" high confidence).");

        text.append(" Revenue ").append(money(actualRevenue))
                .append(" against baseline ").append(money(baselineRevenue))
                .append(": incremental revenue ").append(money(uplift.getIncrementalRevenue()))
                .append(" (").append(upliftPercentage.setScale(2, RoundingMode.HALF_EVEN).toPlainString())
                .append("% uplift).");

        if (adSpend == null) {
            text.append(" No ad spend reported for the period; evaluated on revenue only.");
        } else {
            text.append(" Ad spend ").append(money(adSpend.getActualAdSpend()));
            if (adSpend.getCoverage() == PeriodAdSpend.Coverage.REPORTED_ORDERS) {
                text.append(" reported on ").append(adSpend.getOrdersCovered()).append(" orders");
            }
            text.append(" against baseline ").append(money(adSpend.getBaselineAdSpend()))
                    .append(": incremental ad spend ").append(money(uplift.getIncrementalAdSpend())).append('.');
        }

        text.append(" Net profit uplift: ").append(money(uplift.getNetProfitUplift())).append('.');

        if (ordersAttributed == 0) {
            text.append(" No orders attributed to the platform; no fee charged.");
        } else if (uplift.getFeeAmount().signum() == 0) {
            text.append(" Zero-risk policy: net profit uplift not positive, no fee charged.");
        } else {
            text.append(" Performance fee (")
                    .append(uplift.getFeePercentage().movePointRight(2).setScale(2, RoundingMode.HALF_EVEN).toPlainString())
                    .append("% of net profit uplift): ").append(money(uplift.getFeeAmount()))
                    .append(". Client net gain: ").append(money(uplift.getClientNetGain()))
                    .append(" (ROI ").append(uplift.getClientRoi().toPlainString()).append("%).");
        }
        return text.toString();
    }

    private static String money(BigDecimal amount) {
        BigDecimal scaled = amount.setScale(2, RoundingMode.HALF_EVEN);
        return scaled.signum() < 0
                ? "-$" + scaled.negate().toPlainString()
                : "$" + scaled.toPlainString();
    }
}
