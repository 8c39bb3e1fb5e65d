package com.flagship.revenue_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Ad spend recorded on the entries that carried one, next to the baseline spend of
 * those same entries. Entries without a reported spend count in neither sum.
 */
@Value
public class ReportedAdSpend {
    long orders;
    BigDecimal adSpend;
    BigDecimal baselineAdSpend;

    // JPQL constructor expression; SUM over no rows yields null.
    public ReportedAdSpend(Long orders, BigDecimal adSpend, BigDecimal baselineAdSpend) {
        this.orders = orders == null ? 0 : orders;
        this.adSpend = adSpend == null ? BigDecimal.ZERO : adSpend;
        this.baselineAdSpend = baselineAdSpend == null ? BigDecimal.ZERO : baselineAdSpend;
    }

    public boolean isEmpty() {
        return orders == 0;
    }
}
