package com.flagship.revenue_ledger.settlement;

import com.flagship.revenue_ledger.baseline.BaselineSnapshot;
import com.flagship.revenue_ledger.ledger.DateRange;
import com.flagship.revenue_ledger.ledger.LedgerStore;
import com.flagship.revenue_ledger.ledger.ReportedAdSpend;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Default provider: sums the per-order ad spend recorded on the ledger entries of
 * the period against the per-order baselines stored on those same entries. Orders
 * recorded without a spend are left out of both sums. A {@code @Primary}
 * {@link AdSpendProvider} bean takes its place.
 */
@Component
public class LedgerAdSpendProvider implements AdSpendProvider {

    private final LedgerStore ledgerStore;

    public LedgerAdSpendProvider(LedgerStore ledgerStore) {
        this.ledgerStore = ledgerStore;
    }

    @Override
    public Optional<PeriodAdSpend> adSpend(String clientId, DateRange period, BaselineSnapshot baseline) {
        ReportedAdSpend reported = ledgerStore.sumReportedAdSpend(clientId, period);
        if (reported.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(PeriodAdSpend.reportedOrders(
                (int) reported.getOrders(), reported.getAdSpend(), reported.getBaselineAdSpend()));
    }
}
