package com.flagship.revenue_ledger.settlement;

import com.flagship.revenue_ledger.baseline.BaselineSnapshot;
import com.flagship.revenue_ledger.ledger.DateRange;

import java.util.Optional;

/**
 * Ad spend of a client over a billing period, already normalized to one currency,
 * together with the baseline spend measured over the same orders. Empty when no
 * spend was reported for the period at all, which is different from a reported
 * spend of zero.
 *
 * A provider backed by the ad platform's own period totals should answer with
 * {@link PeriodAdSpend#fullPeriod}.
 */
public interface AdSpendProvider {

    Optional<PeriodAdSpend> adSpend(String clientId, DateRange period, BaselineSnapshot baseline);
}
