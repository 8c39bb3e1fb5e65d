package com.flagship.revenue_ledger.ledger;

import lombok.Value;

import java.util.List;

/**
 * One page of a {@link LedgerStore#query} scan. Pass {@code nextCursor} back as
 * {@code afterSequence} to continue; it is null on the last page.
 */
@Value
public class LedgerPage {
    List<LedgerEntry> entries;
    Long nextCursor;

    public boolean hasMore() {
        return nextCursor != null;
    }
}
