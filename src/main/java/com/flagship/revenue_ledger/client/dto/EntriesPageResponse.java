package com.flagship.revenue_ledger.client.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.revenue_ledger.ledger.LedgerPage;
import com.flagship.revenue_ledger.order.dto.AttributionResult;
import lombok.Value;

import java.util.List;

/**
 * One page of ledger entries. Pass {@code next_cursor} as {@code after} for the
 * next page; it is absent on the last one.
 */
@Value
public class EntriesPageResponse {

    @JsonProperty("entries")
    List<AttributionResult> entries;

    @JsonProperty("next_cursor")
    Long nextCursor;

    public static EntriesPageResponse from(LedgerPage page) {
        return new EntriesPageResponse(
                page.getEntries().stream().map(AttributionResult::from).toList(),
                page.getNextCursor());
    }
}
