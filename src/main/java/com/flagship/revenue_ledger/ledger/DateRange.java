package com.flagship.revenue_ledger.ledger;

import com.flagship.revenue_ledger.exception.ValidationException;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneOffset;

/**
 * Half-open UTC interval {@code [from, to)} over entry creation time.
 */
@Value
public class DateRange {

    private static final Instant OPEN_START = Instant.parse("1970-01-01T00:00:00Z");
    private static final Instant OPEN_END = Instant.parse("9999-12-31T00:00:00Z");

    Instant from;
    Instant to;

    public static DateRange of(Instant from, Instant to) {
        Instant start = from == null ? OPEN_START : from;
        Instant end = to == null ? OPEN_END : to;
        if (!end.isAfter(start)) {
            throw new ValidationException("dateRange", "Range end must be after its start");
        }
        return new DateRange(start, end);
    }

    /**
     * Calendar dates, both inclusive, either may be null for an open bound.
     */
    public static DateRange ofDates(LocalDate fromInclusive, LocalDate toInclusive) {
        return of(
            fromInclusive == null ? null : fromInclusive.atStartOfDay(ZoneOffset.UTC).toInstant(),
            toInclusive == null ? null : toInclusive.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant()
        );
    }

    public static DateRange ofMonth(YearMonth month) {
        return of(
            month.atDay(1).atStartOfDay(ZoneOffset.UTC).toInstant(),
            month.plusMonths(1).atDay(1).atStartOfDay(ZoneOffset.UTC).toInstant()
        );
    }

    public static DateRange all() {
        return new DateRange(OPEN_START, OPEN_END);
    }
}
