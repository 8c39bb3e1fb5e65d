package com.flagship.revenue_ledger.baseline;

import java.math.BigDecimal;

/**
 * Reliability tier of a baseline, derived from how much history it was computed from.
 */
public enum DataQuality {
    HIGH,
    MEDIUM,
    LOW;

    private static final int LOW_SAMPLE_SIZE = 10;
    private static final int LOW_PERIOD_DAYS = 30;
    private static final int MEDIUM_SAMPLE_SIZE = 30;
    private static final int MEDIUM_PERIOD_DAYS = 90;
    private static final BigDecimal MEDIUM_VARIANCE = new BigDecimal("0.50");

    /**
     * {@code LOW} if fewer than 10 samples or under 30 days of history;
     * {@code MEDIUM} if fewer than 30 samples, under 90 days, or revenue variance above 0.50;
     * {@code HIGH} otherwise.
     */
    public static DataQuality assess(int sampleSize, int periodDays, BigDecimal revenueVariance) {
        if (sampleSize < LOW_SAMPLE_SIZE || periodDays < LOW_PERIOD_DAYS) {
            return LOW;
        }
        if (sampleSize < MEDIUM_SAMPLE_SIZE
                || periodDays < MEDIUM_PERIOD_DAYS
                || (revenueVariance != null && revenueVariance.compareTo(MEDIUM_VARIANCE) > 0)) {
            return MEDIUM;
        }
        return HIGH;
    }
}
