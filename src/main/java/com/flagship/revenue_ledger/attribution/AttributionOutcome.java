package com.flagship.revenue_ledger.attribution;

public enum AttributionOutcome {
    /** Confidence under the client's threshold; nothing else was computed. */
    BELOW_THRESHOLD,
    /** Order value did not exceed the baseline average order value. */
    BELOW_BASELINE,
    ATTRIBUTED
}
