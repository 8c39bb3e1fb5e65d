package com.flagship.revenue_ledger.attribution;

/**
 * Platform agents an attributed order can be credited to.
 */
public enum Agent {
    BID_OPTIMIZER("Bid Optimizer"),
    LTV_TARGETING("LTV Targeting"),
    CREATIVE_STUDIO("Creative Studio"),
    NURTURE_FLOWS("Nurture Flows"),

    /** Generic label used when no individual signal clears its cutoff. */
    PLATFORM("Platform");

    private final String label;

    Agent(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
