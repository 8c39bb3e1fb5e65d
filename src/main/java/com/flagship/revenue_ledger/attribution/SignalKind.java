package com.flagship.revenue_ledger.attribution;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Optional;

/**
 * Closed set of evidence signals supplied with an order.
 *
 * Declaration order is the order in which causes appear in explanations, so it must
 * not be changed without replaying historical explanations.
 */
public enum SignalKind {
    AD_TOUCHPOINT("ad_touchpoint", new BigDecimal("0.30"), Agent.BID_OPTIMIZER,
            "Customer interacted with a platform-managed ad campaign"),
    ACQUISITION("acquisition", new BigDecimal("0.40"), Agent.LTV_TARGETING,
            "New customer acquired via platform-optimized targeting"),
    PRODUCT_PROMOTION("product_promotion", new BigDecimal("0.30"), Agent.CREATIVE_STUDIO,
            "Purchased product promoted by platform-generated creatives"),
    NURTURE_ENGAGEMENT("nurture_engagement", new BigDecimal("0.30"), Agent.NURTURE_FLOWS,
            "Re-engaged through a platform nurture flow");

    private final String key;
    private final BigDecimal cutoff;
    private final Agent agent;
    private final String cause;

    SignalKind(String key, BigDecimal cutoff, Agent agent, String cause) {
        this.key = key;
        this.cutoff = cutoff;
        this.agent = agent;
        this.cause = cause;
    }

    /** Wire name, e.g. {@code ad_touchpoint}. */
    public String getKey() {
        return key;
    }

    public BigDecimal getCutoff() {
        return cutoff;
    }

    public Agent getAgent() {
        return agent;
    }

    public String getCause() {
        return cause;
    }

    public boolean qualifies(BigDecimal score) {
        return score != null && score.compareTo(cutoff) >= 0;
    }

    public static Optional<SignalKind> fromKey(String key) {
        return Arrays.stream(values())
                .filter(kind -> kind.key.equals(key))
                .findFirst();
    }
}
