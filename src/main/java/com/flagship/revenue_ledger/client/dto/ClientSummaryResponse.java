package com.flagship.revenue_ledger.client.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.revenue_ledger.baseline.DataQuality;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Dashboard view of one client: historical baseline, current period, cumulative
 * uplift and who the attributed orders were credited to.
 */
@Value
@Builder
public class ClientSummaryResponse {

    @JsonProperty("client_id")
    String clientId;

    @JsonProperty("platform")
    String platform;

    @JsonProperty("baseline")
    Baseline baseline;

    @JsonProperty("current")
    Current current;

    @JsonProperty("incremental")
    Incremental incremental;

    @JsonProperty("total_orders")
    long totalOrders;

    @JsonProperty("attributed_orders")
    long attributedOrders;

    /** Percent of recorded orders that were attributed. */
    @JsonProperty("attribution_rate")
    BigDecimal attributionRate;

    @JsonProperty("roi")
    BigDecimal roi;

    @JsonProperty("top_agents")
    List<AgentShare> topAgents;

    @JsonProperty("last_synced_at")
    Instant lastSyncedAt;

    @Value
    @Builder
    public static class Baseline {
        @JsonProperty("revenue")
        BigDecimal revenue;

        @JsonProperty("order_count")
        int orderCount;

        @JsonProperty("avg_order_value")
        BigDecimal avgOrderValue;

        @JsonProperty("ad_spend")
        BigDecimal adSpend;

        @JsonProperty("profit")
        BigDecimal profit;

        @JsonProperty("data_quality")
        DataQuality dataQuality;
    }

    @Value
    @Builder
    public static class Current {
        @JsonProperty("revenue")
        BigDecimal revenue;

        @JsonProperty("order_count")
        int orderCount;

        @JsonProperty("ad_spend")
        BigDecimal adSpend;

        @JsonProperty("profit")
        BigDecimal profit;

        @JsonProperty("uplift_percentage")
        BigDecimal upliftPercentage;

        @JsonProperty("period_started_at")
        Instant periodStartedAt;
    }

    @Value
    @Builder
    public static class Incremental {
        @JsonProperty("revenue")
        BigDecimal revenue;

        @JsonProperty("ad_spend")
        BigDecimal adSpend;

        @JsonProperty("net_profit_uplift")
        BigDecimal netProfitUplift;

        @JsonProperty("fees")
        BigDecimal fees;
    }

    @Value
    public static class AgentShare {
        @JsonProperty("agent")
        String agent;

        /** Fraction of attributed orders credited to the agent. */
        @JsonProperty("share")
        BigDecimal share;
    }
}
