package com.flagship.revenue_ledger.client.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.revenue_ledger.baseline.BaselineSnapshot;
import com.flagship.revenue_ledger.baseline.DataQuality;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
public class BaselineResponse {

    @JsonProperty("client_id")
    String clientId;

    @JsonProperty("platform")
    String platform;

    @JsonProperty("baseline_revenue")
    BigDecimal baselineRevenue;

    @JsonProperty("baseline_order_count")
    int baselineOrderCount;

    @JsonProperty("baseline_avg_order_value")
    BigDecimal baselineAvgOrderValue;

    @JsonProperty("baseline_ad_spend")
    BigDecimal baselineAdSpend;

    @JsonProperty("baseline_profit")
    BigDecimal baselineProfit;

    @JsonProperty("current_revenue")
    BigDecimal currentRevenue;

    @JsonProperty("current_order_count")
    int currentOrderCount;

    @JsonProperty("current_ad_spend")
    BigDecimal currentAdSpend;

    @JsonProperty("total_incremental_revenue")
    BigDecimal totalIncrementalRevenue;

    @JsonProperty("total_incremental_ad_spend")
    BigDecimal totalIncrementalAdSpend;

    @JsonProperty("total_net_profit_uplift")
    BigDecimal totalNetProfitUplift;

    @JsonProperty("total_fees")
    BigDecimal totalFees;

    @JsonProperty("data_quality")
    DataQuality dataQuality;

    @JsonProperty("period_started_at")
    Instant periodStartedAt;

    @JsonProperty("last_synced_at")
    Instant lastSyncedAt;

    @JsonProperty("version")
    long version;

    public static BaselineResponse from(BaselineSnapshot snapshot) {
        return BaselineResponse.builder()
                .clientId(snapshot.getClientId())
                .platform(snapshot.getPlatform())
                .baselineRevenue(snapshot.getBaselineRevenue())
                .baselineOrderCount(snapshot.getBaselineOrderCount())
                .baselineAvgOrderValue(snapshot.getBaselineAvgOrderValue())
                .baselineAdSpend(snapshot.getBaselineAdSpend())
                .baselineProfit(snapshot.getBaselineProfit())
                .currentRevenue(snapshot.getCurrentRevenue())
                .currentOrderCount(snapshot.getCurrentOrderCount())
                .currentAdSpend(snapshot.getCurrentAdSpend())
                .totalIncrementalRevenue(snapshot.getTotalIncrementalRevenue())
                .totalIncrementalAdSpend(snapshot.getTotalIncrementalAdSpend())
                .totalNetProfitUplift(snapshot.getTotalNetProfitUplift())
                .totalFees(snapshot.getTotalFees())
                .dataQuality(snapshot.getDataQuality())
                .periodStartedAt(snapshot.getPeriodStartedAt())
                .lastSyncedAt(snapshot.getLastSyncedAt())
                .version(snapshot.getVersion())
                .build();
    }
}
