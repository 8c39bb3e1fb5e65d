package com.flagship.revenue_ledger.client.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.revenue_ledger.baseline.BaselineUpdate;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

/**
 * Body of {@code PUT /clients/{clientId}/baseline}, sent by the baseline
 * recalculation job.
 */
@Value
@Builder
@Jacksonized
public class BaselineRequest {

    @NotBlank(message = "Platform is required")
    @JsonProperty("platform")
    String platform;

    @NotNull(message = "Baseline revenue is required")
    @DecimalMin(value = "0.00", message = "Baseline revenue must be non-negative")
    @Digits(integer = 14, fraction = 2)
    @JsonProperty("baseline_revenue")
    BigDecimal baselineRevenue;

    @Min(value = 0, message = "Baseline order count must be non-negative")
    @JsonProperty("baseline_order_count")
    int baselineOrderCount;

    @DecimalMin(value = "0.00", message = "Average order value must be non-negative")
    @Digits(integer = 12, fraction = 2)
    @JsonProperty("baseline_avg_order_value")
    BigDecimal baselineAvgOrderValue;

    @NotNull(message = "Baseline ad spend is required")
    @DecimalMin(value = "0.00", message = "Baseline ad spend must be non-negative")
    @Digits(integer = 14, fraction = 2)
    @JsonProperty("baseline_ad_spend")
    BigDecimal baselineAdSpend;

    @Min(0)
    @JsonProperty("sample_size")
    int sampleSize;

    @Min(0)
    @JsonProperty("period_days")
    int periodDays;

    @JsonProperty("revenue_variance")
    BigDecimal revenueVariance;

    @JsonProperty("reset_current_period")
    boolean resetCurrentPeriod;

    public BaselineUpdate toUpdate() {
        return BaselineUpdate.builder()
                .platform(platform)
                .baselineRevenue(baselineRevenue)
                .baselineOrderCount(baselineOrderCount)
                .baselineAvgOrderValue(baselineAvgOrderValue)
                .baselineAdSpend(baselineAdSpend)
                .sampleSize(sampleSize)
                .periodDays(periodDays)
                .revenueVariance(revenueVariance)
                .resetCurrentPeriod(resetCurrentPeriod)
                .build();
    }
}
