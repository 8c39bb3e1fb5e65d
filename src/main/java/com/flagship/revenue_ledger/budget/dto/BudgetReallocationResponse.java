package com.flagship.revenue_ledger.budget.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.revenue_ledger.budget.BudgetReallocation;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BudgetReallocationResponse {

    @JsonProperty("id")
    Long id;

    @JsonProperty("client_id")
    String clientId;

    @JsonProperty("from_platform")
    String fromPlatform;

    @JsonProperty("to_platform")
    String toPlatform;

    @JsonProperty("amount_shifted")
    BigDecimal amountShifted;

    @JsonProperty("from_efficiency")
    BigDecimal fromEfficiency;

    @JsonProperty("to_efficiency")
    BigDecimal toEfficiency;

    @JsonProperty("reason")
    String reason;

    @JsonProperty("shifted_at")
    Instant shiftedAt;

    @JsonProperty("created_at")
    Instant createdAt;

    public static BudgetReallocationResponse from(BudgetReallocation reallocation) {
        return BudgetReallocationResponse.builder()
                .id(reallocation.getId())
                .clientId(reallocation.getClientId())
                .fromPlatform(reallocation.getFromPlatform())
                .toPlatform(reallocation.getToPlatform())
                .amountShifted(reallocation.getAmountShifted())
                .fromEfficiency(reallocation.getFromEfficiency())
                .toEfficiency(reallocation.getToEfficiency())
                .reason(reallocation.getReason())
                .shiftedAt(reallocation.getShiftedAt())
                .createdAt(reallocation.getCreatedAt())
                .build();
    }
}
