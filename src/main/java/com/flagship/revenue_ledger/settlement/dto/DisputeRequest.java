package com.flagship.revenue_ledger.settlement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class DisputeRequest {

    @NotBlank(message = "Dispute reason is required")
    @Size(max = 1000)
    @JsonProperty("reason")
    String reason;
}
