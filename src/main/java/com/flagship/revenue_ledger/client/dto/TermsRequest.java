package com.flagship.revenue_ledger.client.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

/**
 * Ranges are checked by {@link com.flagship.revenue_ledger.client.ClientTermsService}.
 */
@Value
@Builder
@Jacksonized
public class TermsRequest {

    @NotNull(message = "Fee percentage is required")
    @JsonProperty("fee_percentage")
    BigDecimal feePercentage;

    @NotNull(message = "Confidence threshold is required")
    @JsonProperty("confidence_threshold")
    BigDecimal confidenceThreshold;
}
