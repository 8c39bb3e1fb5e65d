package com.flagship.revenue_ledger.client.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.revenue_ledger.client.ClientTerms;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
public class TermsResponse {

    @JsonProperty("client_id")
    String clientId;

    @JsonProperty("fee_percentage")
    BigDecimal feePercentage;

    @JsonProperty("confidence_threshold")
    BigDecimal confidenceThreshold;

    @JsonProperty("custom")
    boolean custom;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static TermsResponse from(ClientTerms terms) {
        return new TermsResponse(terms.getClientId(), terms.getFeePercentage(), terms.getConfidenceThreshold(),
                terms.isCustom(), terms.getUpdatedAt());
    }
}
