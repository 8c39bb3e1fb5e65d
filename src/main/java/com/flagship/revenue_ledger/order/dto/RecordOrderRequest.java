package com.flagship.revenue_ledger.order.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Order event handed over by the order-ingest collaborator, over REST or Kafka.
 *
 * {@code (client_id, external_order_id)} is the idempotency key: retries must reuse it.
 */
@Value
@Builder
@Jacksonized
public class RecordOrderRequest {

    @NotBlank(message = "Client ID is required")
    @Size(max = 64, message = "Client ID must be at most 64 characters")
    @JsonProperty("client_id")
    String clientId;

    @Size(max = 64, message = "Platform must be at most 64 characters")
    @JsonProperty("platform")
    String platform;

    @NotBlank(message = "Internal order ID is required")
    @Size(max = 128, message = "Internal order ID must be at most 128 characters")
    @JsonProperty("internal_order_id")
    String internalOrderId;

    @NotBlank(message = "External order ID is required")
    @Size(max = 128, message = "External order ID must be at most 128 characters")
    @Pattern(regexp = "^(?!anon:).*$", message = "External order ID must not use the reserved 'anon:' prefix")
    @JsonProperty("external_order_id")
    String externalOrderId;

    @NotNull(message = "Order amount is required")
    @DecimalMin(value = "0.00", message = "Order amount must not be negative")
    @Digits(integer = 12, fraction = 2, message = "Order amount must have at most 2 decimal places")
    @JsonProperty("order_amount")
    BigDecimal orderAmount;

    @NotNull(message = "Attribution confidence is required")
    @DecimalMin(value = "0.0", message = "Attribution confidence must be between 0 and 1")
    @DecimalMax(value = "1.0", message = "Attribution confidence must be between 0 and 1")
    @Digits(integer = 1, fraction = 4, message = "Attribution confidence must have at most 4 decimal places")
    @JsonProperty("attribution_confidence")
    BigDecimal attributionConfidence;

    @JsonProperty("signal_scores")
    Map<String, BigDecimal> signalScores;

    @DecimalMin(value = "0.00", message = "Ad spend must not be negative")
    @Digits(integer = 12, fraction = 2, message = "Ad spend must have at most 2 decimal places")
    @JsonProperty("ad_spend_for_order")
    BigDecimal adSpendForOrder;

    @Size(max = 128, message = "Campaign ID must be at most 128 characters")
    @JsonProperty("campaign_id")
    String campaignId;

    @Size(max = 128, message = "Creative ID must be at most 128 characters")
    @JsonProperty("creative_id")
    String creativeId;

    @Size(max = 128, message = "Touchpoint ID must be at most 128 characters")
    @JsonProperty("touchpoint_id")
    String touchpointId;
}
