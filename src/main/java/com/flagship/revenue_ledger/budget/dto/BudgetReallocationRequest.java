package com.flagship.revenue_ledger.budget.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

/**
 * Body of {@code POST /clients/{clientId}/budget-reallocations}, sent by the budget
 * optimizer after it moves spend between platforms.
 */
@Value
@Builder
@Jacksonized
public class BudgetReallocationRequest {

    @NotBlank(message = "Source platform is required")
    @Size(max = 50, message = "Source platform must be at most 50 characters")
    @JsonProperty("from_platform")
    String fromPlatform;

    @NotBlank(message = "Target platform is required")
    @Size(max = 50, message = "Target platform must be at most 50 characters")
    @JsonProperty("to_platform")
    String toPlatform;

    @NotNull(message = "Amount shifted is required")
    @Positive(message = "Amount shifted must be positive")
    @Digits(integer = 12, fraction = 2, message = "Amount shifted must have at most 2 decimal places")
    @JsonProperty("amount_shifted")
    BigDecimal amountShifted;

    @DecimalMin(value = "0.00", message = "Source efficiency must not be negative")
    @Digits(integer = 5, fraction = 2)
    @JsonProperty("from_efficiency")
    BigDecimal fromEfficiency;

    @DecimalMin(value = "0.00", message = "Target efficiency must not be negative")
    @Digits(integer = 5, fraction = 2)
    @JsonProperty("to_efficiency")
    BigDecimal toEfficiency;

    @NotBlank(message = "Reason is required")
    @Size(max = 2000, message = "Reason must be at most 2000 characters")
    @JsonProperty("reason")
    String reason;

    /** Epoch seconds of the shift; the time of recording when absent. */
    @PositiveOrZero
    @JsonProperty("timestamp")
    Long timestamp;
}
