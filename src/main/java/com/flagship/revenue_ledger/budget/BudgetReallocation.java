package com.flagship.revenue_ledger.budget;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One budget shift between two ad platforms, as decided by the budget optimizer.
 * Efficiencies are LTV-to-CAC ratios and may be unknown.
 */
@Value
@Builder
public class BudgetReallocation {
    Long id;
    String clientId;
    String fromPlatform;
    String toPlatform;
    BigDecimal amountShifted;
    BigDecimal fromEfficiency;
    BigDecimal toEfficiency;
    String reason;
    Instant shiftedAt;
    String correlationId;
    Instant createdAt;
}
