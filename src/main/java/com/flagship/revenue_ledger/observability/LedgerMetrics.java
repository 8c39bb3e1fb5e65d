package com.flagship.revenue_ledger.observability;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Micrometer meters for the ledger engine.
 *
 * - ledger.orders.recorded{outcome}: attributed / below_threshold / below_baseline / duplicate / error
 * - ledger.fees.charged: sum of per-order fees, in currency units
 * - ledger.zero_risk.clamped{scope}: times the zero-risk floor overrode a computed fee
 * - ledger.append.retries: optimistic version conflicts that forced a retry
 * - ledger.settlements.generated{outcome}: created / existing / error
 * - ledger.invoices.transitions{status}
 * - ledger.latency{operation}
 * - ledger.budget.reallocations{from,to}
 * - idempotency.cache{result}
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordOrder(String outcome) {
        registry.counter("ledger.orders.recorded", "outcome", sanitizeTag(outcome)).increment();
    }

    public void recordFeeCharged(BigDecimal fee) {
        if (fee != null && fee.signum() > 0) {
            registry.counter("ledger.fees.charged").increment(fee.doubleValue());
        }
    }

    public void recordZeroRiskClamp(String scope) {
        registry.counter("ledger.zero_risk.clamped", "scope", sanitizeTag(scope)).increment();
    }

    public void recordAppendRetry() {
        registry.counter("ledger.append.retries").increment();
    }

    public void recordSettlement(String outcome) {
        registry.counter("ledger.settlements.generated", "outcome", sanitizeTag(outcome)).increment();
    }

    public void recordInvoiceTransition(String status) {
        registry.counter("ledger.invoices.transitions", "status", sanitizeTag(status)).increment();
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("ledger.latency", "operation", sanitizeTag(operation))
                .record(Duration.ofMillis(durationMs));
    }

    public void recordBudgetReallocation(String fromPlatform, String toPlatform) {
        registry.counter("ledger.budget.reallocations",
                "from", sanitizeTag(fromPlatform), "to", sanitizeTag(toPlatform)).increment();
    }

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    /**
     * Keeps tag cardinality bounded.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.toLowerCase().replaceAll("[^a-z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
