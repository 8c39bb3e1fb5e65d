package com.flagship.revenue_ledger.baseline;

import com.flagship.revenue_ledger.uplift.UpliftCalculator;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * JPA entity for {@link BaselineSnapshot}.
 *
 * No setters. Historical fields change only through {@link #replaceHistorical};
 * running totals are never written through JPA but through the versioned additive
 * update in {@link BaselineService#applyCurrentPeriodDelta}.
 */
@Entity
@Table(name = "baseline_snapshots")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class BaselineSnapshotEntity {

    @Id
    @Column(name = "client_id", nullable = false, updatable = false, length = 64)
    private String clientId;

    @Column(nullable = false, length = 64)
    private String platform;

    @Column(name = "baseline_revenue", nullable = false, precision = 14, scale = 2)
    private BigDecimal baselineRevenue;

    @Column(name = "baseline_order_count", nullable = false)
    private int baselineOrderCount;

    @Column(name = "baseline_avg_order_value", nullable = false, precision = 14, scale = 2)
    private BigDecimal baselineAvgOrderValue;

    @Column(name = "baseline_ad_spend", nullable = false, precision = 14, scale = 2)
    private BigDecimal baselineAdSpend;

    @Column(name = "baseline_profit", nullable = false, precision = 14, scale = 2)
    private BigDecimal baselineProfit;

    @Column(name = "current_revenue", nullable = false, precision = 14, scale = 2)
    private BigDecimal currentRevenue;

    @Column(name = "current_order_count", nullable = false)
    private int currentOrderCount;

    @Column(name = "current_ad_spend", nullable = false, precision = 14, scale = 2)
    private BigDecimal currentAdSpend;

    @Column(name = "total_incremental_revenue", nullable = false, precision = 14, scale = 2)
    private BigDecimal totalIncrementalRevenue;

    @Column(name = "total_incremental_ad_spend", nullable = false, precision = 14, scale = 2)
    private BigDecimal totalIncrementalAdSpend;

    @Column(name = "total_net_profit_uplift", nullable = false, precision = 14, scale = 2)
    private BigDecimal totalNetProfitUplift;

    @Column(name = "total_fees", nullable = false, precision = 14, scale = 2)
    private BigDecimal totalFees;

    @Enumerated(EnumType.STRING)
    @Column(name = "data_quality", nullable = false, length = 16)
    private DataQuality dataQuality;

    @Column(name = "period_started_at", nullable = false)
    private Instant periodStartedAt;

    @Column(name = "last_synced_at", nullable = false)
    private Instant lastSyncedAt;

    @Version
    @Column(nullable = false)
    private Long version;

    static BaselineSnapshotEntity create(String clientId, BaselineUpdate update,
                                         BigDecimal avgOrderValue, DataQuality quality, Instant now) {
        return new BaselineSnapshotEntity(
            clientId,
            update.getPlatform(),
            update.getBaselineRevenue(),
            update.getBaselineOrderCount(),
            avgOrderValue,
            update.getBaselineAdSpend(),
            update.getBaselineRevenue().subtract(update.getBaselineAdSpend()),
            UpliftCalculator.ZERO,
            0,
            UpliftCalculator.ZERO,
            UpliftCalculator.ZERO,
            UpliftCalculator.ZERO,
            UpliftCalculator.ZERO,
            UpliftCalculator.ZERO,
            quality,
            now,
            now,
            null // assigned by the persistence provider
        );
    }

    /**
     * Overwrites the historical averages. Cumulative incremental totals are kept.
     */
    void replaceHistorical(BaselineUpdate update, BigDecimal avgOrderValue, DataQuality quality, Instant now) {
        this.platform = update.getPlatform();
        this.baselineRevenue = update.getBaselineRevenue();
        this.baselineOrderCount = update.getBaselineOrderCount();
        this.baselineAvgOrderValue = avgOrderValue;
        this.baselineAdSpend = update.getBaselineAdSpend();
        this.baselineProfit = update.getBaselineRevenue().subtract(update.getBaselineAdSpend());
        this.dataQuality = quality;
        this.lastSyncedAt = now;
        if (update.isResetCurrentPeriod()) {
            this.currentRevenue = UpliftCalculator.ZERO;
            this.currentOrderCount = 0;
            this.currentAdSpend = UpliftCalculator.ZERO;
            this.periodStartedAt = now;
        }
    }

    public BaselineSnapshot toDomain() {
        return new BaselineSnapshot(
            clientId,
            platform,
            baselineRevenue,
            baselineOrderCount,
            baselineAvgOrderValue,
            baselineAdSpend,
            baselineProfit,
            currentRevenue,
            currentOrderCount,
            currentAdSpend,
            totalIncrementalRevenue,
            totalIncrementalAdSpend,
            totalNetProfitUplift,
            totalFees,
            dataQuality,
            periodStartedAt,
            lastSyncedAt,
            version == null ? 0L : version
        );
    }
}
