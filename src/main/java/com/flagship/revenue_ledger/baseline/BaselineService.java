package com.flagship.revenue_ledger.baseline;

import com.flagship.revenue_ledger.exception.BaselineNotFoundException;
import com.flagship.revenue_ledger.exception.ValidationException;
import com.flagship.revenue_ledger.uplift.UpliftCalculator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Baseline store.
 *
 * Reads go through JPA. Running totals are changed only by a single guarded SQL
 * statement that adds the delta and bumps the row version:
 * <pre>
 *   UPDATE baseline_snapshots SET current_revenue = current_revenue + ?, ..., version = version + 1
 *   WHERE client_id = ? AND version = ?
 * </pre>
 * Zero updated rows means another writer got there first; the caller re-reads and
 * retries (bounded) or surfaces the conflict.
 */
@Service
@Slf4j
public class BaselineService {

    private static final String APPLY_DELTA_SQL = """
        UPDATE baseline_snapshots
           SET current_revenue = current_revenue + ?,
               current_ad_spend = current_ad_spend + ?,
               current_order_count = current_order_count + ?,
               total_incremental_revenue = total_incremental_revenue + ?,
               total_incremental_ad_spend = total_incremental_ad_spend + ?,
               total_net_profit_uplift = total_net_profit_uplift + ?,
               total_fees = total_fees + ?,
               version = version + 1
         WHERE client_id = ? AND version = ?
        """;

    private final BaselineRepository repository;
    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;
    private final int maxAttempts;

    public BaselineService(BaselineRepository repository,
                           JdbcTemplate jdbcTemplate,
                           Clock clock,
                           @Value("${ledger.append.max-attempts:3}") int maxAttempts) {
        this.repository = repository;
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
        this.maxAttempts = maxAttempts;
    }

    /**
     * @throws BaselineNotFoundException if the baseline job has not run for this client yet
     */
    @Transactional(readOnly = true)
    public BaselineSnapshot getBaseline(String clientId) {
        return findBaseline(clientId).orElseThrow(() -> new BaselineNotFoundException(clientId));
    }

    @Transactional(readOnly = true)
    public Optional<BaselineSnapshot> findBaseline(String clientId) {
        return repository.findById(clientId).map(BaselineSnapshotEntity::toDomain);
    }

    /**
     * Applies {@code delta} if the row is still at {@code expectedVersion}. Must run
     * inside the transaction that recorded the order so both commit or neither does.
     *
     * @return the new version
     * @throws OptimisticLockingFailureException if the snapshot moved on since it was read
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public long applyCurrentPeriodDelta(String clientId, long expectedVersion, BaselineDelta delta) {
        delta.validate();

        int updated = jdbcTemplate.update(APPLY_DELTA_SQL,
                delta.getRevenue(),
                delta.getAdSpend(),
                delta.getOrders(),
                delta.getIncrementalRevenue(),
                delta.getIncrementalAdSpend(),
                delta.getNetProfitUplift(),
                delta.getFees(),
                clientId,
                expectedVersion);

        if (updated == 0) {
            if (!repository.existsById(clientId)) {
                throw new BaselineNotFoundException(clientId);
            }
            throw new OptimisticLockingFailureException(
                    "Baseline for client " + clientId + " changed since version " + expectedVersion);
        }

        log.debug("Applied baseline delta: clientId={}, version={}->{}, revenue+={}, orders+={}",
                clientId, expectedVersion, expectedVersion + 1, delta.getRevenue(), delta.getOrders());
        return expectedVersion + 1;
    }

    /**
     * Standalone additive update: reads the current version and applies the delta,
     * re-reading on a version conflict up to the configured number of attempts.
     */
    @Transactional
    public long applyCurrentPeriodDelta(String clientId, BaselineDelta delta) {
        OptimisticLockingFailureException lastConflict = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            long version = currentVersion(clientId);
            try {
                return applyCurrentPeriodDelta(clientId, version, delta);
            } catch (OptimisticLockingFailureException e) {
                lastConflict = e;
                log.warn("Baseline version conflict: clientId={}, attempt={}/{}", clientId, attempt, maxAttempts);
            }
        }
        throw lastConflict;
    }

    /**
     * Entry point for the external baseline recalculation job. Overwrites historical
     * averages and, when asked, starts a new current period.
     */
    @Transactional
    public BaselineSnapshot upsertBaseline(String clientId, BaselineUpdate update) {
        validate(update);
        Instant now = clock.instant();
        BigDecimal avgOrderValue = averageOrderValue(update);
        DataQuality quality = DataQuality.assess(
                update.getSampleSize(), update.getPeriodDays(), update.getRevenueVariance());

        BaselineSnapshotEntity entity = repository.findById(clientId)
                .map(existing -> {
                    existing.replaceHistorical(update, avgOrderValue, quality, now);
                    return existing;
                })
                .orElseGet(() -> BaselineSnapshotEntity.create(clientId, update, avgOrderValue, quality, now));

        BaselineSnapshot saved = repository.saveAndFlush(entity).toDomain();
        log.info("Baseline upserted: clientId={}, avgOrderValue={}, quality={}, resetPeriod={}",
                clientId, avgOrderValue, quality, update.isResetCurrentPeriod());
        return saved;
    }

    private long currentVersion(String clientId) {
        List<Long> versions = jdbcTemplate.queryForList(
                "SELECT version FROM baseline_snapshots WHERE client_id = ?", Long.class, clientId);
        if (versions.isEmpty()) {
            throw new BaselineNotFoundException(clientId);
        }
        return versions.get(0);
    }

    private static BigDecimal averageOrderValue(BaselineUpdate update) {
        if (update.getBaselineAvgOrderValue() != null) {
            return UpliftCalculator.currency(update.getBaselineAvgOrderValue());
        }
        if (update.getBaselineOrderCount() <= 0) {
            return UpliftCalculator.ZERO;
        }
        return update.getBaselineRevenue().divide(
                BigDecimal.valueOf(update.getBaselineOrderCount()),
                UpliftCalculator.CURRENCY_SCALE, RoundingMode.HALF_EVEN);
    }

    private static void validate(BaselineUpdate update) {
        if (update.getPlatform() == null || update.getPlatform().isBlank()) {
            throw new ValidationException("platform", "Platform is required");
        }
        if (update.getBaselineRevenue() == null || update.getBaselineRevenue().signum() < 0) {
            throw new ValidationException("baselineRevenue", "Baseline revenue must be non-negative");
        }
        if (update.getBaselineAdSpend() == null || update.getBaselineAdSpend().signum() < 0) {
            throw new ValidationException("baselineAdSpend", "Baseline ad spend must be non-negative");
        }
        if (update.getBaselineOrderCount() < 0) {
            throw new ValidationException("baselineOrderCount", "Baseline order count must be non-negative");
        }
        if (update.getBaselineAvgOrderValue() != null && update.getBaselineAvgOrderValue().signum() < 0) {
            throw new ValidationException("baselineAvgOrderValue", "Average order value must be non-negative");
        }
    }
}
