package com.flagship.revenue_ledger.baseline;

import com.flagship.revenue_ledger.exception.BaselineNotFoundException;
import com.flagship.revenue_ledger.exception.ValidationException;
import com.flagship.revenue_ledger.support.LedgerFixtures;
import com.flagship.revenue_ledger.support.MutableClock;
import com.flagship.revenue_ledger.support.TestClockConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.transaction.IllegalTransactionStateException;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@Import(TestClockConfig.class)
class BaselineServiceTest {

    @Autowired
    private BaselineService baselineService;

    @Autowired
    private TransactionTemplate transactionTemplate;

    @Autowired
    private MutableClock clock;

    private String clientId;

    private static void assertAmount(String expected, BigDecimal actual) {
        assertEquals(0, new BigDecimal(expected).compareTo(actual),
                () -> "expected " + expected + " but was " + actual);
    }

    private static BaselineDelta order(String amount) {
        return BaselineDelta.builder().revenue(new BigDecimal(amount)).orders(1).build();
    }

    @BeforeEach
    void setUp() {
        clock.setInstant(Instant.parse("2026-01-15T10:00:00Z"));
        clientId = LedgerFixtures.newClientId();
    }

    @Test
    @DisplayName("Upsert derives AOV, profit and data quality")
    void upsertDerivesFigures() {
        BaselineSnapshot snapshot = baselineService.upsertBaseline(clientId, LedgerFixtures.standardBaseline());

        assertAmount("70.00", snapshot.getBaselineAvgOrderValue());
        assertAmount("6000.00", snapshot.getBaselineProfit());
        assertAmount("10.00", snapshot.adSpendPerOrder());
        assertEquals(DataQuality.HIGH, snapshot.getDataQuality());
        assertEquals(0, snapshot.getCurrentOrderCount());
        assertEquals(clock.instant(), snapshot.getPeriodStartedAt());
    }

    @Test
    @DisplayName("Explicit AOV wins over the derived one")
    void explicitAverageOrderValue() {
        BaselineUpdate update = LedgerFixtures.standardBaseline().toBuilder()
                .baselineAvgOrderValue(new BigDecimal("65.50"))
                .build();

        assertAmount("65.50", baselineService.upsertBaseline(clientId, update).getBaselineAvgOrderValue());
    }

    @Test
    @DisplayName("Zero historical orders gives a zero AOV")
    void zeroOrders() {
        BaselineUpdate update = LedgerFixtures.standardBaseline().toBuilder()
                .baselineOrderCount(0)
                .build();

        BaselineSnapshot snapshot = baselineService.upsertBaseline(clientId, update);

        assertAmount("0.00", snapshot.getBaselineAvgOrderValue());
        assertAmount("0.00", snapshot.adSpendPerOrder());
    }

    @Test
    @DisplayName("Recalculation keeps running totals unless a new period starts")
    void recalculation() {
        baselineService.upsertBaseline(clientId, LedgerFixtures.standardBaseline());
        baselineService.applyCurrentPeriodDelta(clientId, order("120.00"));

        BaselineSnapshot kept = baselineService.upsertBaseline(clientId, LedgerFixtures.standardBaseline());
        assertEquals(1, kept.getCurrentOrderCount());
        assertAmount("120.00", kept.getCurrentRevenue());

        clock.advance(Duration.ofDays(20));
        BaselineSnapshot reset = baselineService.upsertBaseline(clientId,
                LedgerFixtures.standardBaseline().toBuilder().resetCurrentPeriod(true).build());
        assertEquals(0, reset.getCurrentOrderCount());
        assertAmount("0.00", reset.getCurrentRevenue());
        assertEquals(clock.instant(), reset.getPeriodStartedAt());
    }

    @Test
    @DisplayName("Invalid historical figures are rejected")
    void invalidUpdate() {
        BaselineUpdate negative = LedgerFixtures.standardBaseline().toBuilder()
                .baselineRevenue(new BigDecimal("-1.00"))
                .build();

        assertThrows(ValidationException.class, () -> baselineService.upsertBaseline(clientId, negative));
        assertTrue(baselineService.findBaseline(clientId).isEmpty());
    }

    @Test
    @DisplayName("Unknown client has no baseline")
    void missing() {
        assertThrows(BaselineNotFoundException.class, () -> baselineService.getBaseline(clientId));
        assertThrows(BaselineNotFoundException.class,
                () -> baselineService.applyCurrentPeriodDelta(clientId, order("1.00")));
    }

    @Test
    @DisplayName("Stale version is rejected")
    void staleVersion() {
        BaselineSnapshot snapshot = baselineService.upsertBaseline(clientId, LedgerFixtures.standardBaseline());
        long version = snapshot.getVersion();

        transactionTemplate.executeWithoutResult(status ->
                baselineService.applyCurrentPeriodDelta(clientId, version, order("10.00")));

        assertThrows(OptimisticLockingFailureException.class, () -> transactionTemplate.executeWithoutResult(status ->
                baselineService.applyCurrentPeriodDelta(clientId, version, order("10.00"))));
        assertEquals(1, baselineService.getBaseline(clientId).getCurrentOrderCount());
    }

    @Test
    @DisplayName("Versioned update needs the caller's transaction")
    void versionedUpdateNeedsTransaction() {
        BaselineSnapshot snapshot = baselineService.upsertBaseline(clientId, LedgerFixtures.standardBaseline());

        assertThrows(IllegalTransactionStateException.class,
                () -> baselineService.applyCurrentPeriodDelta(clientId, snapshot.getVersion(), order("1.00")));
    }

    @Test
    @DisplayName("Negative deltas are rejected")
    void negativeDelta() {
        baselineService.upsertBaseline(clientId, LedgerFixtures.standardBaseline());

        assertThrows(ValidationException.class,
                () -> baselineService.applyCurrentPeriodDelta(clientId, order("-5.00")));
    }

    @Test
    @DisplayName("Concurrent additive updates lose nothing")
    void concurrentDeltas() throws Exception {
        baselineService.upsertBaseline(clientId, LedgerFixtures.standardBaseline());
        int numThreads = 4;
        int perThread = 5;

        ExecutorService executor = Executors.newFixedThreadPool(numThreads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Integer>> futures = new ArrayList<>();
        for (int t = 0; t < numThreads; t++) {
            futures.add(executor.submit(() -> {
                start.await();
                int applied = 0;
                for (int i = 0; i < perThread; i++) {
                    // Retry past the bounded attempts of a single call.
                    while (true) {
                        try {
                            baselineService.applyCurrentPeriodDelta(clientId, order("10.00"));
                            applied++;
                            break;
                        } catch (ConcurrencyFailureException e) {
                            Thread.onSpinWait();
                        }
                    }
                }
                return applied;
            }));
        }
        start.countDown();

        int applied = 0;
        for (Future<Integer> future : futures) {
            applied += future.get(60, TimeUnit.SECONDS);
        }
        executor.shutdown();

        BaselineSnapshot snapshot = baselineService.getBaseline(clientId);
        assertEquals(numThreads * perThread, applied);
        assertEquals(applied, snapshot.getCurrentOrderCount());
        assertAmount("200.00", snapshot.getCurrentRevenue());
    }
}
