package com.flagship.revenue_ledger.settlement;

import com.flagship.revenue_ledger.baseline.BaselineService;
import com.flagship.revenue_ledger.ledger.LedgerStore;
import com.flagship.revenue_ledger.order.OrderAttributionService;
import com.flagship.revenue_ledger.support.LedgerFixtures;
import com.flagship.revenue_ledger.support.MutableClock;
import com.flagship.revenue_ledger.support.PostgresLedgerTestBase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Month-end settlement on PostgreSQL: racing callers share one invoice and every
 * entry of the month is stamped with it exactly once.
 */
class SettlementPostgresTest extends PostgresLedgerTestBase {

    @Autowired
    private SettlementService settlementService;

    @Autowired
    private OrderAttributionService orderAttributionService;

    @Autowired
    private BaselineService baselineService;

    @Autowired
    private LedgerStore ledgerStore;

    @Autowired
    private MutableClock clock;

    private String clientId;

    @BeforeEach
    void setUp() {
        clock.setInstant(Instant.parse("2026-01-15T10:00:00Z"));
        clientId = LedgerFixtures.newClientId();
        baselineService.upsertBaseline(clientId, LedgerFixtures.standardBaseline());
    }

    @Test
    @DisplayName("Concurrent generation for one month yields a single invoice")
    void concurrentGeneration() throws Exception {
        printTestHeader("Concurrent settlement on PostgreSQL");
        orderAttributionService.recordOrder(LedgerFixtures.order(clientId, "pg-1")
                .orderAmount(new BigDecimal("8000.00")).build(), null);
        orderAttributionService.recordOrder(LedgerFixtures.order(clientId, "pg-2")
                .orderAmount(new BigDecimal("500.00")).build(), null);
        clock.setInstant(Instant.parse("2026-02-03T09:00:00Z"));

        int callers = 6;
        ExecutorService executor = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<SettlementInvoice>> futures = new ArrayList<>();
        for (int i = 0; i < callers; i++) {
            futures.add(executor.submit(() -> {
                start.await();
                return settlementService.generateOrReturn(clientId, 2026, 1, null);
            }));
        }
        start.countDown();

        Set<UUID> ids = new HashSet<>();
        for (Future<SettlementInvoice> future : futures) {
            ids.add(future.get(60, TimeUnit.SECONDS).getId());
        }
        executor.shutdown();

        printOutput("Distinct invoices", ids.size());
        assertEquals(1, ids.size());
        UUID invoiceId = ids.iterator().next();
        assertEquals(1, settlementService.listInvoices(clientId, null).size());
        assertEquals(2, ledgerStore.findByInvoice(invoiceId).size());
        printSuccess("One invoice, both entries stamped");
    }
}
