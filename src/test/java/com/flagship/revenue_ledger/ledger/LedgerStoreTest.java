package com.flagship.revenue_ledger.ledger;

import com.flagship.revenue_ledger.baseline.BaselineService;
import com.flagship.revenue_ledger.exception.NotFoundException;
import com.flagship.revenue_ledger.exception.ValidationException;
import com.flagship.revenue_ledger.order.OrderAttributionService;
import com.flagship.revenue_ledger.support.LedgerFixtures;
import com.flagship.revenue_ledger.support.MutableClock;
import com.flagship.revenue_ledger.support.TestClockConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@Import(TestClockConfig.class)
class LedgerStoreTest {

    @Autowired
    private LedgerStore ledgerStore;

    @Autowired
    private OrderAttributionService orderAttributionService;

    @Autowired
    private BaselineService baselineService;

    @Autowired
    private MutableClock clock;

    private String clientId;

    @BeforeEach
    void setUp() {
        clock.setInstant(Instant.parse("2026-01-15T10:00:00Z"));
        clientId = LedgerFixtures.newClientId();
        baselineService.upsertBaseline(clientId, LedgerFixtures.standardBaseline());
    }

    private void recordOrders(int count) {
        for (int i = 1; i <= count; i++) {
            orderAttributionService.recordOrder(LedgerFixtures.order(clientId, "ord-" + i).build(), null);
        }
    }

    @Test
    @DisplayName("Query pages through entries with a cursor")
    void paging() {
        recordOrders(5);

        List<LedgerEntry> seen = new ArrayList<>();
        Long cursor = null;
        int pages = 0;
        LedgerPage page;
        do {
            page = ledgerStore.query(clientId, DateRange.all(), cursor, 2);
            seen.addAll(page.getEntries());
            cursor = page.getNextCursor();
            pages++;
        } while (page.hasMore());

        assertEquals(3, pages);
        assertEquals(5, seen.size());
        for (int i = 1; i < seen.size(); i++) {
            assertTrue(seen.get(i).getSequence() > seen.get(i - 1).getSequence());
            assertEquals(seen.get(i - 1).getEntryHash(), seen.get(i).getPreviousHash());
        }
        assertEquals(seen, ledgerStore.findAll(clientId, DateRange.all()));
    }

    @Test
    @DisplayName("Page size outside 1..1000 is rejected")
    void pageSize() {
        assertThrows(ValidationException.class, () -> ledgerStore.query(clientId, DateRange.all(), null, 0));
        assertThrows(ValidationException.class,
                () -> ledgerStore.query(clientId, DateRange.all(), null, LedgerStore.MAX_PAGE_SIZE + 1));
    }

    @Test
    @DisplayName("Chains of different clients are independent")
    void independentChains() {
        String otherClient = LedgerFixtures.newClientId();
        baselineService.upsertBaseline(otherClient, LedgerFixtures.standardBaseline());

        recordOrders(2);
        orderAttributionService.recordOrder(LedgerFixtures.order(otherClient, "ord-1").build(), null);

        List<LedgerEntry> other = ledgerStore.findAll(otherClient, DateRange.all());
        assertEquals(1, other.size());
        assertEquals(EntryHasher.GENESIS_HASH, other.get(0).getPreviousHash());
        assertEquals(2, ledgerStore.countEntries(clientId));
    }

    @Test
    @DisplayName("Attribution log is stored next to the entry")
    void attributionLog() {
        orderAttributionService.recordOrder(LedgerFixtures.order(clientId, "ord-log")
                .signalScores(Map.of("acquisition", new BigDecimal("0.9")))
                .build(), null);
        LedgerEntry entry = ledgerStore.findByOrder(clientId, "ord-log").orElseThrow();

        AttributionLog attributionLog = ledgerStore.findAttributionLog(entry.getSequence()).orElseThrow();

        assertEquals(clientId, attributionLog.getClientId());
        assertEquals(0, new BigDecimal("0.85").compareTo(attributionLog.getFinalConfidence()));
        assertEquals(entry.getExplanation(), attributionLog.getExplanation());
    }

    @Test
    @DisplayName("Assigning an invoice to an unknown entry is not found")
    void assignUnknownEntry() {
        assertThrows(NotFoundException.class,
                () -> ledgerStore.assignInvoice("f".repeat(64), UUID.randomUUID()));
    }

    @Test
    @DisplayName("Latest hash starts at genesis")
    void latestHash() {
        assertEquals(EntryHasher.GENESIS_HASH, ledgerStore.latestHash(clientId));
        recordOrders(1);
        assertEquals(ledgerStore.findByOrder(clientId, "ord-1").orElseThrow().getEntryHash(),
                ledgerStore.latestHash(clientId));
    }

    @Test
    @DisplayName("Recent attributed entries come newest first")
    void recentAttributed() {
        recordOrders(3);
        orderAttributionService.recordOrder(LedgerFixtures.order(clientId, "ord-low")
                .attributionConfidence(new BigDecimal("0.10"))
                .build(), null);

        List<LedgerEntry> recent = ledgerStore.findRecentAttributed(clientId, 2);

        assertEquals(2, recent.size());
        assertEquals("ord-3", recent.get(0).getExternalOrderId());
        assertEquals("ord-2", recent.get(1).getExternalOrderId());
    }
}
