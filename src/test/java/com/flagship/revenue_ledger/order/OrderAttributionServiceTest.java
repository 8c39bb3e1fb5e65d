package com.flagship.revenue_ledger.order;

import com.flagship.revenue_ledger.baseline.BaselineService;
import com.flagship.revenue_ledger.baseline.BaselineSnapshot;
import com.flagship.revenue_ledger.client.ClientTermsService;
import com.flagship.revenue_ledger.event.OrderAttributedEvent;
import com.flagship.revenue_ledger.exception.BaselineNotFoundException;
import com.flagship.revenue_ledger.exception.NotFoundException;
import com.flagship.revenue_ledger.exception.ValidationException;
import com.flagship.revenue_ledger.ledger.EntryHasher;
import com.flagship.revenue_ledger.ledger.LedgerStore;
import com.flagship.revenue_ledger.order.dto.AttributionResult;
import com.flagship.revenue_ledger.order.dto.OrderAttributionResponse;
import com.flagship.revenue_ledger.outbox.OutboxService;
import com.flagship.revenue_ledger.support.LedgerFixtures;
import com.flagship.revenue_ledger.support.MutableClock;
import com.flagship.revenue_ledger.support.TestClockConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RecordOrder against the real store (H2 in PostgreSQL mode):
 * - decisions are persisted with their attribution log and outbox event
 * - duplicates return the original entry, however they race
 * - running totals follow the recorded orders
 */
@SpringBootTest
@Import(TestClockConfig.class)
class OrderAttributionServiceTest {

    @Autowired
    private OrderAttributionService orderAttributionService;

    @Autowired
    private BaselineService baselineService;

    @Autowired
    private ClientTermsService clientTermsService;

    @Autowired
    private LedgerStore ledgerStore;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private MutableClock clock;

    private String clientId;

    // Helper methods for test output
    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printInput(String label, Object value) {
        System.out.println("INPUT  - " + label + ": " + value);
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private static void assertAmount(String expected, BigDecimal actual) {
        assertEquals(0, new BigDecimal(expected).compareTo(actual),
                () -> "expected " + expected + " but was " + actual);
    }

    @BeforeEach
    void setUp() {
        clock.setInstant(Instant.parse("2026-01-15T10:00:00Z"));
        clientId = LedgerFixtures.newClientId();
        baselineService.upsertBaseline(clientId, LedgerFixtures.standardBaseline());
    }

    @Nested
    @DisplayName("Recording")
    class Recording {

        @Test
        @DisplayName("Worked example is attributed and charged $6.00")
        void workedExample() {
            printTestHeader("Record attributed order");
            printInput("Order", "$99.99 at 0.85 confidence, baseline AOV $70.00");

            AttributionResult result = orderAttributionService.recordOrder(
                    LedgerFixtures.order(clientId, "ext-1").build(), null);

            printOutput("Entry hash", result.getEntryHash());
            printOutput("Explanation", result.getExplanation());
            assertFalse(result.isDuplicate());
            assertTrue(result.isAttributed());
            assertAmount("29.99", result.getIncrementalRevenue());
            assertAmount("42.84", result.getUpliftPercentage());
            assertAmount("6.00", result.getFeeAmount());
            assertEquals(EntryHasher.GENESIS_HASH, result.getPreviousHash());
            assertEquals(64, result.getEntryHash().length());
            assertEquals("shopify", result.getPlatform());
            printSuccess("Order attributed with a $6.00 fee");
        }

        @Test
        @DisplayName("Confidence below the threshold is recorded but not attributed")
        void belowThreshold() {
            AttributionResult result = orderAttributionService.recordOrder(
                    LedgerFixtures.order(clientId, "ext-low")
                            .attributionConfidence(new BigDecimal("0.65"))
                            .build(), null);

            assertFalse(result.isAttributed());
            assertAmount("0.00", result.getFeeAmount());
            assertTrue(result.getExplanation().contains("threshold 0.70"));
            assertEquals(1, ledgerStore.countEntries(clientId));
            assertEquals(0, ledgerStore.countAttributed(clientId));
        }

        @Test
        @DisplayName("Client terms override the default fee and threshold")
        void clientTerms() {
            clientTermsService.putTerms(clientId, new BigDecimal("0.10"), new BigDecimal("0.90"));

            AttributionResult rejected = orderAttributionService.recordOrder(
                    LedgerFixtures.order(clientId, "ext-terms-1").build(), null);
            AttributionResult accepted = orderAttributionService.recordOrder(
                    LedgerFixtures.order(clientId, "ext-terms-2")
                            .attributionConfidence(new BigDecimal("0.95"))
                            .build(), null);

            assertFalse(rejected.isAttributed());
            assertTrue(accepted.isAttributed());
            assertAmount("3.00", accepted.getFeeAmount());
        }

        @Test
        @DisplayName("Reported ad spend is netted against the baseline per order")
        void adSpend() {
            AttributionResult result = orderAttributionService.recordOrder(
                    LedgerFixtures.order(clientId, "ext-ads")
                            .adSpendForOrder(new BigDecimal("15.00"))
                            .build(), null);

            assertAmount("5.00", result.getIncrementalAdSpend());
            assertAmount("24.99", result.getNetProfitUplift());
            assertAmount("5.00", result.getFeeAmount());
        }

        @Test
        @DisplayName("Entries of one client form a hash chain")
        void hashChain() {
            AttributionResult first = orderAttributionService.recordOrder(
                    LedgerFixtures.order(clientId, "ext-a").build(), null);
            AttributionResult second = orderAttributionService.recordOrder(
                    LedgerFixtures.order(clientId, "ext-b").build(), null);

            assertEquals(first.getEntryHash(), second.getPreviousHash());
            assertEquals(second.getEntryHash(), ledgerStore.latestHash(clientId));
            assertTrue(second.getSequence() > first.getSequence());
        }

        @Test
        @DisplayName("Running totals follow recorded orders")
        void runningTotals() {
            orderAttributionService.recordOrder(LedgerFixtures.order(clientId, "ext-t1").build(), null);
            orderAttributionService.recordOrder(LedgerFixtures.order(clientId, "ext-t2")
                    .orderAmount(new BigDecimal("40.00"))
                    .build(), null);

            BaselineSnapshot baseline = baselineService.getBaseline(clientId);
            assertEquals(2, baseline.getCurrentOrderCount());
            assertAmount("139.99", baseline.getCurrentRevenue());
            assertAmount("29.99", baseline.getTotalIncrementalRevenue());
            assertAmount("6.00", baseline.getTotalFees());
        }

        @Test
        @DisplayName("OrderAttributed is written to the outbox")
        void outboxEvent() {
            orderAttributionService.recordOrder(LedgerFixtures.order(clientId, "ext-evt").build(), null);

            assertEquals(1, outboxService.getEvents(OrderAttributedEvent.EVENT_TYPE, clientId).size());
        }
    }

    @Nested
    @DisplayName("Idempotency")
    class Idempotency {

        @Test
        @DisplayName("Same order twice returns the original entry")
        void sameOrderTwice() {
            printTestHeader("Idempotency: Same Order Twice");

            AttributionResult first = orderAttributionService.recordOrder(
                    LedgerFixtures.order(clientId, "ext-dup").build(), null);
            AttributionResult second = orderAttributionService.recordOrder(
                    LedgerFixtures.order(clientId, "ext-dup")
                            .orderAmount(new BigDecimal("500.00"))
                            .build(), null);

            printOutput("First hash", first.getEntryHash());
            printOutput("Second hash", second.getEntryHash());
            assertTrue(second.isDuplicate());
            assertEquals(first.getEntryHash(), second.getEntryHash());
            assertAmount("99.99", second.getOrderAmount());
            assertEquals(1, ledgerStore.countEntries(clientId));
            assertEquals(1, baselineService.getBaseline(clientId).getCurrentOrderCount());
            printSuccess("Second submission answered with the original entry");
        }

        @Test
        @DisplayName("Concurrent duplicates produce exactly one entry")
        void concurrentDuplicates() throws Exception {
            printTestHeader("Idempotency: Concurrent Duplicate Orders");
            int numThreads = 8;
            printInput("Concurrent submissions", numThreads);

            ExecutorService executor = Executors.newFixedThreadPool(numThreads);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<AttributionResult>> futures = new ArrayList<>();
            for (int i = 0; i < numThreads; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return orderAttributionService.recordOrder(
                            LedgerFixtures.order(clientId, "ext-race").build(), null);
                }));
            }
            start.countDown();

            Set<String> hashes = ConcurrentHashMap.newKeySet();
            int created = 0;
            for (Future<AttributionResult> future : futures) {
                AttributionResult result = future.get(30, TimeUnit.SECONDS);
                hashes.add(result.getEntryHash());
                if (!result.isDuplicate()) {
                    created++;
                }
            }
            executor.shutdown();

            printOutput("Distinct hashes", hashes.size());
            printOutput("Created", created);
            assertEquals(1, hashes.size());
            assertEquals(1, created);
            assertEquals(1, ledgerStore.countEntries(clientId));
            printSuccess("Exactly one entry recorded");
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("No baseline for the client is a precondition failure")
        void missingBaseline() {
            assertThrows(BaselineNotFoundException.class, () -> orderAttributionService.recordOrder(
                    LedgerFixtures.order(LedgerFixtures.newClientId(), "ext-1").build(), null));
        }

        @Test
        @DisplayName("Confidence outside [0, 1] is rejected before anything is written")
        void invalidConfidence() {
            ValidationException e = assertThrows(ValidationException.class,
                    () -> orderAttributionService.recordOrder(LedgerFixtures.order(clientId, "ext-bad")
                            .attributionConfidence(new BigDecimal("1.5"))
                            .build(), null));

            assertTrue(e.getFieldErrors().containsKey("attributionConfidence"));
            assertEquals(0, ledgerStore.countEntries(clientId));
        }

        @Test
        @DisplayName("Unknown signal names are rejected")
        void unknownSignal() {
            assertThrows(ValidationException.class,
                    () -> orderAttributionService.recordOrder(LedgerFixtures.order(clientId, "ext-sig")
                            .signalScores(Map.of("weather", new BigDecimal("0.5")))
                            .build(), null));
        }

        @Test
        @DisplayName("Reserved anon: prefix is rejected")
        void reservedPrefix() {
            assertThrows(ValidationException.class, () -> orderAttributionService.recordOrder(
                    LedgerFixtures.order(clientId, "anon:abc").build(), null));
        }
    }

    @Nested
    @DisplayName("Lookup and anonymization")
    class Lookup {

        @Test
        @DisplayName("Attribution detail explains the decision")
        void attributionDetail() {
            orderAttributionService.recordOrder(LedgerFixtures.order(clientId, "ext-why")
                    .signalScores(Map.of("ad_touchpoint", new BigDecimal("0.8")))
                    .build(), null);

            OrderAttributionResponse response = orderAttributionService.getOrderAttribution(clientId, "ext-why", null);

            assertEquals(OrderAttributionService.DECISION_ENGINE, response.getAttributionLog().getDecisionEngine());
            assertAmount("0.70", response.getAttributionLog().getThresholdApplied());
            assertAmount("0.80", response.getAttributionLog().getSignalScores().get("ad_touchpoint"));
            assertEquals(response.getEntry().getExplanation(), response.getAttributionLog().getExplanation());
        }

        @Test
        @DisplayName("Unknown order is not found")
        void unknownOrder() {
            assertThrows(NotFoundException.class,
                    () -> orderAttributionService.getOrderAttribution(clientId, "missing", null));
        }

        @Test
        @DisplayName("Anonymization replaces order ids and keeps figures and hash")
        void anonymize() {
            AttributionResult original = orderAttributionService.recordOrder(
                    LedgerFixtures.order(clientId, "ext-pii").build(), null);

            AttributionResult anonymized = orderAttributionService.anonymize(clientId, "ext-pii", null);
            AttributionResult again = orderAttributionService.anonymize(clientId, "ext-pii", null);

            assertEquals(EntryHasher.anonymizedForm("ext-pii"), anonymized.getExternalOrderId());
            assertTrue(anonymized.getInternalOrderId().startsWith(EntryHasher.ANONYMIZED_PREFIX));
            assertEquals(original.getEntryHash(), anonymized.getEntryHash());
            assertAmount("6.00", anonymized.getFeeAmount());
            assertNotNull(anonymized.getAnonymizedAt());
            assertEquals(anonymized.getAnonymizedAt(), again.getAnonymizedAt());
            assertEquals(EntryHasher.hash(ledgerStore.findByOrder(clientId, "ext-pii").orElseThrow()),
                    anonymized.getEntryHash());
        }

        @Test
        @DisplayName("Replaying an anonymized order is still answered as a duplicate")
        void replayAfterAnonymization() {
            AttributionResult original = orderAttributionService.recordOrder(
                    LedgerFixtures.order(clientId, "ext-replay").build(), null);
            orderAttributionService.anonymize(clientId, "ext-replay", null);

            AttributionResult replay = orderAttributionService.recordOrder(
                    LedgerFixtures.order(clientId, "ext-replay").build(), null);

            assertTrue(replay.isDuplicate());
            assertEquals(original.getEntryHash(), replay.getEntryHash());
            assertEquals(1, ledgerStore.countEntries(clientId));
        }
    }
}
