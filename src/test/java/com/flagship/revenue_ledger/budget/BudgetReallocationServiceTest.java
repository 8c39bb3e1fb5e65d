package com.flagship.revenue_ledger.budget;

import com.flagship.revenue_ledger.budget.dto.BudgetReallocationRequest;
import com.flagship.revenue_ledger.exception.ValidationException;
import com.flagship.revenue_ledger.ledger.DateRange;
import com.flagship.revenue_ledger.observability.CorrelationContext;
import com.flagship.revenue_ledger.support.LedgerFixtures;
import com.flagship.revenue_ledger.support.MutableClock;
import com.flagship.revenue_ledger.support.TestClockConfig;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@Import(TestClockConfig.class)
class BudgetReallocationServiceTest {

    private static final Instant NOW = Instant.parse("2026-02-08T12:00:00Z");

    @Autowired
    private BudgetReallocationService service;

    @Autowired
    private BudgetReallocationRepository repository;

    @Autowired
    private MeterRegistry meterRegistry;

    @Autowired
    private MutableClock clock;

    private String clientId;

    // Helper methods for test output
    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @BeforeEach
    void setUp() {
        clock.setInstant(NOW);
        clientId = LedgerFixtures.newClientId();
    }

    @AfterEach
    void tearDown() {
        CorrelationContext.end();
    }

    private static BudgetReallocationRequest.BudgetReallocationRequestBuilder shift() {
        return BudgetReallocationRequest.builder()
                .fromPlatform("meta")
                .toPlatform("tiktok")
                .amountShifted(new BigDecimal("100.00"))
                .fromEfficiency(new BigDecimal("2.50"))
                .toEfficiency(new BigDecimal("4.00"))
                .reason("Efficiency drop: 2.50x vs 2.83x avg");
    }

    @Nested
    @DisplayName("Recording")
    class Recording {

        @Test
        @DisplayName("A valid shift is stored with its correlation id and counted")
        void recordsShift() {
            printTestHeader("Record budget reallocation");
            CorrelationContext.begin("optimizer-run-7");
            double before = meterRegistry.counter("ledger.budget.reallocations", "from", "meta", "to", "tiktok").count();

            BudgetReallocation saved = service.record(clientId,
                    shift().timestamp(1770552000L).build(), null);

            printOutput("Reallocation", saved);
            assertNotNull(saved.getId());
            assertEquals(clientId, saved.getClientId());
            assertEquals(0, new BigDecimal("100.00").compareTo(saved.getAmountShifted()));
            assertEquals(Instant.ofEpochSecond(1770552000L), saved.getShiftedAt());
            assertEquals(NOW, saved.getCreatedAt());
            assertEquals("optimizer-run-7", saved.getCorrelationId());
            assertTrue(repository.findById(saved.getId()).isPresent());
            assertEquals(before + 1,
                    meterRegistry.counter("ledger.budget.reallocations", "from", "meta", "to", "tiktok").count());
            printSuccess("Reallocation appended");
        }

        @Test
        @DisplayName("Without a timestamp the shift is dated at recording time")
        void defaultsShiftTime() {
            BudgetReallocation saved = service.record(clientId, shift().build(), null);

            assertEquals(NOW, saved.getShiftedAt());
            assertNull(saved.getCorrelationId());
        }

        @Test
        @DisplayName("Efficiencies are optional")
        void optionalEfficiencies() {
            BudgetReallocation saved = service.record(clientId,
                    shift().fromEfficiency(null).toEfficiency(null).build(), null);

            assertNull(saved.getFromEfficiency());
            assertNull(saved.getToEfficiency());
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("Client id is required")
        void clientRequired() {
            ValidationException e = assertThrows(ValidationException.class,
                    () -> service.record(" ", shift().build(), null));
            assertTrue(e.getFieldErrors().containsKey("clientId"));
        }

        @Test
        @DisplayName("Zero and negative amounts are rejected")
        void amountMustBePositive() {
            ValidationException zero = assertThrows(ValidationException.class,
                    () -> service.record(clientId, shift().amountShifted(BigDecimal.ZERO).build(), null));
            ValidationException negative = assertThrows(ValidationException.class,
                    () -> service.record(clientId, shift().amountShifted(new BigDecimal("-5.00")).build(), null));

            assertTrue(zero.getFieldErrors().containsKey("amountShifted"));
            assertTrue(negative.getFieldErrors().containsKey("amountShifted"));
            assertTrue(service.list(clientId, DateRange.all(), null, null).isEmpty());
        }

        @Test
        @DisplayName("Source and target platform must differ")
        void samePlatform() {
            ValidationException e = assertThrows(ValidationException.class,
                    () -> service.record(clientId, shift().toPlatform("META").build(), null));
            assertTrue(e.getFieldErrors().containsKey("toPlatform"));
        }

        @Test
        @DisplayName("Reason is required")
        void reasonRequired() {
            ValidationException e = assertThrows(ValidationException.class,
                    () -> service.record(clientId, shift().reason("").build(), null));
            assertTrue(e.getFieldErrors().containsKey("reason"));
        }

        @Test
        @DisplayName("List limit is bounded")
        void limitBounded() {
            assertThrows(ValidationException.class,
                    () -> service.list(clientId, DateRange.all(), 0, null));
            assertThrows(ValidationException.class,
                    () -> service.list(clientId, DateRange.all(), BudgetReallocationService.MAX_LIMIT + 1, null));
        }
    }

    @Nested
    @DisplayName("Listing")
    class Listing {

        @Test
        @DisplayName("Newest shift first, filtered by date range and client")
        void newestFirst() {
            service.record(clientId, shift().timestamp(Instant.parse("2026-02-01T08:00:00Z").getEpochSecond()).build(), null);
            service.record(clientId, shift().timestamp(Instant.parse("2026-02-05T08:00:00Z").getEpochSecond())
                    .fromPlatform("google").build(), null);
            service.record(clientId, shift().timestamp(Instant.parse("2026-01-20T08:00:00Z").getEpochSecond()).build(), null);
            service.record(LedgerFixtures.newClientId(), shift().build(), null);

            List<BudgetReallocation> february = service.list(clientId,
                    DateRange.ofDates(LocalDate.of(2026, 2, 1), LocalDate.of(2026, 2, 28)), null, null);
            List<BudgetReallocation> all = service.list(clientId, DateRange.all(), null, null);
            List<BudgetReallocation> latest = service.list(clientId, DateRange.all(), 1, null);

            assertEquals(2, february.size());
            assertEquals("google", february.get(0).getFromPlatform());
            assertEquals("meta", february.get(1).getFromPlatform());
            assertEquals(3, all.size());
            assertEquals(1, latest.size());
            assertEquals("google", latest.get(0).getFromPlatform());
        }
    }
}
