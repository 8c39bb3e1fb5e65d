package com.flagship.revenue_ledger.order;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.revenue_ledger.baseline.BaselineService;
import com.flagship.revenue_ledger.order.dto.RecordOrderRequest;
import com.flagship.revenue_ledger.security.InternalApiKeyFilter;
import com.flagship.revenue_ledger.support.LedgerFixtures;
import com.flagship.revenue_ledger.support.MutableClock;
import com.flagship.revenue_ledger.support.TestClockConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.math.BigDecimal;
import java.time.Instant;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * REST surface end to end: API key check, status codes, snake_case bodies and the
 * error envelope.
 */
@SpringBootTest
@AutoConfigureMockMvc
@Import(TestClockConfig.class)
class OrderControllerTest {

    private static final String API_KEY = "test-internal-key";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private BaselineService baselineService;

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

    @BeforeEach
    void setUp() {
        clock.setInstant(Instant.parse("2026-01-15T10:00:00Z"));
        clientId = LedgerFixtures.newClientId();
        baselineService.upsertBaseline(clientId, LedgerFixtures.standardBaseline());
    }

    private String json(RecordOrderRequest request) throws Exception {
        return objectMapper.writeValueAsString(request);
    }

    private MvcResult postOrder(RecordOrderRequest request) throws Exception {
        return mockMvc.perform(post("/api/v1/ledger/orders")
                        .header(InternalApiKeyFilter.HEADER, API_KEY)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(request)))
                .andReturn();
    }

    @Nested
    @DisplayName("POST /api/v1/ledger/orders")
    class RecordOrder {

        @Test
        @DisplayName("201 on first submission, 200 with the same entry on retry")
        void createdThenDuplicate() throws Exception {
            printTestHeader("Record order twice over REST");
            RecordOrderRequest request = LedgerFixtures.order(clientId, "web-1").build();
            printInput("Request", json(request));

            MvcResult first = postOrder(request);
            MvcResult second = postOrder(request);

            printOutput("First status", first.getResponse().getStatus());
            printOutput("Second status", second.getResponse().getStatus());
            assertEquals(201, first.getResponse().getStatus());
            assertEquals(200, second.getResponse().getStatus());

            JsonNode created = objectMapper.readTree(first.getResponse().getContentAsString());
            JsonNode replayed = objectMapper.readTree(second.getResponse().getContentAsString());
            assertEquals(created.get("entry_hash").asText(), replayed.get("entry_hash").asText());
            assertFalse(created.get("duplicate").asBoolean());
            assertTrue(replayed.get("duplicate").asBoolean());
            assertTrue(first.getResponse().getContentAsString().contains("\"fee_amount\":6.00"));
            assertTrue(created.get("attributed").asBoolean());
            printSuccess("Retry answered with the original entry");
        }

        @Test
        @DisplayName("401 without the internal API key")
        void missingKey() throws Exception {
            mockMvc.perform(post("/api/v1/ledger/orders")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(json(LedgerFixtures.order(clientId, "web-2").build())))
                    .andExpect(status().isUnauthorized())
                    .andExpect(jsonPath("$.error").value("UNAUTHORIZED"));
        }

        @Test
        @DisplayName("401 with a wrong internal API key")
        void wrongKey() throws Exception {
            mockMvc.perform(post("/api/v1/ledger/orders")
                            .header(InternalApiKeyFilter.HEADER, "not-the-key")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(json(LedgerFixtures.order(clientId, "web-3").build())))
                    .andExpect(status().isUnauthorized())
                    .andExpect(jsonPath("$.message").value("Invalid internal API key"));
        }

        @Test
        @DisplayName("400 when confidence is outside [0, 1]")
        void invalidConfidence() throws Exception {
            MvcResult result = postOrder(LedgerFixtures.order(clientId, "web-4")
                    .attributionConfidence(new BigDecimal("1.5"))
                    .build());

            assertEquals(400, result.getResponse().getStatus());
            JsonNode body = objectMapper.readTree(result.getResponse().getContentAsString());
            assertEquals("VALIDATION_FAILED", body.get("error").asText());
            assertNotNull(body.get("details"));
        }

        @Test
        @DisplayName("400 on malformed JSON")
        void malformedBody() throws Exception {
            mockMvc.perform(post("/api/v1/ledger/orders")
                            .header(InternalApiKeyFilter.HEADER, API_KEY)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"client_id\": "))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error").value("VALIDATION_FAILED"));
        }

        @Test
        @DisplayName("412 when the client has no baseline")
        void missingBaseline() throws Exception {
            MvcResult result = postOrder(LedgerFixtures.order(LedgerFixtures.newClientId(), "web-5").build());

            assertEquals(412, result.getResponse().getStatus());
            assertEquals("BASELINE_MISSING",
                    objectMapper.readTree(result.getResponse().getContentAsString()).get("error").asText());
        }
    }

    @Nested
    @DisplayName("Client reads")
    class ClientReads {

        @Test
        @DisplayName("Summary reflects recorded orders")
        void summary() throws Exception {
            postOrder(LedgerFixtures.order(clientId, "web-s1").build());
            postOrder(LedgerFixtures.order(clientId, "web-s2")
                    .attributionConfidence(new BigDecimal("0.20"))
                    .build());

            mockMvc.perform(get("/api/v1/ledger/clients/{clientId}/summary", clientId)
                            .header(InternalApiKeyFilter.HEADER, API_KEY))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.client_id").value(clientId))
                    .andExpect(jsonPath("$.total_orders").value(2))
                    .andExpect(jsonPath("$.attributed_orders").value(1))
                    .andExpect(content().string(containsString("\"attribution_rate\":50.00")))
                    .andExpect(jsonPath("$.baseline.data_quality").exists());
        }

        @Test
        @DisplayName("Order lookup returns the attribution log")
        void orderLookup() throws Exception {
            postOrder(LedgerFixtures.order(clientId, "web-l1").build());

            mockMvc.perform(get("/api/v1/ledger/clients/{clientId}/orders/{orderId}", clientId, "web-l1")
                            .header(InternalApiKeyFilter.HEADER, API_KEY))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.entry.external_order_id").value("web-l1"))
                    .andExpect(jsonPath("$.attribution_log.decision_engine")
                            .value(OrderAttributionService.DECISION_ENGINE));
        }

        @Test
        @DisplayName("404 for an unknown order")
        void unknownOrder() throws Exception {
            mockMvc.perform(get("/api/v1/ledger/clients/{clientId}/orders/{orderId}", clientId, "nope")
                            .header(InternalApiKeyFilter.HEADER, API_KEY))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.error").value("NOT_FOUND"));
        }

        @Test
        @DisplayName("Audit CSV is streamed with a header row")
        void auditCsv() throws Exception {
            postOrder(LedgerFixtures.order(clientId, "web-a1").build());

            MvcResult started = mockMvc.perform(get("/api/v1/ledger/clients/{clientId}/audit.csv", clientId)
                            .header(InternalApiKeyFilter.HEADER, API_KEY))
                    .andExpect(request().asyncStarted())
                    .andReturn();

            mockMvc.perform(asyncDispatch(started))
                    .andExpect(status().isOk())
                    .andExpect(header().string("Content-Disposition", containsString("attachment")))
                    .andExpect(content().string(startsWith("EntryHash,PreviousHash,Sequence")))
                    .andExpect(content().string(containsString(",web-a1,99.99,true,")));
        }

        @Test
        @DisplayName("400 for a live-feed limit above the maximum")
        void liveLimit() throws Exception {
            mockMvc.perform(get("/api/v1/ledger/clients/{clientId}/attributions/live", clientId)
                            .param("limit", "1000")
                            .header(InternalApiKeyFilter.HEADER, API_KEY))
                    .andExpect(status().isBadRequest());
        }

        @Test
        @DisplayName("400 for terms outside their ranges")
        void invalidTerms() throws Exception {
            mockMvc.perform(put("/api/v1/ledger/clients/{clientId}/terms", clientId)
                            .header(InternalApiKeyFilter.HEADER, API_KEY)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"fee_percentage\": 1.5, \"confidence_threshold\": 0.7}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error").value("VALIDATION_FAILED"));
        }
    }

    @Nested
    @DisplayName("Settlements")
    class Settlements {

        @Test
        @DisplayName("Invoice is generated after month end and moves through its lifecycle")
        void lifecycle() throws Exception {
            printTestHeader("Settlement over REST");
            postOrder(LedgerFixtures.order(clientId, "web-m1").orderAmount(new BigDecimal("8000.00")).build());
            clock.setInstant(Instant.parse("2026-02-02T08:00:00Z"));

            MvcResult generated = mockMvc.perform(
                            get("/api/v1/ledger/clients/{clientId}/settlements/{year}/{month}", clientId, 2026, 1)
                                    .header(InternalApiKeyFilter.HEADER, API_KEY))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.status").value("DRAFT"))
                    .andExpect(jsonPath("$.billing_period").value("2026-01"))
                    .andReturn();
            String invoiceId = objectMapper.readTree(generated.getResponse().getContentAsString())
                    .get("invoice_id").asText();
            printOutput("Invoice", invoiceId);

            mockMvc.perform(get("/api/v1/ledger/settlements/{invoiceId}/entries", invoiceId)
                            .header(InternalApiKeyFilter.HEADER, API_KEY))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.length()").value(1))
                    .andExpect(jsonPath("$[0].external_order_id").value("web-m1"))
                    .andExpect(jsonPath("$[0].invoice_id").value(invoiceId));

            mockMvc.perform(post("/api/v1/ledger/settlements/{invoiceId}/pay", invoiceId)
                            .header(InternalApiKeyFilter.HEADER, API_KEY))
                    .andExpect(status().isConflict());
            mockMvc.perform(post("/api/v1/ledger/settlements/{invoiceId}/send", invoiceId)
                            .header(InternalApiKeyFilter.HEADER, API_KEY))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.status").value("SENT"));
            mockMvc.perform(post("/api/v1/ledger/settlements/{invoiceId}/dispute", invoiceId)
                            .header(InternalApiKeyFilter.HEADER, API_KEY)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"reason\": \"Refunds not deducted\"}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.status").value("DISPUTED"))
                    .andExpect(jsonPath("$.dispute_reason").value("Refunds not deducted"));
            printSuccess("DRAFT -> SENT -> DISPUTED");
        }

        @Test
        @DisplayName("400 for a period that has not ended")
        void openPeriod() throws Exception {
            mockMvc.perform(get("/api/v1/ledger/clients/{clientId}/settlements/{year}/{month}", clientId, 2026, 1)
                            .header(InternalApiKeyFilter.HEADER, API_KEY))
                    .andExpect(status().isBadRequest());
        }
    }

    @Test
    @DisplayName("Health endpoint needs no API key")
    void health() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk());
    }
}
