package com.flagship.revenue_ledger.client;

import com.flagship.revenue_ledger.baseline.BaselineService;
import com.flagship.revenue_ledger.client.dto.BaselineRequest;
import com.flagship.revenue_ledger.client.dto.BaselineResponse;
import com.flagship.revenue_ledger.client.dto.ClientSummaryResponse;
import com.flagship.revenue_ledger.client.dto.EntriesPageResponse;
import com.flagship.revenue_ledger.client.dto.TermsRequest;
import com.flagship.revenue_ledger.client.dto.TermsResponse;
import com.flagship.revenue_ledger.config.RequestTimeouts;
import com.flagship.revenue_ledger.config.TransactionRunner;
import com.flagship.revenue_ledger.ledger.DateRange;
import com.flagship.revenue_ledger.ledger.LedgerStore;
import com.flagship.revenue_ledger.order.dto.AttributionResult;
import com.flagship.revenue_ledger.settlement.SettlementService;
import com.flagship.revenue_ledger.settlement.dto.InvoiceResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;

/**
 * Per-client endpoints: dashboard reads, ledger paging, baseline and terms writes,
 * and the monthly settlement.
 */
@RestController
@RequestMapping("/api/v1/ledger/clients/{clientId}")
@RequiredArgsConstructor
public class ClientController {

    private static final int DEFAULT_PAGE_SIZE = 100;

    private final ClientSummaryService summaryService;
    private final BaselineService baselineService;
    private final ClientTermsService termsService;
    private final SettlementService settlementService;
    private final LedgerStore ledgerStore;
    private final TransactionRunner transactionRunner;

    @GetMapping("/summary")
    public ResponseEntity<ClientSummaryResponse> getSummary(
            @PathVariable("clientId") String clientId,
            @RequestHeader(value = RequestTimeouts.HEADER, required = false) Long timeoutMs) {

        return ResponseEntity.ok(summaryService.getSummary(clientId, RequestTimeouts.fromHeader(timeoutMs)));
    }

    @GetMapping("/attributions/live")
    public ResponseEntity<List<AttributionResult>> getLiveAttributions(
            @PathVariable("clientId") String clientId,
            @RequestParam(value = "limit", required = false) Integer limit,
            @RequestHeader(value = RequestTimeouts.HEADER, required = false) Long timeoutMs) {

        List<AttributionResult> live = summaryService
                .getLiveAttributions(clientId, limit, RequestTimeouts.fromHeader(timeoutMs))
                .stream()
                .map(AttributionResult::from)
                .toList();
        return ResponseEntity.ok(live);
    }

    @GetMapping("/entries")
    public ResponseEntity<EntriesPageResponse> getEntries(
            @PathVariable("clientId") String clientId,
            @RequestParam(value = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(value = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            @RequestParam(value = "after", required = false) Long after,
            @RequestParam(value = "limit", required = false) Integer limit,
            @RequestHeader(value = RequestTimeouts.HEADER, required = false) Long timeoutMs) {

        DateRange range = DateRange.ofDates(from, to);
        int pageSize = limit == null ? DEFAULT_PAGE_SIZE : limit;
        return ResponseEntity.ok(EntriesPageResponse.from(transactionRunner.readOnly(
                RequestTimeouts.fromHeader(timeoutMs),
                () -> ledgerStore.query(clientId, range, after, pageSize))));
    }

    @GetMapping("/baseline")
    public ResponseEntity<BaselineResponse> getBaseline(
            @PathVariable("clientId") String clientId,
            @RequestHeader(value = RequestTimeouts.HEADER, required = false) Long timeoutMs) {

        return ResponseEntity.ok(BaselineResponse.from(transactionRunner.readOnly(
                RequestTimeouts.fromHeader(timeoutMs), () -> baselineService.getBaseline(clientId))));
    }

    @PutMapping("/baseline")
    public ResponseEntity<BaselineResponse> upsertBaseline(
            @PathVariable("clientId") String clientId,
            @Valid @RequestBody BaselineRequest request,
            @RequestHeader(value = RequestTimeouts.HEADER, required = false) Long timeoutMs) {

        return ResponseEntity.ok(BaselineResponse.from(transactionRunner.inTransaction(
                RequestTimeouts.fromHeader(timeoutMs),
                () -> baselineService.upsertBaseline(clientId, request.toUpdate()))));
    }

    @GetMapping("/terms")
    public ResponseEntity<TermsResponse> getTerms(@PathVariable("clientId") String clientId) {
        return ResponseEntity.ok(TermsResponse.from(termsService.getTerms(clientId)));
    }

    @PutMapping("/terms")
    public ResponseEntity<TermsResponse> putTerms(
            @PathVariable("clientId") String clientId,
            @Valid @RequestBody TermsRequest request) {

        return ResponseEntity.ok(TermsResponse.from(
                termsService.putTerms(clientId, request.getFeePercentage(), request.getConfidenceThreshold())));
    }

    /**
     * Generates the invoice for a closed month on first call, returns it unchanged afterwards.
     */
    @GetMapping("/settlements/{year}/{month}")
    public ResponseEntity<InvoiceResponse> getSettlement(
            @PathVariable("clientId") String clientId,
            @PathVariable("year") int year,
            @PathVariable("month") int month,
            @RequestHeader(value = RequestTimeouts.HEADER, required = false) Long timeoutMs) {

        Duration timeout = RequestTimeouts.fromHeader(timeoutMs);
        return ResponseEntity.ok(InvoiceResponse.from(
                settlementService.generateOrReturn(clientId, year, month, timeout)));
    }

    @GetMapping("/settlements")
    public ResponseEntity<List<InvoiceResponse>> listSettlements(
            @PathVariable("clientId") String clientId,
            @RequestHeader(value = RequestTimeouts.HEADER, required = false) Long timeoutMs) {

        return ResponseEntity.ok(settlementService.listInvoices(clientId, RequestTimeouts.fromHeader(timeoutMs))
                .stream()
                .map(InvoiceResponse::from)
                .toList());
    }
}
