package com.flagship.revenue_ledger.settlement;

import com.flagship.revenue_ledger.config.RequestTimeouts;
import com.flagship.revenue_ledger.order.dto.AttributionResult;
import com.flagship.revenue_ledger.settlement.dto.DisputeRequest;
import com.flagship.revenue_ledger.settlement.dto.InvoiceResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Invoice lifecycle: draft -> sent -> paid | disputed. Repeating the transition an
 * invoice already went through returns it unchanged; any other move answers 409.
 */
@RestController
@RequestMapping("/api/v1/ledger/settlements")
@RequiredArgsConstructor
public class SettlementController {

    private final SettlementService settlementService;

    @GetMapping("/{invoiceId}")
    public ResponseEntity<InvoiceResponse> getInvoice(
            @PathVariable("invoiceId") UUID invoiceId,
            @RequestHeader(value = RequestTimeouts.HEADER, required = false) Long timeoutMs) {

        return ResponseEntity.ok(InvoiceResponse.from(
                settlementService.getInvoice(invoiceId, RequestTimeouts.fromHeader(timeoutMs))));
    }

    @GetMapping("/{invoiceId}/entries")
    public ResponseEntity<List<AttributionResult>> getInvoiceEntries(
            @PathVariable("invoiceId") UUID invoiceId,
            @RequestHeader(value = RequestTimeouts.HEADER, required = false) Long timeoutMs) {

        return ResponseEntity.ok(settlementService.getInvoiceEntries(invoiceId, RequestTimeouts.fromHeader(timeoutMs))
                .stream()
                .map(AttributionResult::from)
                .toList());
    }

    @PostMapping("/{invoiceId}/send")
    public ResponseEntity<InvoiceResponse> markSent(
            @PathVariable("invoiceId") UUID invoiceId,
            @RequestHeader(value = RequestTimeouts.HEADER, required = false) Long timeoutMs) {

        return ResponseEntity.ok(InvoiceResponse.from(
                settlementService.markSent(invoiceId, RequestTimeouts.fromHeader(timeoutMs))));
    }

    @PostMapping("/{invoiceId}/pay")
    public ResponseEntity<InvoiceResponse> markPaid(
            @PathVariable("invoiceId") UUID invoiceId,
            @RequestHeader(value = RequestTimeouts.HEADER, required = false) Long timeoutMs) {

        return ResponseEntity.ok(InvoiceResponse.from(
                settlementService.markPaid(invoiceId, RequestTimeouts.fromHeader(timeoutMs))));
    }

    @PostMapping("/{invoiceId}/dispute")
    public ResponseEntity<InvoiceResponse> markDisputed(
            @PathVariable("invoiceId") UUID invoiceId,
            @Valid @RequestBody DisputeRequest request,
            @RequestHeader(value = RequestTimeouts.HEADER, required = false) Long timeoutMs) {

        return ResponseEntity.ok(InvoiceResponse.from(
                settlementService.markDisputed(invoiceId, request.getReason(), RequestTimeouts.fromHeader(timeoutMs))));
    }
}
