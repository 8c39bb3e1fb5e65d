package com.flagship.revenue_ledger.budget;

import com.flagship.revenue_ledger.budget.dto.BudgetReallocationRequest;
import com.flagship.revenue_ledger.budget.dto.BudgetReallocationResponse;
import com.flagship.revenue_ledger.config.RequestTimeouts;
import com.flagship.revenue_ledger.ledger.DateRange;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/v1/ledger/clients/{clientId}/budget-reallocations")
@RequiredArgsConstructor
public class BudgetReallocationController {

    private final BudgetReallocationService service;

    @PostMapping
    public ResponseEntity<BudgetReallocationResponse> record(
            @PathVariable("clientId") String clientId,
            @RequestBody BudgetReallocationRequest request,
            @RequestHeader(value = RequestTimeouts.HEADER, required = false) Long timeoutMs) {

        return ResponseEntity.status(HttpStatus.CREATED).body(BudgetReallocationResponse.from(
                service.record(clientId, request, RequestTimeouts.fromHeader(timeoutMs))));
    }

    @GetMapping
    public ResponseEntity<List<BudgetReallocationResponse>> list(
            @PathVariable("clientId") String clientId,
            @RequestParam(value = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(value = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            @RequestParam(value = "limit", required = false) Integer limit,
            @RequestHeader(value = RequestTimeouts.HEADER, required = false) Long timeoutMs) {

        return ResponseEntity.ok(service.list(clientId, DateRange.ofDates(from, to), limit,
                        RequestTimeouts.fromHeader(timeoutMs))
                .stream()
                .map(BudgetReallocationResponse::from)
                .toList());
    }
}
