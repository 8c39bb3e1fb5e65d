package com.flagship.revenue_ledger.order;

import com.flagship.revenue_ledger.config.RequestTimeouts;
import com.flagship.revenue_ledger.order.dto.AttributionResult;
import com.flagship.revenue_ledger.order.dto.OrderAttributionResponse;
import com.flagship.revenue_ledger.order.dto.RecordOrderRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for order attribution.
 *
 * {@code POST /orders} is idempotent on {@code (client_id, external_order_id)}: the
 * first call answers 201, repeats answer 200 with the original entry.
 */
@RestController
@RequestMapping("/api/v1/ledger")
@RequiredArgsConstructor
public class OrderController {

    private final OrderAttributionService orderAttributionService;

    @PostMapping("/orders")
    public ResponseEntity<AttributionResult> recordOrder(
            @Valid @RequestBody RecordOrderRequest request,
            @RequestHeader(value = RequestTimeouts.HEADER, required = false) Long timeoutMs) {

        AttributionResult result = orderAttributionService.recordOrder(request, RequestTimeouts.fromHeader(timeoutMs));
        return ResponseEntity.status(result.isDuplicate() ? HttpStatus.OK : HttpStatus.CREATED).body(result);
    }

    @GetMapping("/clients/{clientId}/orders/{externalOrderId}")
    public ResponseEntity<OrderAttributionResponse> getOrderAttribution(
            @PathVariable("clientId") String clientId,
            @PathVariable("externalOrderId") String externalOrderId,
            @RequestHeader(value = RequestTimeouts.HEADER, required = false) Long timeoutMs) {

        return ResponseEntity.ok(orderAttributionService.getOrderAttribution(
                clientId, externalOrderId, RequestTimeouts.fromHeader(timeoutMs)));
    }

    @PostMapping("/clients/{clientId}/orders/{externalOrderId}/anonymize")
    public ResponseEntity<AttributionResult> anonymize(
            @PathVariable("clientId") String clientId,
            @PathVariable("externalOrderId") String externalOrderId,
            @RequestHeader(value = RequestTimeouts.HEADER, required = false) Long timeoutMs) {

        return ResponseEntity.ok(orderAttributionService.anonymize(
                clientId, externalOrderId, RequestTimeouts.fromHeader(timeoutMs)));
    }
}
