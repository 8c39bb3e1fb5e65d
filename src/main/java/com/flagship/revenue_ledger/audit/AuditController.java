package com.flagship.revenue_ledger.audit;

import com.flagship.revenue_ledger.config.RequestTimeouts;
import com.flagship.revenue_ledger.ledger.DateRange;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;

/**
 * Audit trail export. {@code from} and {@code to} are inclusive UTC dates; either
 * may be omitted.
 */
@RestController
@RequestMapping("/api/v1/ledger/clients/{clientId}")
@RequiredArgsConstructor
public class AuditController {

    private static final MediaType TEXT_CSV = new MediaType("text", "csv", StandardCharsets.UTF_8);

    private final AuditExportService auditExportService;

    @GetMapping("/audit")
    public ResponseEntity<List<AuditRecord>> export(
            @PathVariable("clientId") String clientId,
            @RequestParam(value = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(value = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            @RequestHeader(value = RequestTimeouts.HEADER, required = false) Long timeoutMs) {

        return ResponseEntity.ok(auditExportService.export(
                clientId, DateRange.ofDates(from, to), RequestTimeouts.fromHeader(timeoutMs)));
    }

    @GetMapping("/audit.csv")
    public ResponseEntity<StreamingResponseBody> exportCsv(
            @PathVariable("clientId") String clientId,
            @RequestParam(value = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(value = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            @RequestHeader(value = RequestTimeouts.HEADER, required = false) Long timeoutMs) {

        DateRange range = DateRange.ofDates(from, to);
        Duration timeout = RequestTimeouts.fromHeader(timeoutMs);
        StreamingResponseBody body = out -> {
            Writer writer = new OutputStreamWriter(out, StandardCharsets.UTF_8);
            auditExportService.exportCsv(clientId, range, writer, timeout);
        };
        return ResponseEntity.ok()
                .contentType(TEXT_CSV)
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"audit-" + clientId + ".csv\"")
                .body(body);
    }

    @GetMapping("/audit/verify")
    public ResponseEntity<VerificationReport> verify(
            @PathVariable("clientId") String clientId,
            @RequestParam(value = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(value = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            @RequestHeader(value = RequestTimeouts.HEADER, required = false) Long timeoutMs) {

        return ResponseEntity.ok(auditExportService.verify(
                clientId, DateRange.ofDates(from, to), RequestTimeouts.fromHeader(timeoutMs)));
    }
}
