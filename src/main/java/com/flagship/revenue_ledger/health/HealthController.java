package com.flagship.revenue_ledger.health;

import com.flagship.revenue_ledger.observability.OutboxMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness probe for load balancers. Outside {@code /api/**}, so it needs no
 * internal key.
 *
 * Only the ledger database decides UP or DOWN: orders cannot be recorded without
 * it. The outbox backlog is reported for information and comes from the cached
 * metrics, so the probe runs a single query.
 */
@RestController
@Slf4j
public class HealthController {

    private static final int PROBE_TIMEOUT_SECONDS = 2;

    private final JdbcTemplate probeTemplate;
    private final OutboxMetrics outboxMetrics;
    private final Clock clock;

    public HealthController(JdbcTemplate jdbcTemplate, OutboxMetrics outboxMetrics, Clock clock) {
        this.probeTemplate = new JdbcTemplate(jdbcTemplate.getDataSource());
        this.probeTemplate.setQueryTimeout(PROBE_TIMEOUT_SECONDS);
        this.outboxMetrics = outboxMetrics;
        this.clock = clock;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        boolean ledgerUp = ledgerReachable();

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", ledgerUp ? "UP" : "DOWN");
        response.put("timestamp", clock.instant().toString());
        response.put("ledgerDatabase", ledgerUp ? "UP" : "DOWN");
        response.put("outboxBacklog", outboxMetrics.getBacklog().size());

        return ResponseEntity.status(ledgerUp ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(response);
    }

    private boolean ledgerReachable() {
        try {
            probeTemplate.queryForObject("SELECT COUNT(*) FROM client_terms WHERE 1 = 0", Long.class);
            return true;
        } catch (DataAccessException e) {
            log.warn("Ledger database health check failed: {}", e.getMessage());
            return false;
        }
    }
}
