package com.flagship.revenue_ledger.observability;

import com.flagship.revenue_ledger.settlement.InvoiceStatus;
import com.flagship.revenue_ledger.settlement.SettlementInvoiceRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Refreshes the gauges that need a database read: the outbox backlog and the
 * number of invoices in each lifecycle status ({@code ledger.invoices{status}}).
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MetricsScheduler {

    private final OutboxMetrics outboxMetrics;
    private final SettlementInvoiceRepository invoiceRepository;
    private final MeterRegistry meterRegistry;

    private final Map<InvoiceStatus, AtomicLong> invoicesByStatus = new EnumMap<>(InvoiceStatus.class);

    @PostConstruct
    public void registerInvoiceGauges() {
        for (InvoiceStatus status : InvoiceStatus.values()) {
            AtomicLong count = new AtomicLong();
            invoicesByStatus.put(status, count);
            Gauge.builder("ledger.invoices", count, AtomicLong::get)
                    .description("Settlement invoices by lifecycle status")
                    .tag("status", status.name().toLowerCase())
                    .register(meterRegistry);
        }
    }

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refresh() {
        outboxMetrics.refreshMetrics();
        refreshInvoiceGauges();
    }

    void refreshInvoiceGauges() {
        try {
            invoicesByStatus.forEach((status, count) -> count.set(invoiceRepository.countByStatus(status)));
        } catch (RuntimeException e) {
            log.warn("Failed to refresh invoice gauges: {}", e.getMessage());
        }
    }

    long invoiceCount(InvoiceStatus status) {
        return invoicesByStatus.get(status).get();
    }
}
