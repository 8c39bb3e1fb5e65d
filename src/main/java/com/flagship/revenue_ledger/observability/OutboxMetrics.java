package com.flagship.revenue_ledger.observability;

import com.flagship.revenue_ledger.outbox.OutboxEventRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Relay counters and a cached view of the outbox backlog.
 *
 * The backlog is read by {@link MetricsScheduler}; gauges and health checks only see
 * the cached {@link Backlog}, so a Prometheus scrape never queries the database.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutboxMetrics {

    /**
     * Unpublished events, the age of the oldest one, and how many ran out of retries.
     */
    public record Backlog(long size, long oldestAgeSeconds, long exhausted) {
        static final Backlog EMPTY = new Backlog(0, 0, 0);
    }

    private final OutboxEventRepository outboxRepository;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    private final AtomicReference<Backlog> backlog = new AtomicReference<>(Backlog.EMPTY);

    @PostConstruct
    public void init() {
        Gauge.builder("outbox.backlog.size", backlog, ref -> ref.get().size())
                .description("Ledger events waiting to be relayed to Kafka")
                .register(meterRegistry);
        Gauge.builder("outbox.backlog.age.seconds", backlog, ref -> ref.get().oldestAgeSeconds())
                .description("Age of the oldest unrelayed ledger event")
                .register(meterRegistry);
        Gauge.builder("outbox.events.exhausted", backlog, ref -> ref.get().exhausted())
                .description("Ledger events that ran out of relay attempts and need a manual replay")
                .register(meterRegistry);
    }

    @Transactional(readOnly = true)
    public void refreshMetrics() {
        try {
            long oldestAge = outboxRepository.findOldestUnpublishedCreatedAt()
                    .map(oldest -> Math.max(0, Duration.between(oldest, clock.instant()).getSeconds()))
                    .orElse(0L);
            Backlog current = new Backlog(outboxRepository.countUnpublished(), oldestAge,
                    outboxRepository.countExhausted(maxRetries));
            backlog.set(current);
            log.debug("Outbox backlog refreshed: {}", current);
        } catch (RuntimeException e) {
            log.warn("Failed to refresh outbox metrics, keeping the previous values: {}", e.getMessage());
        }
    }

    public Backlog getBacklog() {
        return backlog.get();
    }

    /**
     * @param result PUBLISHED, FAILED or EXHAUSTED
     */
    public void recordRelay(String eventType, String topic, String result) {
        meterRegistry.counter("outbox.events.relayed",
                "event_type", eventType,
                "topic", topic,
                "result", result.toLowerCase()).increment();
    }
}
