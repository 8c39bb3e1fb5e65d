package com.flagship.revenue_ledger.outbox;

import com.flagship.revenue_ledger.event.OrderAttributedEvent;
import com.flagship.revenue_ledger.observability.CorrelationContext;
import com.flagship.revenue_ledger.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Relays outbox events to Kafka.
 *
 * Rows are locked with {@code FOR UPDATE SKIP LOCKED}, so several instances can
 * poll side by side. Each event is sent synchronously, keyed by client id, and
 * carries its correlation id as a header. Consumers rely on a client's events
 * arriving in ledger order, so once a send fails the remaining events of that
 * client wait for the next poll.
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    enum Relay { PUBLISHED, FAILED, EXHAUSTED, HELD_BACK }

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${kafka.topic.ledger-entries:ledger-entries}")
    private String ledgerEntriesTopic;

    @Value("${kafka.topic.settlements:ledger-settlements}")
    private String settlementsTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.send-timeout-ms:10000}")
    private long sendTimeoutMs;

    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        List<OutboxEvent> events;
        try {
            events = outboxService.findRelayableEvents(batchSize);
        } catch (RuntimeException e) {
            log.error("Outbox poll failed: {}", e.getMessage(), e);
            return;
        }
        if (events.isEmpty()) {
            return;
        }

        Set<String> blockedClients = new HashSet<>();
        int published = 0;
        for (OutboxEvent event : events) {
            if (relay(event, blockedClients) == Relay.PUBLISHED) {
                published++;
            }
        }
        log.debug("Outbox batch relayed: published={}, of={}, clientsHeldBack={}",
                published, events.size(), blockedClients.size());
    }

    Relay relay(OutboxEvent event, Set<String> blockedClients) {
        if (blockedClients.contains(event.getClientId())) {
            return Relay.HELD_BACK;
        }

        String topic = topicFor(event);
        try {
            SendResult<String, String> result = kafkaTemplate.send(toRecord(topic, event))
                    .get(sendTimeoutMs, TimeUnit.MILLISECONDS);

            log.debug("Relayed {}: outboxId={}, clientId={}, partition={}, offset={}",
                    event.getEventType(), event.getId(), event.getClientId(),
                    result.getRecordMetadata().partition(), result.getRecordMetadata().offset());

            outboxService.markPublished(event.getId());
            outboxMetrics.recordRelay(event.getEventType(), topic, Relay.PUBLISHED.name());
            return Relay.PUBLISHED;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return failed(event, topic, "interrupted", blockedClients);
        } catch (Exception e) {
            log.error("Relay of {} to {} failed: outboxId={}, clientId={}, error={}",
                    event.getEventType(), topic, event.getId(), event.getClientId(), e.getMessage());
            return failed(event, topic, e.getMessage(), blockedClients);
        }
    }

    private Relay failed(OutboxEvent event, String topic, String error, Set<String> blockedClients) {
        blockedClients.add(event.getClientId());
        boolean exhausted = outboxService.markFailed(event.getId(), error)
                .map(updated -> updated.isExhausted(outboxService.getMaxRetries()))
                .orElse(false);
        if (exhausted) {
            log.warn("Outbox event {} exhausted its retries, leaving it for manual replay. eventType={}, clientId={}",
                    event.getId(), event.getEventType(), event.getClientId());
            outboxMetrics.recordRelay(event.getEventType(), topic, Relay.EXHAUSTED.name());
            return Relay.EXHAUSTED;
        }
        outboxMetrics.recordRelay(event.getEventType(), topic, Relay.FAILED.name());
        return Relay.FAILED;
    }

    private static ProducerRecord<String, String> toRecord(String topic, OutboxEvent event) {
        ProducerRecord<String, String> record = new ProducerRecord<>(topic, event.getClientId(), event.getPayload());
        record.headers().add("event-type", event.getEventType().getBytes(StandardCharsets.UTF_8));
        if (event.getCorrelationId() != null) {
            record.headers().add(CorrelationContext.CORRELATION_ID_HEADER,
                    event.getCorrelationId().getBytes(StandardCharsets.UTF_8));
        }
        return record;
    }

    String topicFor(OutboxEvent event) {
        return OrderAttributedEvent.AGGREGATE_TYPE.equals(event.getAggregateType())
                ? ledgerEntriesTopic
                : settlementsTopic;
    }
}
