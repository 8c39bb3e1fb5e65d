package com.flagship.revenue_ledger.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.revenue_ledger.event.LedgerEvent;
import com.flagship.revenue_ledger.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Outbox reads and writes.
 *
 * {@link #saveEvent} joins the transaction of the ledger append or invoice change;
 * the relay side ({@link OutboxPublisher}) works in short transactions of its own.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxService {

    private final OutboxEventRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries = 5;

    /**
     * Must be called within an existing transaction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent saveEvent(LedgerEvent event) {
        OutboxEvent outboxEvent = OutboxEvent.of(event, serializePayload(event),
                CorrelationContext.current(), clock.instant());
        repository.save(OutboxEventEntity.fromDomain(outboxEvent));

        log.debug("Queued {} for client {}: outboxId={}",
                event.getEventType(), event.getClientId(), outboxEvent.getId());
        return outboxEvent;
    }

    /**
     * Next batch to relay, oldest first. Exhausted events are not returned.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<OutboxEvent> findRelayableEvents(int limit) {
        return repository.findRelayableForUpdate(maxRetries, limit)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markPublished(UUID eventId) {
        repository.findById(eventId).ifPresent(entity -> entity.markPublished(clock.instant()));
    }

    /**
     * @return the event after the failure was counted, empty if it no longer exists
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Optional<OutboxEvent> markFailed(UUID eventId, String errorMessage) {
        return repository.findById(eventId).map(entity -> {
            entity.markFailed(errorMessage);
            log.warn("Relay of outbox event {} failed (attempt {} of {}): {}",
                    eventId, entity.getRetryCount(), maxRetries, errorMessage);
            return entity.toDomain();
        });
    }

    @Transactional(readOnly = true)
    public List<OutboxEvent> getEvents(String eventType, String clientId) {
        return repository.findByClientIdAndEventTypeOrderByCreatedAtAsc(clientId, eventType)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    private String serializePayload(LedgerEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + event.getEventType() + " event", e);
        }
    }
}
