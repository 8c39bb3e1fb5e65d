package com.flagship.revenue_ledger.outbox;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Row of {@code outbox_events}. Only the relay bookkeeping columns are updatable.
 */
@Entity
@Table(name = "outbox_events")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class OutboxEventEntity {

    private static final int MAX_ERROR_LENGTH = 2000;

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "aggregate_type", nullable = false, updatable = false, length = 100)
    private String aggregateType;

    @Column(name = "client_id", nullable = false, updatable = false, length = 64)
    private String clientId;

    @Column(name = "event_type", nullable = false, updatable = false, length = 100)
    private String eventType;

    @Column(name = "payload", nullable = false, updatable = false, length = 10000)
    private String payload;

    @Column(name = "correlation_id", updatable = false, length = 64)
    private String correlationId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "published_at")
    private Instant publishedAt;

    @Column(name = "retry_count", nullable = false)
    private int retryCount;

    @Column(name = "last_error", length = MAX_ERROR_LENGTH)
    private String lastError;

    static OutboxEventEntity fromDomain(OutboxEvent event) {
        OutboxEventEntity entity = new OutboxEventEntity();
        entity.id = event.getId();
        entity.aggregateType = event.getAggregateType();
        entity.clientId = event.getClientId();
        entity.eventType = event.getEventType();
        entity.payload = event.getPayload();
        entity.correlationId = event.getCorrelationId();
        entity.createdAt = event.getCreatedAt();
        entity.publishedAt = event.getPublishedAt();
        entity.retryCount = event.getRetryCount();
        entity.lastError = event.getLastError();
        return entity;
    }

    public OutboxEvent toDomain() {
        return new OutboxEvent(id, aggregateType, clientId, eventType, payload, correlationId,
                createdAt, publishedAt, retryCount, lastError);
    }

    void markPublished(Instant now) {
        this.publishedAt = now;
        this.lastError = null;
    }

    void markFailed(String errorMessage) {
        this.retryCount++;
        this.lastError = errorMessage != null && errorMessage.length() > MAX_ERROR_LENGTH
                ? errorMessage.substring(0, MAX_ERROR_LENGTH)
                : errorMessage;
    }
}
