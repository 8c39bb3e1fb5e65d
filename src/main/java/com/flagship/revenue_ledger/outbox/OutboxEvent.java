package com.flagship.revenue_ledger.outbox;

import com.flagship.revenue_ledger.event.LedgerEvent;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A ledger event waiting to be relayed to Kafka.
 *
 * Stored in the transaction that appended the entry or changed the invoice, so a
 * rolled back change never leaves an event behind. The client id doubles as the
 * Kafka key; the correlation id travels as a record header.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;
    String clientId;
    String eventType;
    String payload;
    String correlationId;      // null when written outside a request or order event
    Instant createdAt;
    Instant publishedAt;
    int retryCount;
    String lastError;

    public static OutboxEvent of(LedgerEvent event, String payload, String correlationId, Instant now) {
        return new OutboxEvent(
            UUID.randomUUID(),
            event.getAggregateType(),
            event.getClientId(),
            event.getEventType(),
            payload,
            correlationId,
            now,
            null,
            0,
            null
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }

    /** Left for manual replay once the publisher has given up on it. */
    public boolean isExhausted(int maxRetries) {
        return retryCount >= maxRetries;
    }
}
