package com.flagship.revenue_ledger.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Events published through the outbox. Facts about what the ledger recorded,
 * keyed by client so one client's events stay ordered.
 */
public interface LedgerEvent {

    UUID getEventId();

    String getClientId();

    Instant getOccurredAt();

    /** Outbox aggregate type; selects the Kafka topic. */
    String getAggregateType();

    String getEventType();
}
