package com.flagship.revenue_ledger.outbox;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface OutboxEventRepository extends JpaRepository<OutboxEventEntity, UUID> {

    /**
     * Oldest relayable events, locked so that concurrent publishers skip each other's rows.
     * Exhausted events stay out of the batch.
     */
    @Query(value = """
        SELECT * FROM outbox_events
        WHERE published_at IS NULL AND retry_count < :maxRetries
        ORDER BY created_at ASC, id ASC
        LIMIT :limit
        FOR UPDATE SKIP LOCKED
        """, nativeQuery = true)
    List<OutboxEventEntity> findRelayableForUpdate(@Param("maxRetries") int maxRetries, @Param("limit") int limit);

    List<OutboxEventEntity> findByClientIdAndEventTypeOrderByCreatedAtAsc(String clientId, String eventType);

    @Query("SELECT COUNT(e) FROM OutboxEventEntity e WHERE e.publishedAt IS NULL")
    long countUnpublished();

    @Query("SELECT COUNT(e) FROM OutboxEventEntity e WHERE e.publishedAt IS NULL AND e.retryCount >= :maxRetries")
    long countExhausted(@Param("maxRetries") int maxRetries);

    @Query("SELECT MIN(e.createdAt) FROM OutboxEventEntity e WHERE e.publishedAt IS NULL")
    Optional<Instant> findOldestUnpublishedCreatedAt();
}
