package com.flagship.revenue_ledger.ledger;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface LedgerEntryRepository extends JpaRepository<LedgerEntryEntity, Long> {

    Optional<LedgerEntryEntity> findByEntryHash(String entryHash);

    Optional<LedgerEntryEntity> findByClientIdAndExternalOrderId(String clientId, String externalOrderId);

    /**
     * Head of the client's hash chain.
     */
    Optional<LedgerEntryEntity> findFirstByClientIdOrderByIdDesc(String clientId);

    /**
     * Keyset page in append order. Restartable: pass the last seen id as {@code afterId}.
     */
    @Query("""
        SELECT e FROM LedgerEntryEntity e
        WHERE e.clientId = :clientId
          AND e.createdAt >= :from AND e.createdAt < :to
          AND e.id > :afterId
        ORDER BY e.id ASC
        """)
    List<LedgerEntryEntity> findPage(@Param("clientId") String clientId,
                                     @Param("from") Instant from,
                                     @Param("to") Instant to,
                                     @Param("afterId") long afterId,
                                     Pageable pageable);

    @Query("""
        SELECT e FROM LedgerEntryEntity e
        WHERE e.clientId = :clientId AND e.attributed = true
        ORDER BY e.id DESC
        """)
    List<LedgerEntryEntity> findRecentAttributed(@Param("clientId") String clientId, Pageable pageable);

    List<LedgerEntryEntity> findByInvoiceIdOrderByIdAsc(UUID invoiceId);

    @Query("""
        SELECT new com.flagship.revenue_ledger.ledger.ReportedAdSpend(
                   COUNT(e), SUM(e.adSpendForOrder), SUM(e.baselineAdSpend))
        FROM LedgerEntryEntity e
        WHERE e.clientId = :clientId AND e.createdAt >= :from AND e.createdAt < :to
          AND e.adSpendForOrder IS NOT NULL
        """)
    ReportedAdSpend sumReportedAdSpend(@Param("clientId") String clientId,
                                       @Param("from") Instant from,
                                       @Param("to") Instant to);

    long countByClientId(String clientId);

    long countByClientIdAndAttributedTrue(String clientId);
}
