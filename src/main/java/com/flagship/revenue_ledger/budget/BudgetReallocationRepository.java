package com.flagship.revenue_ledger.budget;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface BudgetReallocationRepository extends JpaRepository<BudgetReallocationEntity, Long> {

    /**
     * Newest first; ties on {@code shiftedAt} in reverse insertion order.
     */
    @Query("""
        SELECT r FROM BudgetReallocationEntity r
        WHERE r.clientId = :clientId AND r.shiftedAt >= :from AND r.shiftedAt < :to
        ORDER BY r.shiftedAt DESC, r.id DESC
        """)
    List<BudgetReallocationEntity> findRecent(@Param("clientId") String clientId,
                                              @Param("from") Instant from,
                                              @Param("to") Instant to,
                                              Pageable page);
}
