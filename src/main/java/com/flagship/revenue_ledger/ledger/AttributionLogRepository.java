package com.flagship.revenue_ledger.ledger;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

@Repository
public interface AttributionLogRepository extends JpaRepository<AttributionLogEntity, Long> {

    Optional<AttributionLogEntity> findByLedgerEntryId(Long ledgerEntryId);

    /**
     * Summed agent shares over a client's attributed entries, in the column order
     * bid optimizer, LTV targeting, creative studio, nurture flows.
     */
    @Query("""
        SELECT COALESCE(SUM(l.bidOptimizerShare), 0),
               COALESCE(SUM(l.ltvTargetingShare), 0),
               COALESCE(SUM(l.creativeStudioShare), 0),
               COALESCE(SUM(l.nurtureFlowsShare), 0)
        FROM AttributionLogEntity l, LedgerEntryEntity e
        WHERE e.id = l.ledgerEntryId AND l.clientId = :clientId AND e.attributed = true
        """)
    List<Object[]> sumAgentShares(@Param("clientId") String clientId);

    default BigDecimal[] agentShareTotals(String clientId) {
        Object[] row = sumAgentShares(clientId).get(0);
        BigDecimal[] totals = new BigDecimal[row.length];
        for (int i = 0; i < row.length; i++) {
            totals[i] = row[i] == null ? BigDecimal.ZERO : new BigDecimal(row[i].toString());
        }
        return totals;
    }
}
