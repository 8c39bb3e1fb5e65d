package com.flagship.revenue_ledger.settlement;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface SettlementInvoiceRepository extends JpaRepository<SettlementInvoiceEntity, UUID> {

    Optional<SettlementInvoiceEntity> findByClientIdAndBillingYearAndBillingMonth(
            String clientId, int billingYear, int billingMonth);

    List<SettlementInvoiceEntity> findByClientIdOrderByBillingYearDescBillingMonthDesc(String clientId);

    long countByStatus(InvoiceStatus status);
}
