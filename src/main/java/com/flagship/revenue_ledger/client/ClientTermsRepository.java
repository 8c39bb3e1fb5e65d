package com.flagship.revenue_ledger.client;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ClientTermsRepository extends JpaRepository<ClientTermsEntity, String> {
}
