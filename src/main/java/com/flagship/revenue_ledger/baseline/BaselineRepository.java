package com.flagship.revenue_ledger.baseline;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface BaselineRepository extends JpaRepository<BaselineSnapshotEntity, String> {
}
