package com.flagship.finance_automation.balance;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface BalanceSnapshotRepository extends JpaRepository<BalanceSnapshotEntity, BalanceSnapshotId> {

    @Query("SELECT s FROM BalanceSnapshotEntity s ORDER BY s.id.bankRef, s.id.groupName")
    List<BalanceSnapshotEntity> findAllOrdered();

    long countByStaleTrue();
}
