package com.sparagne.budget_ledger.store.jpa;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

/**
 * Repository for ledger transactions. Listing filters are expressed as
 * {@link org.springframework.data.jpa.domain.Specification}s built by the store.
 */
@Repository
public interface TransactionRepository extends JpaRepository<TransactionEntity, UUID>,
        JpaSpecificationExecutor<TransactionEntity> {

    List<TransactionEntity> findByRefundOfOrderByRecordedAt(UUID refundOf);

    boolean existsByVaultId(UUID vaultId);

    @Modifying
    @Query("DELETE FROM TransactionEntity t WHERE t.vaultId = :vaultId")
    int deleteByVault(@Param("vaultId") UUID vaultId);
}
