package com.sparagne.budget_ledger.store.jpa;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface TransactionLegRepository extends JpaRepository<TransactionLegEntity, UUID> {

    List<TransactionLegEntity> findByTransactionIdOrderByPosition(UUID transactionId);

    List<TransactionLegEntity> findByTransactionIdIn(Collection<UUID> transactionIds);

    @Modifying
    @Query("DELETE FROM TransactionLegEntity l WHERE l.transactionId IN " +
           "(SELECT t.id FROM TransactionEntity t WHERE t.vaultId = :vaultId)")
    int deleteByVault(@Param("vaultId") UUID vaultId);
}
