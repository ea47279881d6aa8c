package com.sparagne.budget_ledger.store.jpa;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface CashFlowRepository extends JpaRepository<CashFlowEntity, UUID> {

    List<CashFlowEntity> findByVaultIdOrderByCreatedAt(UUID vaultId);

    /**
     * Applies a signed delta to the stored balance.
     *
     * @return number of rows updated, 0 if the row is gone
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE CashFlowEntity e SET e.balanceMinor = e.balanceMinor + :delta WHERE e.id = :id")
    int adjustBalance(@Param("id") UUID id, @Param("delta") long delta);

    @Modifying
    @Query("DELETE FROM CashFlowEntity e WHERE e.vaultId = :vaultId")
    int deleteByVault(@Param("vaultId") UUID vaultId);
}
