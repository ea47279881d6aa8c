package com.sparagne.budget_ledger.store.jpa;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface MembershipRepository extends JpaRepository<MembershipEntity, UUID> {

    List<MembershipEntity> findByVaultIdOrderByGrantedAt(UUID vaultId);

    List<MembershipEntity> findByVaultIdAndUsername(UUID vaultId, String username);

    Optional<MembershipEntity> findByVaultIdAndCashFlowIdIsNullAndUsername(UUID vaultId, String username);

    Optional<MembershipEntity> findByVaultIdAndCashFlowIdAndUsername(UUID vaultId, UUID cashFlowId, String username);

    @Modifying
    @Query("DELETE FROM MembershipEntity m WHERE m.vaultId = :vaultId")
    int deleteByVault(@Param("vaultId") UUID vaultId);
}
