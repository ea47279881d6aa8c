package com.sparagne.budget_ledger.store.jpa;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface VaultRepository extends JpaRepository<VaultEntity, UUID> {

    /**
     * Locks the vault row for the rest of the surrounding transaction.
     * All ledger writes on a vault go through this lock, which serializes them.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT v FROM VaultEntity v WHERE v.id = :id")
    Optional<VaultEntity> lockById(@Param("id") UUID id);

    @Query("SELECT DISTINCT v FROM VaultEntity v WHERE v.owner = :username " +
           "OR v.id IN (SELECT m.vaultId FROM MembershipEntity m WHERE m.username = :username) " +
           "ORDER BY v.createdAt")
    List<VaultEntity> findVisibleTo(@Param("username") String username);
}
