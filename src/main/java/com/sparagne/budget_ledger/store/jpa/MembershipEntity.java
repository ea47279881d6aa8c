package com.sparagne.budget_ledger.store.jpa;

import com.sparagne.budget_ledger.vault.Membership;
import com.sparagne.budget_ledger.vault.MembershipRole;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for memberships. A null {@code cashFlowId} marks a vault-wide grant.
 *
 * Uniqueness of (vault, cash flow, username) is kept by the store, since a
 * unique index would treat two null cash flow ids as distinct.
 */
@Entity
@Table(
    name = "memberships",
    indexes = {
        @Index(name = "idx_memberships_vault", columnList = "vault_id"),
        @Index(name = "idx_memberships_username", columnList = "username")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class MembershipEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "vault_id", nullable = false, updatable = false)
    private UUID vaultId;

    @Column(name = "cash_flow_id", updatable = false)
    private UUID cashFlowId;

    @Column(nullable = false, updatable = false, length = 128)
    private String username;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private MembershipRole role;

    @Column(name = "granted_at", nullable = false, updatable = false)
    private Instant grantedAt;

    static MembershipEntity fromDomain(Membership membership) {
        return new MembershipEntity(
            UUID.randomUUID(),
            membership.getVaultId(),
            membership.getCashFlowId(),
            membership.getUsername(),
            membership.getRole(),
            membership.getGrantedAt()
        );
    }

    Membership toDomain() {
        return new Membership(vaultId, cashFlowId, username, role, grantedAt);
    }

    void updateRole(MembershipRole newRole) {
        this.role = newRole;
    }
}
