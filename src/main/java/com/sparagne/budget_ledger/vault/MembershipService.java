package com.sparagne.budget_ledger.vault;

import com.sparagne.budget_ledger.exception.LedgerException;
import com.sparagne.budget_ledger.store.LedgerStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

/**
 * Vault-wide and flow-scoped membership management.
 *
 * Adding a user who already holds the grant replaces its role. The owner's
 * membership is fixed, and OWNER is never granted. Removing a member leaves
 * every transaction they recorded in place.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MembershipService {

    private final LedgerStore store;
    private final AccessGate accessGate;

    // ==================== Vault members ====================

    public Membership addVaultMember(UUID vaultId, String caller, String username, MembershipRole role) {
        Membership membership = store.inVaultTransaction(vaultId, () -> {
            AccessGrant grant = accessGate.require(vaultId, caller, Capability.ADMINISTER);
            String member = validateGrant(grant.getVault(), username, role);
            Membership granted = Membership.vaultWide(vaultId, member, role);
            store.saveMembership(granted);
            return store.findMembership(vaultId, null, member).orElse(granted);
        });
        log.info("Vault member granted: vaultId={}, username={}, role={}", vaultId, membership.getUsername(), role);
        return membership;
    }

    public void removeVaultMember(UUID vaultId, String caller, String username) {
        String member = memberName(username);
        store.inVaultTransaction(vaultId, () -> {
            AccessGrant grant = accessGate.require(vaultId, caller, Capability.ADMINISTER);
            requireNotOwner(grant.getVault(), member);
            if (!store.deleteMembership(vaultId, null, member)) {
                throw LedgerException.notFound("membership", member);
            }
            return null;
        });
        log.info("Vault member removed: vaultId={}, username={}", vaultId, member);
    }

    /**
     * Vault-wide memberships, owner included.
     */
    public List<Membership> listVaultMembers(UUID vaultId, String caller) {
        return store.readOnly(() -> {
            AccessGrant grant = accessGate.require(vaultId, caller, Capability.VIEW);
            if (!grant.isVaultWide()) {
                throw LedgerException.unauthorized(caller, "vault", vaultId, "list members of vault " + vaultId);
            }
            return store.findMemberships(vaultId).stream()
                .filter(m -> !m.isFlowScoped())
                .toList();
        });
    }

    // ==================== Cash flow members ====================

    public Membership addFlowMember(UUID vaultId, UUID cashFlowId, String caller, String username,
                                    MembershipRole role) {
        Membership membership = store.inVaultTransaction(vaultId, () -> {
            AccessGrant grant = accessGate.require(vaultId, caller, Capability.ADMINISTER);
            requireCashFlowInVault(vaultId, cashFlowId);
            String member = validateGrant(grant.getVault(), username, role);
            Membership granted = Membership.flowScoped(vaultId, cashFlowId, member, role);
            store.saveMembership(granted);
            return store.findMembership(vaultId, cashFlowId, member).orElse(granted);
        });
        log.info("Cash flow member granted: vaultId={}, cashFlowId={}, username={}, role={}",
            vaultId, cashFlowId, membership.getUsername(), role);
        return membership;
    }

    public void removeFlowMember(UUID vaultId, UUID cashFlowId, String caller, String username) {
        String member = memberName(username);
        store.inVaultTransaction(vaultId, () -> {
            accessGate.require(vaultId, caller, Capability.ADMINISTER);
            requireCashFlowInVault(vaultId, cashFlowId);
            if (!store.deleteMembership(vaultId, cashFlowId, member)) {
                throw LedgerException.notFound("membership", member);
            }
            return null;
        });
        log.info("Cash flow member removed: vaultId={}, cashFlowId={}, username={}", vaultId, cashFlowId, member);
    }

    public List<Membership> listFlowMembers(UUID vaultId, UUID cashFlowId, String caller) {
        return store.readOnly(() -> {
            AccessGrant grant = accessGate.require(vaultId, caller, Capability.VIEW);
            grant.requireCashFlow(cashFlowId);
            requireCashFlowInVault(vaultId, cashFlowId);
            return store.findMemberships(vaultId).stream()
                .filter(m -> cashFlowId.equals(m.getCashFlowId()))
                .toList();
        });
    }

    // ==================== Helpers ====================

    private String validateGrant(Vault vault, String username, MembershipRole role) {
        String member = memberName(username);
        if (role == null) {
            throw LedgerException.invalidInput("membership", "role", "Role is required");
        }
        if (role == MembershipRole.OWNER) {
            throw LedgerException.invalidInput("membership", "role", "The OWNER role cannot be granted");
        }
        requireNotOwner(vault, member);
        return member;
    }

    /**
     * Members are stored under their trimmed username.
     */
    private static String memberName(String username) {
        if (username == null || username.isBlank()) {
            throw LedgerException.invalidInput("membership", "username", "Username is required");
        }
        return username.trim();
    }

    private void requireNotOwner(Vault vault, String username) {
        if (vault.isOwnedBy(username)) {
            throw LedgerException.invalidInput("membership", "username",
                "The owner's membership of vault " + vault.getId() + " cannot be changed");
        }
    }

    private void requireCashFlowInVault(UUID vaultId, UUID cashFlowId) {
        store.findCashFlow(cashFlowId)
            .filter(f -> f.getVaultId().equals(vaultId))
            .orElseThrow(() -> LedgerException.notFound("cash_flow", cashFlowId));
    }
}
