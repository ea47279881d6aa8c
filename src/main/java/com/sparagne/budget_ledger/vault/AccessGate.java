package com.sparagne.budget_ledger.vault;

import com.sparagne.budget_ledger.exception.LedgerException;
import com.sparagne.budget_ledger.store.LedgerStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Single authorization gate for vault access.
 *
 * Resolution order:
 * <ol>
 *   <li>the vault owner holds every capability vault-wide;</li>
 *   <li>a vault-wide membership whose role allows the capability grants it vault-wide;</li>
 *   <li>flow-scoped memberships whose role allows the capability grant it on those flows.
 *       ORGANIZE and ADMINISTER are never granted through a flow scope.</li>
 * </ol>
 * Must be called inside a store unit of work so that the membership read and
 * the operation it guards see the same state.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AccessGate {

    private final LedgerStore store;

    /**
     * @throws LedgerException NOT_FOUND if the vault does not exist,
     *                         UNAUTHORIZED if the caller lacks the capability
     */
    public AccessGrant require(UUID vaultId, String caller, Capability capability) {
        Vault vault = store.findVault(vaultId)
            .orElseThrow(() -> LedgerException.notFound("vault", vaultId));
        if (caller == null || caller.isBlank()) {
            throw LedgerException.unauthorized(String.valueOf(caller), "vault", vaultId, "act anonymously");
        }
        if (vault.isOwnedBy(caller)) {
            return AccessGrant.vaultWide(vault, caller, MembershipRole.OWNER, capability);
        }

        List<Membership> memberships = store.findMembershipsOf(vaultId, caller);
        for (Membership membership : memberships) {
            if (!membership.isFlowScoped() && membership.getRole().allows(capability)) {
                return AccessGrant.vaultWide(vault, caller, membership.getRole(), capability);
            }
        }

        if (capability == Capability.VIEW || capability == Capability.RECORD) {
            List<Membership> flowGrants = memberships.stream()
                .filter(Membership::isFlowScoped)
                .filter(m -> m.getRole().allows(capability))
                .toList();
            if (!flowGrants.isEmpty()) {
                MembershipRole strongest = flowGrants.stream()
                    .map(Membership::getRole)
                    .min(Comparator.naturalOrder())
                    .orElseThrow();
                return AccessGrant.flowScoped(vault, caller, strongest, capability,
                    flowGrants.stream().map(Membership::getCashFlowId).toList());
            }
        }

        log.warn("Access denied: user={}, vault={}, capability={}", caller, vaultId, capability);
        throw LedgerException.unauthorized(caller, "vault", vaultId,
            capability.name().toLowerCase(Locale.ROOT) + " vault " + vaultId);
    }
}
