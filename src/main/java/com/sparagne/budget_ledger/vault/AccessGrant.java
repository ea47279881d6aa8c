package com.sparagne.budget_ledger.vault;

import com.sparagne.budget_ledger.exception.LedgerException;
import com.sparagne.budget_ledger.ledger.BalanceDelta;
import com.sparagne.budget_ledger.ledger.Transaction;
import lombok.Value;

import java.util.Collection;
import java.util.Set;
import java.util.UUID;

/**
 * Outcome of a successful authorization: who may do what, and where.
 *
 * A vault-wide grant covers every wallet and cash flow of the vault. A
 * flow-scoped grant covers only the listed cash flows and no wallet at all.
 */
@Value
public class AccessGrant {
    Vault vault;
    String username;
    MembershipRole role;
    Capability capability;
    boolean vaultWide;
    Set<UUID> cashFlowIds;

    static AccessGrant vaultWide(Vault vault, String username, MembershipRole role, Capability capability) {
        return new AccessGrant(vault, username, role, capability, true, Set.of());
    }

    static AccessGrant flowScoped(Vault vault, String username, MembershipRole role, Capability capability,
                                  Collection<UUID> cashFlowIds) {
        return new AccessGrant(vault, username, role, capability, false, Set.copyOf(cashFlowIds));
    }

    public UUID getVaultId() {
        return vault.getId();
    }

    public boolean coversCashFlow(UUID cashFlowId) {
        return vaultWide || cashFlowIds.contains(cashFlowId);
    }

    /**
     * Cash flows this grant is limited to, or null for a vault-wide grant.
     */
    public Set<UUID> visibleCashFlows() {
        return vaultWide ? null : cashFlowIds;
    }

    public boolean canSee(Transaction transaction) {
        return vaultWide
            || (transaction.getCashFlowId() != null && cashFlowIds.contains(transaction.getCashFlowId()))
            || (transaction.getToCashFlowId() != null && cashFlowIds.contains(transaction.getToCashFlowId()));
    }

    /**
     * @throws LedgerException UNAUTHORIZED unless the grant is vault-wide
     */
    public void requireWallet(UUID walletId) {
        if (!vaultWide) {
            throw LedgerException.unauthorized(username, "wallet", walletId,
                capabilityVerb() + " wallets of vault " + vault.getId());
        }
    }

    /**
     * @throws LedgerException UNAUTHORIZED if the cash flow lies outside the grant
     */
    public void requireCashFlow(UUID cashFlowId) {
        if (!coversCashFlow(cashFlowId)) {
            throw LedgerException.unauthorized(username, "cash_flow", cashFlowId,
                capabilityVerb() + " cash flow " + cashFlowId);
        }
    }

    /**
     * Every leg must target something this grant covers.
     */
    public void requireLegs(Collection<BalanceDelta> legs) {
        for (BalanceDelta leg : legs) {
            if (leg.targetsWallet()) {
                requireWallet(leg.getTargetId());
            } else {
                requireCashFlow(leg.getTargetId());
            }
        }
    }

    /**
     * @throws LedgerException UNAUTHORIZED if the transaction is not visible to this grant
     */
    public void requireVisible(Transaction transaction) {
        if (!canSee(transaction)) {
            throw LedgerException.unauthorized(username, "transaction", transaction.getId(),
                capabilityVerb() + " transaction " + transaction.getId());
        }
    }

    private String capabilityVerb() {
        return switch (capability) {
            case VIEW -> "view";
            case RECORD -> "record on";
            case ORGANIZE -> "organize";
            case ADMINISTER -> "administer";
        };
    }
}
