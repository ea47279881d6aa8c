package com.sparagne.budget_ledger.vault;

/**
 * What {@link VaultService#deleteVault} does with a vault that still has content.
 */
public enum VaultDeletePolicy {
    /** Refuse while any wallet, cash flow or transaction exists. */
    REJECT,
    /** Remove the vault together with everything it owns. */
    CASCADE
}
