package com.sparagne.budget_ledger.vault;

/**
 * What an operation needs from the caller's grant.
 */
public enum Capability {
    /** Read vault, wallet, flow, transaction and statistics data. */
    VIEW,
    /** Record, refund, transfer, update and void transactions. */
    RECORD,
    /** Create, rename and archive wallets and cash flows. */
    ORGANIZE,
    /** Manage members and delete the vault. */
    ADMINISTER
}
