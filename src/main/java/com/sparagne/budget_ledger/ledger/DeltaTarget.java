package com.sparagne.budget_ledger.ledger;

/**
 * What a balance delta applies to.
 */
public enum DeltaTarget {
    WALLET,
    CASH_FLOW
}
