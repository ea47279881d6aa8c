package com.sparagne.budget_ledger.ledger;

/**
 * Lifecycle of a transaction. POSTED moves to VOIDED exactly once.
 */
public enum TransactionState {
    /**
     * Recorded and contributing its legs to balances.
     */
    POSTED,

    /**
     * Logically deleted. Terminal state; contributes nothing to balances or statistics.
     */
    VOIDED
}
