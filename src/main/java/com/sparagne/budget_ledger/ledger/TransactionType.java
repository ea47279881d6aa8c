package com.sparagne.budget_ledger.ledger;

/**
 * Closed set of transaction kinds.
 *
 * Delta computation switches exhaustively over this enum, so adding a constant
 * breaks compilation until its balance effect is defined.
 */
public enum TransactionType {
    INCOME,
    EXPENSE,
    /**
     * Partial or full reversal of an INCOME or EXPENSE.
     */
    REFUND,
    TRANSFER_WALLET,
    TRANSFER_FLOW;

    public boolean isRefundable() {
        return this == INCOME || this == EXPENSE;
    }
}
