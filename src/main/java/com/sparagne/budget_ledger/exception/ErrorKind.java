package com.sparagne.budget_ledger.exception;

/**
 * Kinds of failures the ledger engine reports.
 *
 * The transport layer maps each kind onto a response code without
 * re-deriving the cause.
 */
public enum ErrorKind {
    /**
     * Vault, wallet, cash flow or transaction unknown (or not part of the vault).
     */
    NOT_FOUND,

    /**
     * Caller lacks the membership or capability for the operation.
     */
    UNAUTHORIZED,

    /**
     * Non-positive amount, overflow, or amount above the refundable remainder.
     */
    INVALID_AMOUNT,

    /**
     * Operation not allowed in the current lifecycle state.
     */
    INVALID_STATE,

    /**
     * Second void of the same transaction.
     */
    ALREADY_VOIDED,

    /**
     * Attempt to change amount, type, participants or date of a posted transaction.
     */
    IMMUTABLE,

    SAME_WALLET,

    SAME_FLOW,

    CURRENCY_MISMATCH,

    /**
     * Cash flow would exceed its cap (balance or running income, per its mode).
     */
    MAX_BALANCE_REACHED,

    /**
     * Malformed command input (blank names, missing participants, bad roles).
     */
    INVALID_INPUT,

    /**
     * Opaque failure from the durable store. Never retried by the engine.
     */
    STORE_FAILURE
}
