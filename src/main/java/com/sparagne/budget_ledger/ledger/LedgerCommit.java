package com.sparagne.budget_ledger.ledger;

import lombok.Value;

import java.util.List;
import java.util.UUID;

/**
 * Everything one ledger operation writes, handed to the store as a single unit.
 *
 * The store persists the transaction record and applies every delta, or
 * persists nothing.
 */
@Value
public class LedgerCommit {

    public enum Kind {
        /** Insert a new posted transaction and apply its legs. */
        POST,
        /** Mark a transaction voided and apply its negated legs. */
        VOID,
        /** Rewrite note/category only; no balance change. */
        METADATA
    }

    Kind kind;
    UUID vaultId;
    Transaction transaction;
    List<BalanceDelta> deltas;

    public static LedgerCommit post(Transaction transaction) {
        if (transaction.getLegs().isEmpty()) {
            throw new IllegalArgumentException("Transaction " + transaction.getId() + " has no legs");
        }
        return new LedgerCommit(Kind.POST, transaction.getVaultId(), transaction, transaction.getLegs());
    }

    public static LedgerCommit voiding(Transaction voided) {
        if (!voided.isVoided()) {
            throw new IllegalArgumentException("Transaction " + voided.getId() + " is not voided");
        }
        return new LedgerCommit(Kind.VOID, voided.getVaultId(), voided, DeltaCalculator.reversalOf(voided));
    }

    public static LedgerCommit metadata(Transaction updated) {
        return new LedgerCommit(Kind.METADATA, updated.getVaultId(), updated, List.of());
    }
}
