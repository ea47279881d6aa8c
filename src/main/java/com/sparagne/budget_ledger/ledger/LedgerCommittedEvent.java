package com.sparagne.budget_ledger.ledger;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published in-process after a unit of work that changed a vault's ledger or
 * its wallets and cash flows has committed.
 *
 * {@code transactionId} is null when the change did not concern a single
 * transaction (wallet rename, vault deletion and similar).
 */
@Value
public class LedgerCommittedEvent {
    UUID vaultId;
    UUID transactionId;
    String operation;
    Instant committedAt;

    public static LedgerCommittedEvent of(UUID vaultId, UUID transactionId, String operation) {
        return new LedgerCommittedEvent(vaultId, transactionId, operation, Instant.now());
    }
}
