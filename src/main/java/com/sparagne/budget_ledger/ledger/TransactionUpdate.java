package com.sparagne.budget_ledger.ledger;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Requested changes to a posted transaction.
 *
 * Only {@code note} and {@code category} are editable: null leaves a field
 * unchanged, a blank string clears it. The remaining fields exist so that a
 * caller trying to change them gets an IMMUTABLE error instead of a silent
 * no-op; repeating the current value is accepted.
 */
@Value
@Builder
public class TransactionUpdate {
    String note;
    String category;

    Long amountMinor;
    TransactionType type;
    UUID walletId;
    UUID cashFlowId;
    UUID toWalletId;
    UUID toCashFlowId;
    Instant occurredAt;
}
