package com.sparagne.budget_ledger.store;

import com.sparagne.budget_ledger.ledger.TransactionCursor;
import com.sparagne.budget_ledger.ledger.TransactionType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Set;
import java.util.UUID;

/**
 * Resolved listing query passed to the store.
 *
 * {@code visibleFlows}, when non-null, restricts results to transactions
 * whose source or destination cash flow is in the set.
 */
@Value
@Builder
public class TransactionQuery {
    UUID vaultId;
    UUID walletId;
    UUID cashFlowId;
    Set<UUID> visibleFlows;
    TransactionType type;
    Instant from;
    Instant to;
    boolean includeVoided;
    TransactionCursor after;
    int limit;
}
