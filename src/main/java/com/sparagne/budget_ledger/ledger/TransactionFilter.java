package com.sparagne.budget_ledger.ledger;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Filters for listing a vault's transactions. All fields are optional.
 * The time window is half-open: {@code from <= occurredAt < to}.
 */
@Value
@Builder
public class TransactionFilter {
    UUID walletId;
    UUID cashFlowId;
    TransactionType type;
    Instant from;
    Instant to;
    boolean includeVoided;
    Integer limit;
    String cursor;
}
