package com.sparagne.budget_ledger.ledger;

import com.sparagne.budget_ledger.money.CurrencyCode;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Income or expense request. At least one of {@code walletId} and
 * {@code cashFlowId} is required. {@code currency} is optional; when present
 * it must equal the vault currency.
 */
@Value
@Builder
public class EntryCommand {
    UUID vaultId;
    UUID walletId;
    UUID cashFlowId;
    Long amountMinor;
    CurrencyCode currency;
    String note;
    String category;
    Instant occurredAt;
}
