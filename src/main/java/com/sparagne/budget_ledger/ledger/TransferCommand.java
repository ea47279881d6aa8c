package com.sparagne.budget_ledger.ledger;

import com.sparagne.budget_ledger.money.CurrencyCode;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Move of money between two wallets, or between two cash flows, of one vault.
 */
@Value
@Builder
public class TransferCommand {
    UUID vaultId;
    UUID fromId;
    UUID toId;
    Long amountMinor;
    CurrencyCode currency;
    String note;
    String category;
    Instant occurredAt;
}
