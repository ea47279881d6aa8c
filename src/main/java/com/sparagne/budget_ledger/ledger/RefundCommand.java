package com.sparagne.budget_ledger.ledger;

import com.sparagne.budget_ledger.money.CurrencyCode;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Refund of a posted income or expense, for at most its refundable remainder.
 */
@Value
@Builder
public class RefundCommand {
    UUID originalId;
    Long amountMinor;
    CurrencyCode currency;
    String note;
    String category;
    Instant occurredAt;
}
