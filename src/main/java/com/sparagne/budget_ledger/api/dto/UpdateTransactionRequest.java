package com.sparagne.budget_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.sparagne.budget_ledger.ledger.TransactionType;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Only note and category can change. The other fields are accepted so that an
 * attempted change is answered with IMMUTABLE instead of being ignored.
 */
@Value
public class UpdateTransactionRequest {

    @JsonProperty("note")
    String note;

    @JsonProperty("category")
    String category;

    @JsonProperty("amount_minor")
    Long amountMinor;

    @JsonProperty("type")
    TransactionType type;

    @JsonProperty("wallet_id")
    UUID walletId;

    @JsonProperty("cash_flow_id")
    UUID cashFlowId;

    @JsonProperty("to_wallet_id")
    UUID toWalletId;

    @JsonProperty("to_cash_flow_id")
    UUID toCashFlowId;

    @JsonProperty("occurred_at")
    Instant occurredAt;
}
