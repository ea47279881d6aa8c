package com.sparagne.budget_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Wallet-to-wallet or flow-to-flow transfer, depending on the endpoint.
 */
@Value
public class TransferRequest {

    @NotNull(message = "Source is required")
    @JsonProperty("from_id")
    UUID fromId;

    @NotNull(message = "Destination is required")
    @JsonProperty("to_id")
    UUID toId;

    @NotNull(message = "Amount is required")
    @JsonProperty("amount_minor")
    Long amountMinor;

    @JsonProperty("currency")
    String currency;

    @Size(max = 1000, message = "Note must be at most 1000 characters")
    @JsonProperty("note")
    String note;

    @Size(max = 64, message = "Category must be at most 64 characters")
    @JsonProperty("category")
    String category;

    @JsonProperty("occurred_at")
    Instant occurredAt;
}
