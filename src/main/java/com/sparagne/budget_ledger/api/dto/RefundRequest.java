package com.sparagne.budget_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.time.Instant;

@Value
public class RefundRequest {

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
