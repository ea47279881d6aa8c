package com.sparagne.budget_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.sparagne.budget_ledger.money.Money;
import lombok.Value;

import java.util.UUID;

@Value
public class RefundableResponse {

    @JsonProperty("transaction_id")
    UUID transactionId;

    @JsonProperty("refundable_minor")
    long refundableMinor;

    @JsonProperty("currency")
    String currency;

    public static RefundableResponse of(UUID transactionId, Money remainder) {
        return new RefundableResponse(transactionId, remainder.getMinor(), remainder.getCurrency().name());
    }
}
