package com.sparagne.budget_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.sparagne.budget_ledger.ledger.Transaction;
import lombok.Value;

import java.util.UUID;

@Value
public class TransactionCreatedResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("transaction")
    TransactionResponse transaction;

    public static TransactionCreatedResponse from(Transaction transaction) {
        return new TransactionCreatedResponse(transaction.getId(), TransactionResponse.from(transaction));
    }
}
