package com.sparagne.budget_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.sparagne.budget_ledger.ledger.TransactionPage;
import lombok.Value;

import java.util.List;

@Value
public class TransactionPageResponse {

    @JsonProperty("items")
    List<TransactionResponse> items;

    @JsonProperty("next_cursor")
    String nextCursor;

    public static TransactionPageResponse from(TransactionPage page) {
        return new TransactionPageResponse(
            page.getItems().stream().map(TransactionResponse::from).toList(),
            page.getNextCursor());
    }
}
