package com.sparagne.budget_ledger.ledger;

import lombok.Value;

import java.util.List;

/**
 * One page of transactions, newest first. {@code nextCursor} is null on the last page.
 */
@Value
public class TransactionPage {
    List<Transaction> items;
    String nextCursor;
}
