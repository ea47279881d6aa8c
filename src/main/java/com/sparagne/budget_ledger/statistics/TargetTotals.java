package com.sparagne.budget_ledger.statistics;

import com.sparagne.budget_ledger.ledger.DeltaTarget;
import com.sparagne.budget_ledger.money.Money;
import lombok.Value;

import java.util.UUID;

/**
 * Movement on one wallet or cash flow over a period: money in, money out and
 * their difference, plus the current balance for reference.
 */
@Value
public class TargetTotals {
    DeltaTarget target;
    UUID id;
    String name;
    boolean archived;
    Money inflow;
    Money outflow;
    Money net;
    Money balance;
}
