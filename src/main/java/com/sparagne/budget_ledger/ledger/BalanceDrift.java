package com.sparagne.budget_ledger.ledger;

import com.sparagne.budget_ledger.money.Money;
import lombok.Value;

import java.util.UUID;

/**
 * A wallet or cash flow whose stored balance differs from the sum of the legs
 * of its posted transactions.
 */
@Value
public class BalanceDrift {
    DeltaTarget target;
    UUID targetId;
    String name;
    Money stored;
    Money expected;

    public Money getDifference() {
        return stored.minus(expected);
    }
}
