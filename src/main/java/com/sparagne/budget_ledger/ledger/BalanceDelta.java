package com.sparagne.budget_ledger.ledger;

import com.sparagne.budget_ledger.money.Money;
import lombok.Value;

import java.util.UUID;

/**
 * One leg of a transaction: the signed change applied to a single wallet or
 * cash flow. Positive amounts increase the target balance.
 */
@Value
public class BalanceDelta {
    DeltaTarget target;
    UUID targetId;
    Money amount;

    public static BalanceDelta wallet(UUID walletId, Money amount) {
        return new BalanceDelta(DeltaTarget.WALLET, walletId, amount);
    }

    public static BalanceDelta cashFlow(UUID cashFlowId, Money amount) {
        return new BalanceDelta(DeltaTarget.CASH_FLOW, cashFlowId, amount);
    }

    public BalanceDelta negate() {
        return new BalanceDelta(target, targetId, amount.negate());
    }

    public boolean targetsWallet() {
        return target == DeltaTarget.WALLET;
    }
}
