package com.sparagne.budget_ledger.ledger;

import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
public class BalanceReport {
    UUID vaultId;
    int walletsChecked;
    int cashFlowsChecked;
    List<BalanceDrift> drifts;
    Instant checkedAt;

    public boolean isConsistent() {
        return drifts.isEmpty();
    }
}
