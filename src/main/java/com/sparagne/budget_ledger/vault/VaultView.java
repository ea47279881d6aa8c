package com.sparagne.budget_ledger.vault;

import lombok.Value;

import java.util.List;

/**
 * A vault as seen by one caller. Flow-scoped callers get only their cash flows,
 * no wallets and no member list.
 */
@Value
public class VaultView {
    Vault vault;
    MembershipRole role;
    List<Wallet> wallets;
    List<CashFlow> cashFlows;
    List<Membership> members;
}
