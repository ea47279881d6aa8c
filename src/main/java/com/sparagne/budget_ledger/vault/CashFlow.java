package com.sparagne.budget_ledger.vault;

import com.sparagne.budget_ledger.money.Money;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Cash flow domain object: a budget bucket ("groceries", "holidays") with its
 * own running total, independent of wallet balances.
 *
 * Same mutation discipline as {@link Wallet}: the balance only moves through
 * ledger commits. A flow may carry a cap, see {@link CashFlowMode};
 * {@code capMinor} is null exactly when the mode is UNLIMITED.
 */
@Value
public class CashFlow {
    UUID id;
    UUID vaultId;
    String name;
    Money balance;
    CashFlowMode mode;
    Long capMinor;
    boolean archived;
    Instant createdAt;

    public static CashFlow open(Vault vault, String name) {
        return open(vault, name, CashFlowMode.UNLIMITED, null);
    }

    public static CashFlow open(Vault vault, String name, CashFlowMode mode, Long capMinor) {
        mode.requireValidCap(capMinor);
        return new CashFlow(UUID.randomUUID(), vault.getId(), name, Money.zero(vault.getCurrency()), mode, capMinor,
            false, Instant.now());
    }

    public CashFlow rename(String newName) {
        return new CashFlow(id, vaultId, newName, balance, mode, capMinor, archived, createdAt);
    }

    public CashFlow withArchived(boolean archivedFlag) {
        return new CashFlow(id, vaultId, name, balance, mode, capMinor, archivedFlag, createdAt);
    }

    public CashFlow withMode(CashFlowMode newMode, Long newCapMinor) {
        newMode.requireValidCap(newCapMinor);
        return new CashFlow(id, vaultId, name, balance, newMode, newCapMinor, archived, createdAt);
    }

    public CashFlow withBalance(Money newBalance) {
        return new CashFlow(id, vaultId, name, newBalance, mode, capMinor, archived, createdAt);
    }
}
