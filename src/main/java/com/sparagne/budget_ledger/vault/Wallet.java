package com.sparagne.budget_ledger.vault;

import com.sparagne.budget_ledger.money.Money;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Wallet domain object: a named balance holder inside a vault.
 *
 * The balance is a running total of the legs of posted transactions. It is
 * changed only by the ledger commit path, so this type has no way to set it;
 * {@link #rename(String)} and {@link #withArchived(boolean)} return copies with
 * the balance untouched.
 */
@Value
public class Wallet {
    UUID id;
    UUID vaultId;
    String name;
    Money balance;
    boolean archived;
    Instant createdAt;

    public static Wallet open(Vault vault, String name) {
        return new Wallet(UUID.randomUUID(), vault.getId(), name, Money.zero(vault.getCurrency()), false, Instant.now());
    }

    public Wallet rename(String newName) {
        return new Wallet(id, vaultId, newName, balance, archived, createdAt);
    }

    public Wallet withArchived(boolean archivedFlag) {
        return new Wallet(id, vaultId, name, balance, archivedFlag, createdAt);
    }
}
