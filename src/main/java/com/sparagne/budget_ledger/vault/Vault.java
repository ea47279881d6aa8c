package com.sparagne.budget_ledger.vault;

import com.sparagne.budget_ledger.money.CurrencyCode;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Vault domain object: the sharing and ownership boundary.
 *
 * A vault owns its wallets, cash flows, memberships and transactions. Every
 * Money value inside a vault uses the vault currency.
 */
@Value
public class Vault {
    UUID id;
    String name;
    String owner;
    CurrencyCode currency;
    Instant createdAt;

    public static Vault create(String name, String owner, CurrencyCode currency) {
        return new Vault(UUID.randomUUID(), name, owner, currency, Instant.now());
    }

    public boolean isOwnedBy(String username) {
        return owner.equals(username);
    }
}
