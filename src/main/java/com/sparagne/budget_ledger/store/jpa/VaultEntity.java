package com.sparagne.budget_ledger.store.jpa;

import com.sparagne.budget_ledger.money.CurrencyCode;
import com.sparagne.budget_ledger.vault.Vault;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Locale;
import java.util.UUID;

/**
 * JPA entity for vaults.
 *
 * The vault row doubles as the per-vault lock: every ledger write takes a
 * PESSIMISTIC_WRITE lock on it before touching wallets, flows or transactions.
 * {@code nameKey} is the lower-cased name, unique per owner.
 */
@Entity
@Table(name = "vaults",
    indexes = @Index(name = "idx_vaults_owner", columnList = "owner"),
    uniqueConstraints = @UniqueConstraint(name = "uq_vaults_owner_name", columnNames = {"owner", "name_key"}))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class VaultEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(nullable = false, length = 64)
    private String name;

    @Column(name = "name_key", nullable = false, length = 64)
    private String nameKey;

    @Column(nullable = false, updatable = false, length = 128)
    private String owner;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 3)
    private CurrencyCode currency;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    static VaultEntity fromDomain(Vault vault) {
        return new VaultEntity(vault.getId(), vault.getName(), vault.getName().toLowerCase(Locale.ROOT),
            vault.getOwner(), vault.getCurrency(), vault.getCreatedAt());
    }

    Vault toDomain() {
        return new Vault(id, name, owner, currency, createdAt);
    }
}
