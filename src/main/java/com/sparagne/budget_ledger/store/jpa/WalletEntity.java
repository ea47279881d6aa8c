package com.sparagne.budget_ledger.store.jpa;

import com.sparagne.budget_ledger.money.CurrencyCode;
import com.sparagne.budget_ledger.money.Money;
import com.sparagne.budget_ledger.vault.Wallet;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.DynamicUpdate;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for wallets.
 *
 * No setters. Name and archived flag change through {@link #updateFromDomain};
 * the balance changes only through the repository's adjustBalance query, and
 * {@code @DynamicUpdate} keeps detail updates from writing a stale balance back.
 */
@Entity
@Table(name = "wallets", indexes = @Index(name = "idx_wallets_vault", columnList = "vault_id"))
@DynamicUpdate
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class WalletEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "vault_id", nullable = false, updatable = false)
    private UUID vaultId;

    @Column(nullable = false, length = 64)
    private String name;

    @Column(name = "balance_minor", nullable = false)
    private long balanceMinor;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 3)
    private CurrencyCode currency;

    @Column(nullable = false)
    private boolean archived;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    static WalletEntity fromDomain(Wallet wallet) {
        return new WalletEntity(
            wallet.getId(),
            wallet.getVaultId(),
            wallet.getName(),
            wallet.getBalance().getMinor(),
            wallet.getBalance().getCurrency(),
            wallet.isArchived(),
            wallet.getCreatedAt()
        );
    }

    Wallet toDomain() {
        return new Wallet(id, vaultId, name, Money.of(balanceMinor, currency), archived, createdAt);
    }

    void updateFromDomain(Wallet wallet) {
        this.name = wallet.getName();
        this.archived = wallet.isArchived();
    }
}
