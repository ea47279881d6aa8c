package com.sparagne.budget_ledger.store.jpa;

import com.sparagne.budget_ledger.money.CurrencyCode;
import com.sparagne.budget_ledger.money.Money;
import com.sparagne.budget_ledger.vault.CashFlow;
import com.sparagne.budget_ledger.vault.CashFlowMode;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.DynamicUpdate;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for cash flows.
 *
 * No setters. Name, archived flag, mode and cap change through {@link #updateFromDomain};
 * the balance changes only through the repository's adjustBalance query, and
 * {@code @DynamicUpdate} keeps detail updates from writing a stale balance back.
 */
@Entity
@Table(name = "cash_flows", indexes = @Index(name = "idx_cash_flows_vault", columnList = "vault_id"))
@DynamicUpdate
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CashFlowEntity {

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

    @Enumerated(EnumType.STRING)
    @Column(name = "cap_mode", nullable = false, length = 16)
    private CashFlowMode mode;

    @Column(name = "cap_minor")
    private Long capMinor;

    @Column(nullable = false)
    private boolean archived;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    static CashFlowEntity fromDomain(CashFlow cashFlow) {
        return new CashFlowEntity(
            cashFlow.getId(),
            cashFlow.getVaultId(),
            cashFlow.getName(),
            cashFlow.getBalance().getMinor(),
            cashFlow.getBalance().getCurrency(),
            cashFlow.getMode(),
            cashFlow.getCapMinor(),
            cashFlow.isArchived(),
            cashFlow.getCreatedAt()
        );
    }

    CashFlow toDomain() {
        return new CashFlow(id, vaultId, name, Money.of(balanceMinor, currency), mode, capMinor, archived, createdAt);
    }

    void updateFromDomain(CashFlow cashFlow) {
        this.name = cashFlow.getName();
        this.archived = cashFlow.isArchived();
        this.mode = cashFlow.getMode();
        this.capMinor = cashFlow.getCapMinor();
    }
}
