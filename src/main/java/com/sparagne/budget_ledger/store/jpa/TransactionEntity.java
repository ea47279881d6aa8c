package com.sparagne.budget_ledger.store.jpa;

import com.sparagne.budget_ledger.ledger.BalanceDelta;
import com.sparagne.budget_ledger.ledger.Transaction;
import com.sparagne.budget_ledger.ledger.TransactionState;
import com.sparagne.budget_ledger.ledger.TransactionType;
import com.sparagne.budget_ledger.money.CurrencyCode;
import com.sparagne.budget_ledger.money.Money;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * JPA entity for ledger transactions.
 *
 * Amount, type, participants, occurredAt and the creation audit fields are
 * {@code updatable = false}: after insert only note, category, state and the
 * void/update audit fields may change.
 */
@Entity
@Table(
    name = "transactions",
    indexes = {
        @Index(name = "idx_transactions_vault_occurred", columnList = "vault_id, occurred_at, id"),
        @Index(name = "idx_transactions_refund_of", columnList = "refund_of")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TransactionEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "vault_id", nullable = false, updatable = false)
    private UUID vaultId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 16)
    private TransactionType type;

    @Column(name = "amount_minor", nullable = false, updatable = false)
    private long amountMinor;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 3)
    private CurrencyCode currency;

    @Column(name = "wallet_id", updatable = false)
    private UUID walletId;

    @Column(name = "cash_flow_id", updatable = false)
    private UUID cashFlowId;

    @Column(name = "to_wallet_id", updatable = false)
    private UUID toWalletId;

    @Column(name = "to_cash_flow_id", updatable = false)
    private UUID toCashFlowId;

    @Column(name = "refund_of", updatable = false)
    private UUID refundOf;

    @Column(length = 1000)
    private String note;

    @Column(length = 64)
    private String category;

    @Column(name = "occurred_at", nullable = false, updatable = false)
    private Instant occurredAt;

    @Column(name = "recorded_at", nullable = false, updatable = false)
    private Instant recordedAt;

    @Column(name = "created_by", nullable = false, updatable = false, length = 128)
    private String createdBy;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private TransactionState state;

    @Column(name = "voided_at")
    private Instant voidedAt;

    @Column(name = "voided_by", length = 128)
    private String voidedBy;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    static TransactionEntity fromDomain(Transaction tx) {
        return new TransactionEntity(
            tx.getId(),
            tx.getVaultId(),
            tx.getType(),
            tx.getAmount().getMinor(),
            tx.getAmount().getCurrency(),
            tx.getWalletId(),
            tx.getCashFlowId(),
            tx.getToWalletId(),
            tx.getToCashFlowId(),
            tx.getRefundOf(),
            tx.getNote(),
            tx.getCategory(),
            tx.getOccurredAt(),
            tx.getRecordedAt(),
            tx.getCreatedBy(),
            tx.getState(),
            tx.getVoidedAt(),
            tx.getVoidedBy(),
            tx.getUpdatedAt()
        );
    }

    Transaction toDomain(List<BalanceDelta> legs) {
        return Transaction.builder()
            .id(id)
            .vaultId(vaultId)
            .type(type)
            .amount(Money.of(amountMinor, currency))
            .walletId(walletId)
            .cashFlowId(cashFlowId)
            .toWalletId(toWalletId)
            .toCashFlowId(toCashFlowId)
            .refundOf(refundOf)
            .note(note)
            .category(category)
            .occurredAt(occurredAt)
            .recordedAt(recordedAt)
            .createdBy(createdBy)
            .state(state)
            .voidedAt(voidedAt)
            .voidedBy(voidedBy)
            .updatedAt(updatedAt)
            .legs(List.copyOf(legs))
            .build();
    }

    /**
     * Copies the mutable fields. Immutable columns are ignored even if the
     * domain object carries different values.
     */
    void updateFromDomain(Transaction tx) {
        this.note = tx.getNote();
        this.category = tx.getCategory();
        this.state = tx.getState();
        this.voidedAt = tx.getVoidedAt();
        this.voidedBy = tx.getVoidedBy();
        this.updatedAt = tx.getUpdatedAt();
    }
}
