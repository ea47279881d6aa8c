package com.sparagne.budget_ledger.store.jpa;

import com.sparagne.budget_ledger.ledger.BalanceDelta;
import com.sparagne.budget_ledger.ledger.DeltaTarget;
import com.sparagne.budget_ledger.money.CurrencyCode;
import com.sparagne.budget_ledger.money.Money;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * One stored leg of a transaction. Legs are written once, with the transaction,
 * and never updated; a void applies their negation without rewriting them.
 */
@Entity
@Table(
    name = "transaction_legs",
    indexes = {
        @Index(name = "idx_transaction_legs_transaction", columnList = "transaction_id"),
        @Index(name = "idx_transaction_legs_target", columnList = "target_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TransactionLegEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "transaction_id", nullable = false, updatable = false)
    private UUID transactionId;

    @Column(nullable = false, updatable = false)
    private int position;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 16)
    private DeltaTarget target;

    @Column(name = "target_id", nullable = false, updatable = false)
    private UUID targetId;

    @Column(name = "amount_minor", nullable = false, updatable = false)
    private long amountMinor;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 3)
    private CurrencyCode currency;

    static TransactionLegEntity fromDomain(UUID transactionId, int position, BalanceDelta leg) {
        return new TransactionLegEntity(
            UUID.randomUUID(),
            transactionId,
            position,
            leg.getTarget(),
            leg.getTargetId(),
            leg.getAmount().getMinor(),
            leg.getAmount().getCurrency()
        );
    }

    BalanceDelta toDomain() {
        return new BalanceDelta(target, targetId, Money.of(amountMinor, currency));
    }
}
