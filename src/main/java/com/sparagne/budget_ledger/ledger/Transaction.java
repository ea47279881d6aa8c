package com.sparagne.budget_ledger.ledger;

import com.sparagne.budget_ledger.exception.LedgerException;
import com.sparagne.budget_ledger.money.Money;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Transaction domain object.
 *
 * Shared header (id, vault, type, amount, dates, state) plus type-specific
 * participants:
 * <ul>
 *   <li>INCOME / EXPENSE: {@code walletId} and/or {@code cashFlowId}</li>
 *   <li>REFUND: the original's wallet/flow plus {@code refundOf}</li>
 *   <li>TRANSFER_WALLET: {@code walletId} (source) and {@code toWalletId}</li>
 *   <li>TRANSFER_FLOW: {@code cashFlowId} (source) and {@code toCashFlowId}</li>
 * </ul>
 *
 * Once posted, amount, type, participants, occurredAt and legs never change.
 * State changes return new instances; only {@link #withMetadata} and
 * {@link #voidBy} produce a modified copy.
 */
@Value
@Builder(toBuilder = true)
public class Transaction {
    UUID id;
    UUID vaultId;
    TransactionType type;
    Money amount;
    UUID walletId;
    UUID cashFlowId;
    UUID toWalletId;
    UUID toCashFlowId;
    UUID refundOf;
    String note;
    String category;
    Instant occurredAt;
    Instant recordedAt;
    String createdBy;
    TransactionState state;
    Instant voidedAt;
    String voidedBy;
    Instant updatedAt;
    @Builder.Default
    List<BalanceDelta> legs = List.of();

    public static Transaction income(UUID vaultId, UUID walletId, UUID cashFlowId, Money amount,
                                     EntryMetadata metadata, String createdBy) {
        return entry(TransactionType.INCOME, vaultId, walletId, cashFlowId, amount, metadata, createdBy);
    }

    public static Transaction expense(UUID vaultId, UUID walletId, UUID cashFlowId, Money amount,
                                      EntryMetadata metadata, String createdBy) {
        return entry(TransactionType.EXPENSE, vaultId, walletId, cashFlowId, amount, metadata, createdBy);
    }

    /**
     * Creates a refund of {@code original}, touching the same wallet and cash flow.
     */
    public static Transaction refund(Transaction original, Money amount, EntryMetadata metadata, String createdBy) {
        Instant now = Instant.now();
        return Transaction.builder()
            .id(UUID.randomUUID())
            .vaultId(original.getVaultId())
            .type(TransactionType.REFUND)
            .amount(amount)
            .walletId(original.getWalletId())
            .cashFlowId(original.getCashFlowId())
            .refundOf(original.getId())
            .note(metadata.getNote())
            .category(metadata.getCategory() != null ? metadata.getCategory() : original.getCategory())
            .occurredAt(metadata.occurredAtOr(now))
            .recordedAt(now)
            .createdBy(createdBy)
            .state(TransactionState.POSTED)
            .updatedAt(now)
            .build();
    }

    public static Transaction walletTransfer(UUID vaultId, UUID fromWalletId, UUID toWalletId, Money amount,
                                             EntryMetadata metadata, String createdBy) {
        Instant now = Instant.now();
        return Transaction.builder()
            .id(UUID.randomUUID())
            .vaultId(vaultId)
            .type(TransactionType.TRANSFER_WALLET)
            .amount(amount)
            .walletId(fromWalletId)
            .toWalletId(toWalletId)
            .note(metadata.getNote())
            .category(metadata.getCategory())
            .occurredAt(metadata.occurredAtOr(now))
            .recordedAt(now)
            .createdBy(createdBy)
            .state(TransactionState.POSTED)
            .updatedAt(now)
            .build();
    }

    public static Transaction flowTransfer(UUID vaultId, UUID fromFlowId, UUID toFlowId, Money amount,
                                           EntryMetadata metadata, String createdBy) {
        Instant now = Instant.now();
        return Transaction.builder()
            .id(UUID.randomUUID())
            .vaultId(vaultId)
            .type(TransactionType.TRANSFER_FLOW)
            .amount(amount)
            .cashFlowId(fromFlowId)
            .toCashFlowId(toFlowId)
            .note(metadata.getNote())
            .category(metadata.getCategory())
            .occurredAt(metadata.occurredAtOr(now))
            .recordedAt(now)
            .createdBy(createdBy)
            .state(TransactionState.POSTED)
            .updatedAt(now)
            .build();
    }

    private static Transaction entry(TransactionType type, UUID vaultId, UUID walletId, UUID cashFlowId,
                                     Money amount, EntryMetadata metadata, String createdBy) {
        Instant now = Instant.now();
        return Transaction.builder()
            .id(UUID.randomUUID())
            .vaultId(vaultId)
            .type(type)
            .amount(amount)
            .walletId(walletId)
            .cashFlowId(cashFlowId)
            .note(metadata.getNote())
            .category(metadata.getCategory())
            .occurredAt(metadata.occurredAtOr(now))
            .recordedAt(now)
            .createdBy(createdBy)
            .state(TransactionState.POSTED)
            .updatedAt(now)
            .build();
    }

    /**
     * Attaches the legs computed for this transaction. Legs are set exactly once,
     * before the first commit.
     *
     * @throws IllegalStateException if legs were already attached
     */
    public Transaction withLegs(List<BalanceDelta> computedLegs) {
        if (!legs.isEmpty()) {
            throw new IllegalStateException("Legs of transaction " + id + " are already fixed");
        }
        return toBuilder().legs(List.copyOf(computedLegs)).build();
    }

    /**
     * Transitions POSTED to VOIDED.
     *
     * @throws LedgerException ALREADY_VOIDED if the transaction is already voided
     */
    public Transaction voidBy(String username, Instant at) {
        if (state == TransactionState.VOIDED) {
            throw LedgerException.alreadyVoided(id);
        }
        return toBuilder()
            .state(TransactionState.VOIDED)
            .voidedAt(at)
            .voidedBy(username)
            .updatedAt(at)
            .build();
    }

    /**
     * Replaces note and category. Voided transactions are frozen.
     *
     * @throws LedgerException INVALID_STATE if the transaction is voided
     */
    public Transaction withMetadata(String newNote, String newCategory, Instant at) {
        if (state == TransactionState.VOIDED) {
            throw LedgerException.invalidState("transaction", id, "Cannot update voided transaction " + id);
        }
        return toBuilder()
            .note(newNote)
            .category(newCategory)
            .updatedAt(at)
            .build();
    }

    public boolean isPosted() {
        return state == TransactionState.POSTED;
    }

    public boolean isVoided() {
        return state == TransactionState.VOIDED;
    }

    /**
     * True if any leg of this transaction targets the given wallet or cash flow id.
     */
    public boolean touches(UUID targetId) {
        return legs.stream().anyMatch(leg -> leg.getTargetId().equals(targetId));
    }
}
