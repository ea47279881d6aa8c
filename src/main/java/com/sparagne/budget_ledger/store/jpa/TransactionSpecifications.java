package com.sparagne.budget_ledger.store.jpa;

import com.sparagne.budget_ledger.ledger.TransactionCursor;
import com.sparagne.budget_ledger.ledger.TransactionState;
import com.sparagne.budget_ledger.ledger.TransactionType;
import com.sparagne.budget_ledger.store.TransactionQuery;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;

import java.time.Instant;
import java.util.Set;
import java.util.UUID;

/**
 * Criteria building blocks for transaction listings.
 */
final class TransactionSpecifications {

    static final Sort NEWEST_FIRST = Sort.by(Sort.Order.desc("occurredAt"), Sort.Order.desc("id"));

    private TransactionSpecifications() {
    }

    static Specification<TransactionEntity> matching(TransactionQuery query) {
        Specification<TransactionEntity> spec = inVault(query.getVaultId());
        if (!query.isIncludeVoided()) {
            spec = spec.and(inState(TransactionState.POSTED));
        }
        if (query.getWalletId() != null) {
            spec = spec.and(touchingWallet(query.getWalletId()));
        }
        if (query.getCashFlowId() != null) {
            spec = spec.and(touchingCashFlow(query.getCashFlowId()));
        }
        if (query.getVisibleFlows() != null) {
            spec = spec.and(touchingAnyCashFlow(query.getVisibleFlows()));
        }
        if (query.getType() != null) {
            spec = spec.and(ofType(query.getType()));
        }
        return spec.and(occurredWithin(query.getFrom(), query.getTo()))
            .and(after(query.getAfter()));
    }

    static Specification<TransactionEntity> inVault(UUID vaultId) {
        return (root, q, cb) -> cb.equal(root.get("vaultId"), vaultId);
    }

    static Specification<TransactionEntity> inState(TransactionState state) {
        return (root, q, cb) -> cb.equal(root.get("state"), state);
    }

    static Specification<TransactionEntity> ofType(TransactionType type) {
        return (root, q, cb) -> cb.equal(root.get("type"), type);
    }

    static Specification<TransactionEntity> touchingWallet(UUID walletId) {
        return (root, q, cb) -> cb.or(
            cb.equal(root.get("walletId"), walletId),
            cb.equal(root.get("toWalletId"), walletId));
    }

    static Specification<TransactionEntity> touchingCashFlow(UUID cashFlowId) {
        return (root, q, cb) -> cb.or(
            cb.equal(root.get("cashFlowId"), cashFlowId),
            cb.equal(root.get("toCashFlowId"), cashFlowId));
    }

    static Specification<TransactionEntity> touchingAnyCashFlow(Set<UUID> cashFlowIds) {
        return (root, q, cb) -> cashFlowIds.isEmpty()
            ? cb.disjunction()
            : cb.or(root.get("cashFlowId").in(cashFlowIds), root.get("toCashFlowId").in(cashFlowIds));
    }

    /**
     * Half-open window {@code [from, to)}; a null bound is open.
     */
    static Specification<TransactionEntity> occurredWithin(Instant from, Instant to) {
        return (root, q, cb) -> {
            if (from == null && to == null) {
                return cb.conjunction();
            }
            if (from == null) {
                return cb.lessThan(root.<Instant>get("occurredAt"), to);
            }
            if (to == null) {
                return cb.greaterThanOrEqualTo(root.<Instant>get("occurredAt"), from);
            }
            return cb.and(cb.greaterThanOrEqualTo(root.<Instant>get("occurredAt"), from),
                cb.lessThan(root.<Instant>get("occurredAt"), to));
        };
    }

    /**
     * Rows strictly after the keyset position in (occurredAt desc, id desc) order.
     */
    static Specification<TransactionEntity> after(TransactionCursor cursor) {
        return (root, q, cb) -> {
            if (cursor == null) {
                return cb.conjunction();
            }
            return cb.or(
                cb.lessThan(root.<Instant>get("occurredAt"), cursor.getOccurredAt()),
                cb.and(
                    cb.equal(root.get("occurredAt"), cursor.getOccurredAt()),
                    cb.lessThan(root.<UUID>get("id"), cursor.getId())));
        };
    }
}
