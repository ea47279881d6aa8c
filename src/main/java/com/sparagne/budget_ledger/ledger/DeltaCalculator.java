package com.sparagne.budget_ledger.ledger;

import com.sparagne.budget_ledger.exception.LedgerException;
import com.sparagne.budget_ledger.money.Money;

import java.util.ArrayList;
import java.util.List;

/**
 * Computes the balance legs of a transaction. Pure: no I/O, no clock.
 *
 * Sign convention: positive legs increase the target balance.
 * <ul>
 *   <li>INCOME: +amount on wallet and flow</li>
 *   <li>EXPENSE: -amount on wallet and flow</li>
 *   <li>REFUND: the original's legs scaled to the refund amount, negated</li>
 *   <li>TRANSFER_WALLET: -amount on source wallet, +amount on destination</li>
 *   <li>TRANSFER_FLOW: -amount on source flow, +amount on destination</li>
 * </ul>
 */
public final class DeltaCalculator {

    private DeltaCalculator() {
    }

    /**
     * Legs for a new transaction.
     *
     * @param transaction the transaction to post (its legs are ignored)
     * @param original the refunded transaction for REFUND, otherwise null
     */
    public static List<BalanceDelta> legsFor(Transaction transaction, Transaction original) {
        Money amount = transaction.getAmount();
        if (!amount.isPositive()) {
            throw LedgerException.invalidAmount(transaction.getId(), "amount_minor", "Amount must be positive");
        }

        return switch (transaction.getType()) {
            case INCOME -> entryLegs(transaction, amount);
            case EXPENSE -> entryLegs(transaction, amount.negate());
            case REFUND -> entryLegs(transaction, refundDirection(transaction, original));
            case TRANSFER_WALLET -> List.of(
                BalanceDelta.wallet(transaction.getWalletId(), amount.negate()),
                BalanceDelta.wallet(transaction.getToWalletId(), amount));
            case TRANSFER_FLOW -> List.of(
                BalanceDelta.cashFlow(transaction.getCashFlowId(), amount.negate()),
                BalanceDelta.cashFlow(transaction.getToCashFlowId(), amount));
        };
    }

    /**
     * Legs that undo a posted transaction: its stored legs, negated.
     */
    public static List<BalanceDelta> reversalOf(Transaction transaction) {
        return transaction.getLegs().stream()
            .map(BalanceDelta::negate)
            .toList();
    }

    private static Money refundDirection(Transaction refund, Transaction original) {
        if (original == null || !original.getId().equals(refund.getRefundOf())) {
            throw new IllegalArgumentException("Refund " + refund.getId() + " needs its original");
        }
        return switch (original.getType()) {
            case INCOME -> refund.getAmount().negate();
            case EXPENSE -> refund.getAmount();
            case REFUND, TRANSFER_WALLET, TRANSFER_FLOW -> throw LedgerException.invalidState(
                "transaction", original.getId(), "Transactions of type " + original.getType() + " cannot be refunded");
        };
    }

    private static List<BalanceDelta> entryLegs(Transaction transaction, Money signed) {
        if (transaction.getWalletId() == null && transaction.getCashFlowId() == null) {
            throw LedgerException.invalidInput("transaction", "wallet_id",
                "A wallet or a cash flow is required");
        }
        List<BalanceDelta> legs = new ArrayList<>(2);
        if (transaction.getWalletId() != null) {
            legs.add(BalanceDelta.wallet(transaction.getWalletId(), signed));
        }
        if (transaction.getCashFlowId() != null) {
            legs.add(BalanceDelta.cashFlow(transaction.getCashFlowId(), signed));
        }
        return List.copyOf(legs);
    }
}
