package com.sparagne.budget_ledger.ledger;

import com.sparagne.budget_ledger.exception.ErrorKind;
import com.sparagne.budget_ledger.exception.LedgerException;
import com.sparagne.budget_ledger.money.CurrencyCode;
import com.sparagne.budget_ledger.money.Money;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class DeltaCalculatorTest {

    private final UUID vaultId = UUID.randomUUID();
    private final UUID walletId = UUID.randomUUID();
    private final UUID otherWalletId = UUID.randomUUID();
    private final UUID flowId = UUID.randomUUID();
    private final UUID otherFlowId = UUID.randomUUID();
    private final EntryMetadata noMetadata = EntryMetadata.of(null, null, null);

    private static Money eur(long minor) {
        return Money.of(minor, CurrencyCode.EUR);
    }

    @Test
    @DisplayName("Income credits both wallet and cash flow")
    void testIncomeLegs() {
        Transaction income = Transaction.income(vaultId, walletId, flowId, eur(1000), noMetadata, "alice");

        List<BalanceDelta> legs = DeltaCalculator.legsFor(income, null);

        assertEquals(List.of(BalanceDelta.wallet(walletId, eur(1000)), BalanceDelta.cashFlow(flowId, eur(1000))), legs);
    }

    @Test
    @DisplayName("Expense on a cash flow only produces a single negative leg")
    void testExpenseOnFlowOnly() {
        Transaction expense = Transaction.expense(vaultId, null, flowId, eur(250), noMetadata, "alice");

        List<BalanceDelta> legs = DeltaCalculator.legsFor(expense, null);

        assertEquals(List.of(BalanceDelta.cashFlow(flowId, eur(-250))), legs);
    }

    @Test
    @DisplayName("Refund of an expense credits the original targets with the refund amount")
    void testRefundOfExpense() {
        Transaction expense = Transaction.expense(vaultId, walletId, flowId, eur(1000), noMetadata, "alice");
        Transaction refund = Transaction.refund(expense, eur(300), noMetadata, "alice");

        List<BalanceDelta> legs = DeltaCalculator.legsFor(refund, expense);

        assertEquals(List.of(BalanceDelta.wallet(walletId, eur(300)), BalanceDelta.cashFlow(flowId, eur(300))), legs);
    }

    @Test
    @DisplayName("Refund of an income debits the original targets")
    void testRefundOfIncome() {
        Transaction income = Transaction.income(vaultId, walletId, null, eur(1000), noMetadata, "alice");
        Transaction refund = Transaction.refund(income, eur(1000), noMetadata, "alice");

        List<BalanceDelta> legs = DeltaCalculator.legsFor(refund, income);

        assertEquals(List.of(BalanceDelta.wallet(walletId, eur(-1000))), legs);
    }

    @Test
    @DisplayName("Transfers produce two opposite legs that net to zero")
    void testTransferLegs() {
        Transaction walletTransfer = Transaction.walletTransfer(vaultId, walletId, otherWalletId, eur(400),
            noMetadata, "alice");
        Transaction flowTransfer = Transaction.flowTransfer(vaultId, flowId, otherFlowId, eur(400),
            noMetadata, "alice");

        assertEquals(List.of(BalanceDelta.wallet(walletId, eur(-400)), BalanceDelta.wallet(otherWalletId, eur(400))),
            DeltaCalculator.legsFor(walletTransfer, null));
        assertEquals(List.of(BalanceDelta.cashFlow(flowId, eur(-400)), BalanceDelta.cashFlow(otherFlowId, eur(400))),
            DeltaCalculator.legsFor(flowTransfer, null));
    }

    @Test
    @DisplayName("Reversal negates every stored leg")
    void testReversal() {
        Transaction income = Transaction.income(vaultId, walletId, flowId, eur(700), noMetadata, "alice");
        Transaction posted = income.withLegs(DeltaCalculator.legsFor(income, null));

        List<BalanceDelta> reversal = DeltaCalculator.reversalOf(posted);

        assertEquals(List.of(BalanceDelta.wallet(walletId, eur(-700)), BalanceDelta.cashFlow(flowId, eur(-700))),
            reversal);
    }

    @Test
    @DisplayName("Non-positive amounts and refunds of refunds are rejected")
    void testRejections() {
        Transaction zero = Transaction.income(vaultId, walletId, null, eur(0), noMetadata, "alice");
        LedgerException amount = assertThrows(LedgerException.class, () -> DeltaCalculator.legsFor(zero, null));
        assertEquals(ErrorKind.INVALID_AMOUNT, amount.getKind());

        Transaction expense = Transaction.expense(vaultId, walletId, null, eur(100), noMetadata, "alice");
        Transaction refund = Transaction.refund(expense, eur(50), noMetadata, "alice");
        Transaction refundOfRefund = Transaction.refund(refund, eur(10), noMetadata, "alice");
        LedgerException state = assertThrows(LedgerException.class,
            () -> DeltaCalculator.legsFor(refundOfRefund, refund));
        assertEquals(ErrorKind.INVALID_STATE, state.getKind());
    }
}
