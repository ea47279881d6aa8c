package com.sparagne.budget_ledger.ledger;

import com.sparagne.budget_ledger.LedgerFixture;
import com.sparagne.budget_ledger.exception.ErrorKind;
import com.sparagne.budget_ledger.exception.LedgerException;
import com.sparagne.budget_ledger.money.CurrencyCode;
import com.sparagne.budget_ledger.vault.CashFlow;
import com.sparagne.budget_ledger.vault.MembershipRole;
import com.sparagne.budget_ledger.vault.Vault;
import com.sparagne.budget_ledger.vault.Wallet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static com.sparagne.budget_ledger.LedgerFixture.entry;
import static com.sparagne.budget_ledger.LedgerFixture.transfer;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Ledger engine behavior over the in-memory store: recording, refunds, voids,
 * corrections and listings, plus the rejections each of them can produce.
 */
class LedgerEngineTest {

    private LedgerFixture fx;
    private Vault vault;
    private Wallet checking;
    private Wallet savings;
    private CashFlow groceries;
    private CashFlow holidays;

    @BeforeEach
    void setUp() {
        fx = new LedgerFixture();
        vault = fx.vault("alice");
        checking = fx.wallet(vault, "Checking");
        savings = fx.wallet(vault, "Savings");
        groceries = fx.cashFlow(vault, "Groceries");
        holidays = fx.cashFlow(vault, "Holidays");
    }

    // Helper methods for test output
    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printExpectedException(LedgerException e) {
        System.out.println("⚠ EXPECTED EXCEPTION: " + e.getKind());
        System.out.println("  Reason: " + e.getMessage());
    }

    private LedgerException assertLedgerError(ErrorKind kind, Executable executable) {
        LedgerException e = assertThrows(LedgerException.class, executable);
        printExpectedException(e);
        assertEquals(kind, e.getKind(), e.getMessage());
        return e;
    }

    @Test
    @DisplayName("Income, expense, void and refund follow the documented end-to-end scenario")
    void testEndToEndScenario() {
        printTestHeader("End-to-end scenario");

        // Given: a USD vault with one empty wallet
        Vault usd = fx.vaults.createVault("dana", "Travel fund", CurrencyCode.USD);
        Wallet wallet = fx.wallet(usd, "Cash");
        assertEquals(0, fx.walletBalance(wallet.getId()));

        // When/Then: each step moves the balance as described
        Transaction income = fx.engine.recordIncome("dana", EntryCommand.builder()
            .vaultId(usd.getId()).walletId(wallet.getId()).amountMinor(10000L).note("salary").build());
        assertEquals(10000, fx.walletBalance(wallet.getId()));

        Transaction expense = fx.engine.recordExpense("dana", EntryCommand.builder()
            .vaultId(usd.getId()).walletId(wallet.getId()).amountMinor(2500L).note("groceries").build());
        assertEquals(7500, fx.walletBalance(wallet.getId()));

        fx.engine.voidTransaction(expense.getId(), "dana");
        assertEquals(10000, fx.walletBalance(wallet.getId()));

        fx.engine.recordRefund("dana", RefundCommand.builder()
            .originalId(income.getId()).amountMinor(10000L).build());
        assertEquals(0, fx.walletBalance(wallet.getId()));
        assertEquals(0, fx.engine.refundableRemainder(income.getId(), "dana").getMinor());

        assertLedgerError(ErrorKind.INVALID_AMOUNT, () -> fx.engine.recordRefund("dana", RefundCommand.builder()
            .originalId(income.getId()).amountMinor(1L).build()));
        printOutput("Final balance", fx.store.findWallet(wallet.getId()).orElseThrow().getBalance());
    }

    @Test
    @DisplayName("Income and expense move both the wallet and the cash flow")
    void testEntriesMoveWalletAndFlow() {
        Transaction income = fx.income(vault, checking.getId(), groceries.getId(), 5000);
        Transaction expense = fx.expense(vault, checking.getId(), groceries.getId(), 7000);

        assertEquals(TransactionType.INCOME, income.getType());
        assertEquals(TransactionState.POSTED, expense.getState());
        assertEquals(-2000, fx.walletBalance(checking.getId()), "overdraft is permitted");
        assertEquals(-2000, fx.cashFlowBalance(groceries.getId()));
        assertEquals(2, expense.getLegs().size());
    }

    @Test
    @DisplayName("An entry may target only a cash flow, but never nothing")
    void testEntryParticipants() {
        fx.expense(vault, null, groceries.getId(), 1200);
        assertEquals(-1200, fx.cashFlowBalance(groceries.getId()));
        assertEquals(0, fx.walletBalance(checking.getId()));

        assertLedgerError(ErrorKind.INVALID_INPUT, () -> fx.expense(vault, null, null, 100));
    }

    @Test
    @DisplayName("Non-positive amounts fail with INVALID_AMOUNT and write nothing")
    void testNonPositiveAmounts() {
        assertLedgerError(ErrorKind.INVALID_AMOUNT, () -> fx.income(vault, checking.getId(), null, 0));
        assertLedgerError(ErrorKind.INVALID_AMOUNT, () -> fx.expense(vault, checking.getId(), null, -5));
        assertLedgerError(ErrorKind.INVALID_AMOUNT, () -> fx.engine.recordIncome("alice",
            EntryCommand.builder().vaultId(vault.getId()).walletId(checking.getId()).build()));

        assertEquals(0, fx.walletBalance(checking.getId()));
        assertTrue(fx.events.stream().noneMatch(e -> e.getTransactionId() != null));
    }

    @Test
    @DisplayName("Unknown vault, wallet or cash flow fails with NOT_FOUND")
    void testUnknownReferences() {
        assertLedgerError(ErrorKind.NOT_FOUND, () -> fx.engine.recordIncome("alice",
            EntryCommand.builder().vaultId(UUID.randomUUID()).walletId(checking.getId()).amountMinor(5L).build()));
        assertLedgerError(ErrorKind.NOT_FOUND, () -> fx.income(vault, UUID.randomUUID(), null, 5));
        assertLedgerError(ErrorKind.NOT_FOUND, () -> fx.income(vault, checking.getId(), UUID.randomUUID(), 5));
        assertLedgerError(ErrorKind.NOT_FOUND, () -> fx.engine.voidTransaction(UUID.randomUUID(), "alice"));
    }

    @Test
    @DisplayName("A wallet of another vault is NOT_FOUND in this vault")
    void testCrossVaultWallet() {
        Vault other = fx.vault("alice");
        Wallet foreign = fx.wallet(other, "Foreign");

        assertLedgerError(ErrorKind.NOT_FOUND, () -> fx.income(vault, foreign.getId(), null, 100));
        assertLedgerError(ErrorKind.NOT_FOUND,
            () -> fx.engine.transferWallet("alice", transfer(vault, checking.getId(), foreign.getId(), 100)));
        assertEquals(0, fx.walletBalance(foreign.getId()));
    }

    @Test
    @DisplayName("A currency other than the vault's fails with CURRENCY_MISMATCH")
    void testCurrencyMismatch() {
        assertLedgerError(ErrorKind.CURRENCY_MISMATCH, () -> fx.engine.recordIncome("alice", EntryCommand.builder()
            .vaultId(vault.getId()).walletId(checking.getId()).amountMinor(100L).currency(CurrencyCode.USD).build()));

        Transaction ok = fx.engine.recordIncome("alice", EntryCommand.builder()
            .vaultId(vault.getId()).walletId(checking.getId()).amountMinor(100L).currency(CurrencyCode.EUR).build());
        assertEquals(CurrencyCode.EUR, ok.getAmount().getCurrency());
    }

    @Test
    @DisplayName("Callers without membership fail with UNAUTHORIZED")
    void testUnauthorizedCaller() {
        assertLedgerError(ErrorKind.UNAUTHORIZED,
            () -> fx.engine.recordIncome("mallory", entry(vault, checking.getId(), null, 100)));
        assertLedgerError(ErrorKind.UNAUTHORIZED,
            () -> fx.engine.recordIncome(" ", entry(vault, checking.getId(), null, 100)));
        assertEquals(0, fx.walletBalance(checking.getId()));
    }

    @Test
    @DisplayName("Viewers may read but not record")
    void testViewerCannotRecord() {
        Transaction income = fx.income(vault, checking.getId(), null, 100);
        fx.memberships.addVaultMember(vault.getId(), "alice", "victor", MembershipRole.VIEWER);

        assertEquals(income.getId(), fx.engine.getTransaction(income.getId(), "victor").getId());
        assertLedgerError(ErrorKind.UNAUTHORIZED,
            () -> fx.engine.recordExpense("victor", entry(vault, checking.getId(), null, 50)));
        assertLedgerError(ErrorKind.UNAUTHORIZED, () -> fx.engine.voidTransaction(income.getId(), "victor"));
    }

    @Test
    @DisplayName("Archived wallets and cash flows reject new transactions")
    void testArchivedTargets() {
        fx.vaults.setWalletArchived(vault.getId(), savings.getId(), "alice", true);
        fx.vaults.setCashFlowArchived(vault.getId(), holidays.getId(), "alice", true);

        assertLedgerError(ErrorKind.INVALID_STATE, () -> fx.income(vault, savings.getId(), null, 100));
        assertLedgerError(ErrorKind.INVALID_STATE, () -> fx.income(vault, checking.getId(), holidays.getId(), 100));
        assertLedgerError(ErrorKind.INVALID_STATE,
            () -> fx.engine.transferWallet("alice", transfer(vault, checking.getId(), savings.getId(), 100)));
        assertEquals(0, fx.walletBalance(checking.getId()));
    }

    // ==================== Transfers ====================

    @Test
    @DisplayName("Wallet transfer debits the source and credits the destination")
    void testWalletTransfer() {
        fx.income(vault, checking.getId(), null, 10000);

        Transaction tx = fx.engine.transferWallet("alice", transfer(vault, checking.getId(), savings.getId(), 4000));

        assertEquals(TransactionType.TRANSFER_WALLET, tx.getType());
        assertEquals(6000, fx.walletBalance(checking.getId()));
        assertEquals(4000, fx.walletBalance(savings.getId()));
    }

    @Test
    @DisplayName("Flow transfer moves budget between cash flows without touching wallets")
    void testFlowTransfer() {
        fx.engine.transferFlow("alice", transfer(vault, groceries.getId(), holidays.getId(), 2500));

        assertEquals(-2500, fx.cashFlowBalance(groceries.getId()));
        assertEquals(2500, fx.cashFlowBalance(holidays.getId()));
        assertEquals(0, fx.walletBalance(checking.getId()));
    }

    @Test
    @DisplayName("Transfers to the same wallet or flow fail with SAME_WALLET / SAME_FLOW")
    void testDegenerateTransfers() {
        assertLedgerError(ErrorKind.SAME_WALLET,
            () -> fx.engine.transferWallet("alice", transfer(vault, checking.getId(), checking.getId(), 100)));
        assertLedgerError(ErrorKind.SAME_FLOW,
            () -> fx.engine.transferFlow("alice", transfer(vault, groceries.getId(), groceries.getId(), 100)));
        assertLedgerError(ErrorKind.INVALID_INPUT,
            () -> fx.engine.transferWallet("alice", transfer(vault, null, savings.getId(), 100)));
    }

    // ==================== Refunds ====================

    @Test
    @DisplayName("Partial refunds track the remainder and reverse the original proportionally")
    void testPartialRefunds() {
        Transaction expense = fx.expense(vault, checking.getId(), groceries.getId(), 10000);

        Transaction first = fx.engine.recordRefund("alice",
            RefundCommand.builder().originalId(expense.getId()).amountMinor(3000L).note("returned item").build());
        assertEquals(expense.getId(), first.getRefundOf());
        assertEquals(-7000, fx.walletBalance(checking.getId()));
        assertEquals(-7000, fx.cashFlowBalance(groceries.getId()));
        assertEquals(7000, fx.engine.refundableRemainder(expense.getId(), "alice").getMinor());

        assertLedgerError(ErrorKind.INVALID_AMOUNT, () -> fx.engine.recordRefund("alice",
            RefundCommand.builder().originalId(expense.getId()).amountMinor(7001L).build()));

        fx.engine.recordRefund("alice", RefundCommand.builder().originalId(expense.getId()).amountMinor(7000L).build());
        assertEquals(0, fx.walletBalance(checking.getId()));
        assertEquals(0, fx.cashFlowBalance(groceries.getId()));
        assertEquals(0, fx.engine.refundableRemainder(expense.getId(), "alice").getMinor());
    }

    @Test
    @DisplayName("Voiding a refund restores the refundable remainder")
    void testVoidedRefundFreesRemainder() {
        Transaction expense = fx.expense(vault, checking.getId(), null, 5000);
        Transaction refund = fx.engine.recordRefund("alice",
            RefundCommand.builder().originalId(expense.getId()).amountMinor(5000L).build());
        assertEquals(0, fx.engine.refundableRemainder(expense.getId(), "alice").getMinor());

        fx.engine.voidTransaction(refund.getId(), "alice");

        assertEquals(5000, fx.engine.refundableRemainder(expense.getId(), "alice").getMinor());
        assertEquals(-5000, fx.walletBalance(checking.getId()));
    }

    @Test
    @DisplayName("Refunds of voided, transfer or refund transactions fail with INVALID_STATE")
    void testRefundRejections() {
        Transaction expense = fx.expense(vault, checking.getId(), null, 5000);
        fx.engine.voidTransaction(expense.getId(), "alice");
        assertLedgerError(ErrorKind.INVALID_STATE, () -> fx.engine.recordRefund("alice",
            RefundCommand.builder().originalId(expense.getId()).amountMinor(100L).build()));

        Transaction move = fx.engine.transferWallet("alice", transfer(vault, checking.getId(), savings.getId(), 100));
        assertLedgerError(ErrorKind.INVALID_STATE, () -> fx.engine.recordRefund("alice",
            RefundCommand.builder().originalId(move.getId()).amountMinor(100L).build()));
        assertEquals(0, fx.engine.refundableRemainder(move.getId(), "alice").getMinor());

        assertLedgerError(ErrorKind.NOT_FOUND, () -> fx.engine.recordRefund("alice",
            RefundCommand.builder().originalId(UUID.randomUUID()).amountMinor(100L).build()));
    }

    @Test
    @DisplayName("A refunded original cannot be voided until its refunds are voided")
    void testVoidWithPostedRefunds() {
        Transaction income = fx.income(vault, checking.getId(), null, 8000);
        Transaction refund = fx.engine.recordRefund("alice",
            RefundCommand.builder().originalId(income.getId()).amountMinor(2000L).build());

        assertLedgerError(ErrorKind.INVALID_STATE, () -> fx.engine.voidTransaction(income.getId(), "alice"));

        fx.engine.voidTransaction(refund.getId(), "alice");
        fx.engine.voidTransaction(income.getId(), "alice");
        assertEquals(0, fx.walletBalance(checking.getId()));
    }

    // ==================== Voids and corrections ====================

    @Test
    @DisplayName("Double void fails with ALREADY_VOIDED and leaves balances unchanged")
    void testDoubleVoid() {
        fx.income(vault, checking.getId(), null, 9000);
        Transaction expense = fx.expense(vault, checking.getId(), groceries.getId(), 4000);

        Transaction voided = fx.engine.voidTransaction(expense.getId(), "alice");
        assertEquals(TransactionState.VOIDED, voided.getState());
        assertEquals("alice", voided.getVoidedBy());
        assertEquals(9000, fx.walletBalance(checking.getId()));

        assertLedgerError(ErrorKind.ALREADY_VOIDED, () -> fx.engine.voidTransaction(expense.getId(), "alice"));
        assertEquals(9000, fx.walletBalance(checking.getId()));
        assertEquals(0, fx.cashFlowBalance(groceries.getId()));
        assertEquals(1.0, fx.meterRegistry.get("ledger.voids").counter().count());
    }

    @Test
    @DisplayName("Void then re-record equals recording once")
    void testVoidIsInverseOfItsOwnDelta() {
        Transaction first = fx.expense(vault, checking.getId(), null, 1234);
        fx.income(vault, checking.getId(), null, 500);
        fx.engine.voidTransaction(first.getId(), "alice");
        fx.expense(vault, checking.getId(), null, 1234);

        assertEquals(500 - 1234, fx.walletBalance(checking.getId()));
    }

    @Test
    @DisplayName("Update changes note and category only; other fields are IMMUTABLE")
    void testUpdateTransaction() {
        Transaction expense = fx.expense(vault, checking.getId(), groceries.getId(), 3000);

        Transaction updated = fx.engine.updateTransaction(expense.getId(), "alice",
            TransactionUpdate.builder().note("weekly shop").category("food").amountMinor(3000L).build());
        assertEquals("weekly shop", updated.getNote());
        assertEquals("food", updated.getCategory());
        assertEquals(-3000, fx.walletBalance(checking.getId()));

        Transaction cleared = fx.engine.updateTransaction(expense.getId(), "alice",
            TransactionUpdate.builder().category(" ").build());
        assertEquals("weekly shop", cleared.getNote());
        assertNull(cleared.getCategory());

        LedgerException e = assertLedgerError(ErrorKind.IMMUTABLE, () -> fx.engine.updateTransaction(
            expense.getId(), "alice", TransactionUpdate.builder().amountMinor(1L).build()));
        assertEquals("amount_minor", e.getField());
        assertLedgerError(ErrorKind.IMMUTABLE, () -> fx.engine.updateTransaction(expense.getId(), "alice",
            TransactionUpdate.builder().walletId(savings.getId()).build()));
        assertLedgerError(ErrorKind.IMMUTABLE, () -> fx.engine.updateTransaction(expense.getId(), "alice",
            TransactionUpdate.builder().type(TransactionType.INCOME).build()));
        assertLedgerError(ErrorKind.IMMUTABLE, () -> fx.engine.updateTransaction(expense.getId(), "alice",
            TransactionUpdate.builder().occurredAt(Instant.EPOCH).build()));

        fx.engine.voidTransaction(expense.getId(), "alice");
        assertLedgerError(ErrorKind.INVALID_STATE, () -> fx.engine.updateTransaction(expense.getId(), "alice",
            TransactionUpdate.builder().note("too late").build()));
    }

    // ==================== Listing ====================

    @Test
    @DisplayName("Listing pages newest first and hides voided transactions unless asked")
    void testListTransactionsPaging() {
        Instant base = Instant.parse("2024-05-01T00:00:00Z");
        List<UUID> recorded = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            recorded.add(fx.engine.recordIncome("alice", EntryCommand.builder()
                .vaultId(vault.getId()).walletId(checking.getId()).amountMinor(100L + i)
                .occurredAt(base.plusSeconds(i * 60L)).build()).getId());
        }
        fx.engine.voidTransaction(recorded.get(2), "alice");

        TransactionPage first = fx.engine.listTransactions(vault.getId(), "alice",
            TransactionFilter.builder().limit(2).build());
        assertEquals(List.of(recorded.get(4), recorded.get(3)), first.getItems().stream().map(Transaction::getId).toList());
        assertNotNull(first.getNextCursor());

        TransactionPage second = fx.engine.listTransactions(vault.getId(), "alice",
            TransactionFilter.builder().limit(2).cursor(first.getNextCursor()).build());
        assertEquals(List.of(recorded.get(1), recorded.get(0)), second.getItems().stream().map(Transaction::getId).toList());
        assertNull(second.getNextCursor());

        TransactionPage all = fx.engine.listTransactions(vault.getId(), "alice",
            TransactionFilter.builder().includeVoided(true).build());
        assertEquals(5, all.getItems().size());
    }

    @Test
    @DisplayName("Listing filters by wallet, cash flow, type and half-open time window")
    void testListTransactionsFilters() {
        Instant base = Instant.parse("2024-06-01T00:00:00Z");
        fx.engine.recordIncome("alice", EntryCommand.builder().vaultId(vault.getId()).walletId(checking.getId())
            .amountMinor(100L).occurredAt(base).build());
        fx.engine.recordExpense("alice", EntryCommand.builder().vaultId(vault.getId()).walletId(savings.getId())
            .cashFlowId(groceries.getId()).amountMinor(50L).occurredAt(base.plusSeconds(3600)).build());

        assertEquals(1, fx.engine.listTransactions(vault.getId(), "alice",
            TransactionFilter.builder().walletId(checking.getId()).build()).getItems().size());
        assertEquals(1, fx.engine.listTransactions(vault.getId(), "alice",
            TransactionFilter.builder().cashFlowId(groceries.getId()).build()).getItems().size());
        assertEquals(1, fx.engine.listTransactions(vault.getId(), "alice",
            TransactionFilter.builder().type(TransactionType.EXPENSE).build()).getItems().size());
        assertEquals(1, fx.engine.listTransactions(vault.getId(), "alice",
            TransactionFilter.builder().from(base).to(base.plusSeconds(3600)).build()).getItems().size());

        assertLedgerError(ErrorKind.INVALID_INPUT, () -> fx.engine.listTransactions(vault.getId(), "alice",
            TransactionFilter.builder().from(base).to(base).build()));
        assertLedgerError(ErrorKind.INVALID_INPUT, () -> fx.engine.listTransactions(vault.getId(), "alice",
            TransactionFilter.builder().limit(0).build()));
        assertLedgerError(ErrorKind.INVALID_INPUT, () -> fx.engine.listTransactions(vault.getId(), "alice",
            TransactionFilter.builder().cursor("not a cursor").build()));
    }

    // ==================== Verification and events ====================

    @Test
    @DisplayName("Balance verification agrees with posted legs after mixed operations")
    void testVerifyBalances() {
        Transaction income = fx.income(vault, checking.getId(), groceries.getId(), 10000);
        fx.engine.transferWallet("alice", transfer(vault, checking.getId(), savings.getId(), 2500));
        fx.engine.recordRefund("alice", RefundCommand.builder().originalId(income.getId()).amountMinor(1000L).build());
        Transaction expense = fx.expense(vault, savings.getId(), holidays.getId(), 700);
        fx.engine.voidTransaction(expense.getId(), "alice");

        BalanceReport report = fx.engine.verifyBalances(vault.getId(), "alice");

        printOutput("Report", report);
        assertTrue(report.isConsistent());
        assertEquals(2, report.getWalletsChecked());
        assertEquals(2, report.getCashFlowsChecked());
    }

    @Test
    @DisplayName("Each committed operation publishes one event and records metrics")
    void testEventsAndMetrics() {
        int before = fx.events.size();
        Transaction income = fx.income(vault, checking.getId(), null, 100);
        fx.engine.updateTransaction(income.getId(), "alice", TransactionUpdate.builder().note("n").build());
        assertThrows(LedgerException.class, () -> fx.income(vault, checking.getId(), null, -1));

        assertEquals(before + 2, fx.events.size());
        assertEquals(income.getId(), fx.events.get(before).getTransactionId());
        assertEquals(1.0, fx.meterRegistry.get("ledger.transactions")
            .tag("type", "INCOME").tag("outcome", "success").counter().count());
        assertEquals(1.0, fx.meterRegistry.get("ledger.transactions")
            .tag("type", "INCOME").tag("outcome", "invalid_amount").counter().count());
    }
}
