package com.sparagne.budget_ledger.store.jpa;

import com.sparagne.budget_ledger.exception.ErrorKind;
import com.sparagne.budget_ledger.exception.LedgerException;
import com.sparagne.budget_ledger.ledger.EntryCommand;
import com.sparagne.budget_ledger.ledger.LedgerEngine;
import com.sparagne.budget_ledger.ledger.RefundCommand;
import com.sparagne.budget_ledger.ledger.Transaction;
import com.sparagne.budget_ledger.ledger.TransactionFilter;
import com.sparagne.budget_ledger.ledger.TransactionPage;
import com.sparagne.budget_ledger.money.CurrencyCode;
import com.sparagne.budget_ledger.vault.Vault;
import com.sparagne.budget_ledger.vault.VaultService;
import com.sparagne.budget_ledger.vault.Wallet;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * The production schema and row locking against a real PostgreSQL.
 * Skipped when Docker is not available.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class PostgresLedgerStoreTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("budget_ledger_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("ledger.store", () -> "jpa");
    }

    @Autowired
    private LedgerEngine engine;

    @Autowired
    private VaultService vaultService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private long balanceOf(UUID walletId) {
        Long balance = jdbcTemplate.queryForObject(
            "SELECT balance_minor FROM wallets WHERE id = ?", Long.class, walletId);
        return balance != null ? balance : 0L;
    }

    @Test
    @DisplayName("Racing refunds on PostgreSQL never exceed the original amount")
    void testConcurrentRefunds() throws Exception {
        printTestHeader("Concurrent refunds on PostgreSQL");

        String owner = "pg-" + UUID.randomUUID();
        Vault vault = vaultService.createVault(owner, "Household", CurrencyCode.EUR);
        Wallet wallet = vaultService.createWallet(vault.getId(), owner, "Checking");
        Transaction expense = engine.recordExpense(owner, EntryCommand.builder()
            .vaultId(vault.getId()).walletId(wallet.getId()).amountMinor(10000L).build());

        int threads = 6;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger accepted = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    try {
                        engine.recordRefund(owner, RefundCommand.builder()
                            .originalId(expense.getId()).amountMinor(4000L).build());
                        accepted.incrementAndGet();
                    } catch (LedgerException e) {
                        assertEquals(ErrorKind.INVALID_AMOUNT, e.getKind());
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(60, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(2, accepted.get());
        assertEquals(-2000, balanceOf(wallet.getId()));
        assertEquals(2000, engine.refundableRemainder(expense.getId(), owner).getMinor());
        assertTrue(engine.verifyBalances(vault.getId(), owner).isConsistent());
        printSuccess("Exactly two refunds accepted");
    }

    @Test
    @DisplayName("The schema rejects non-positive amounts even when the application is bypassed")
    void testAmountCheckConstraint() {
        String owner = "pg-" + UUID.randomUUID();
        Vault vault = vaultService.createVault(owner, "Household", CurrencyCode.EUR);

        assertThrows(Exception.class, () -> jdbcTemplate.update(
            "INSERT INTO transactions (id, vault_id, type, amount_minor, currency, occurred_at, recorded_at, " +
                "created_by, state, updated_at) VALUES (?, ?, 'INCOME', 0, 'EUR', now(), now(), ?, 'POSTED', now())",
            UUID.randomUUID(), vault.getId(), owner));
    }

    @Test
    @DisplayName("Keyset pagination orders ties by id the same way on PostgreSQL")
    void testPaginationOnPostgres() {
        String owner = "pg-" + UUID.randomUUID();
        Vault vault = vaultService.createVault(owner, "Household", CurrencyCode.EUR);
        Wallet wallet = vaultService.createWallet(vault.getId(), owner, "Checking");
        Instant at = Instant.parse("2024-01-01T00:00:00Z");
        for (int i = 0; i < 5; i++) {
            engine.recordIncome(owner, EntryCommand.builder().vaultId(vault.getId()).walletId(wallet.getId())
                .amountMinor(10L).occurredAt(at).build());
        }

        List<UUID> seen = new ArrayList<>();
        String cursor = null;
        do {
            TransactionPage page = engine.listTransactions(vault.getId(), owner,
                TransactionFilter.builder().limit(2).cursor(cursor).build());
            page.getItems().forEach(t -> seen.add(t.getId()));
            cursor = page.getNextCursor();
        } while (cursor != null);

        assertEquals(5, seen.size());
        assertEquals(5, seen.stream().distinct().count());
    }
}
