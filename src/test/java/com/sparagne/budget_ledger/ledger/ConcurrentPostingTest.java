package com.sparagne.budget_ledger.ledger;

import com.sparagne.budget_ledger.LedgerFixture;
import com.sparagne.budget_ledger.exception.ErrorKind;
import com.sparagne.budget_ledger.exception.LedgerException;
import com.sparagne.budget_ledger.vault.Vault;
import com.sparagne.budget_ledger.vault.Wallet;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static com.sparagne.budget_ledger.LedgerFixture.transfer;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Concurrent commands against one vault must serialize: no lost updates and
 * no over-refund.
 */
class ConcurrentPostingTest {

    private static final int THREADS = 8;

    @Test
    @DisplayName("Concurrent incomes and transfers produce exact final balances")
    void testConcurrentPostings() throws Exception {
        LedgerFixture fx = new LedgerFixture();
        Vault vault = fx.vault("grace");
        Wallet a = fx.wallet(vault, "A");
        Wallet b = fx.wallet(vault, "B");
        int perThread = 50;

        ExecutorService pool = Executors.newFixedThreadPool(THREADS);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < THREADS; t++) {
                boolean mover = t % 2 == 0;
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        fx.income(vault, a.getId(), null, 10);
                        if (mover) {
                            fx.engine.transferWallet("grace", transfer(vault, a.getId(), b.getId(), 3));
                        }
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        long movers = THREADS / 2;
        assertEquals(THREADS * perThread * 10L - movers * perThread * 3L, fx.walletBalance(a.getId()));
        assertEquals(movers * perThread * 3L, fx.walletBalance(b.getId()));
        assertTrue(fx.engine.verifyBalances(vault.getId(), "grace").isConsistent());
    }

    @Test
    @DisplayName("Racing refunds never exceed the original amount")
    void testConcurrentRefunds() throws Exception {
        LedgerFixture fx = new LedgerFixture();
        Vault vault = fx.vault("heidi");
        Wallet wallet = fx.wallet(vault, "Main");
        Transaction expense = fx.expense(vault, wallet.getId(), null, 10000);

        ExecutorService pool = Executors.newFixedThreadPool(THREADS);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger accepted = new AtomicInteger();
        AtomicInteger rejected = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < THREADS; t++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    try {
                        fx.engine.recordRefund("heidi", RefundCommand.builder()
                            .originalId(expense.getId()).amountMinor(3000L).build());
                        accepted.incrementAndGet();
                    } catch (LedgerException e) {
                        assertEquals(ErrorKind.INVALID_AMOUNT, e.getKind());
                        rejected.incrementAndGet();
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(3, accepted.get());
        assertEquals(THREADS - 3, rejected.get());
        assertEquals(1000, fx.engine.refundableRemainder(expense.getId(), "heidi").getMinor());
        assertEquals(-1000, fx.walletBalance(wallet.getId()));
    }
}
