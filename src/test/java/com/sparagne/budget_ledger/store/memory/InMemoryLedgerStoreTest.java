package com.sparagne.budget_ledger.store.memory;

import com.sparagne.budget_ledger.exception.ErrorKind;
import com.sparagne.budget_ledger.exception.LedgerException;
import com.sparagne.budget_ledger.money.CurrencyCode;
import com.sparagne.budget_ledger.vault.Vault;
import com.sparagne.budget_ledger.vault.Wallet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryLedgerStoreTest {

    private InMemoryLedgerStore store;
    private Vault vault;

    @BeforeEach
    void setUp() {
        store = new InMemoryLedgerStore();
        vault = Vault.create("Home", "kim", CurrencyCode.EUR);
        store.inOwnerTransaction("kim", () -> {
            store.insertVault(vault);
            return null;
        });
    }

    @Test
    @DisplayName("Writes of a failed unit of work are discarded")
    void testRollbackOnException() {
        Wallet wallet = Wallet.open(vault, "Cash");

        assertThrows(IllegalStateException.class, () -> store.inVaultTransaction(vault.getId(), () -> {
            store.insertWallet(wallet);
            assertTrue(store.findWallet(wallet.getId()).isPresent(), "visible inside its own unit");
            throw new IllegalStateException("abort");
        }));

        assertTrue(store.findWallet(wallet.getId()).isEmpty());
    }

    @Test
    @DisplayName("Other threads do not see writes before the unit of work completes")
    void testUncommittedWritesAreInvisible() throws Exception {
        Wallet wallet = Wallet.open(vault, "Cash");
        CountDownLatch written = new CountDownLatch(1);
        CountDownLatch checked = new CountDownLatch(1);
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<?> writer = pool.submit(() -> store.inVaultTransaction(vault.getId(), () -> {
                store.insertWallet(wallet);
                written.countDown();
                try {
                    checked.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return null;
            }));

            assertTrue(written.await(10, TimeUnit.SECONDS));
            assertTrue(store.readOnly(() -> store.findWallet(wallet.getId())).isEmpty());
            checked.countDown();
            writer.get(10, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        assertTrue(store.readOnly(() -> store.findWallet(wallet.getId())).isPresent());
    }

    @Test
    @DisplayName("Read-only units reject writes")
    void testReadOnlyRejectsWrites() {
        assertThrows(IllegalStateException.class, () -> store.readOnly(() -> {
            store.insertWallet(Wallet.open(vault, "Cash"));
            return null;
        }));
    }

    @Test
    @DisplayName("Units of work on unknown vaults fail with NOT_FOUND")
    void testUnknownVault() {
        LedgerException e = assertThrows(LedgerException.class, () ->
            store.inVaultTransaction(UUID.randomUUID(), () -> null));
        assertEquals(ErrorKind.NOT_FOUND, e.getKind());
    }

    @Test
    @DisplayName("Membership deletion reports whether anything was removed")
    void testDeleteMembership() {
        assertFalse(store.deleteMembership(vault.getId(), null, "nobody"));
    }

    @Test
    @DisplayName("Deleting a vault drops its lock; later units of work on it fail with NOT_FOUND")
    void testDeleteReleasesVaultLock() {
        store.inVaultTransaction(vault.getId(), () -> null);
        assertTrue(store.holdsVaultLock(vault.getId()));

        store.inVaultTransaction(vault.getId(), () -> {
            store.deleteVault(vault.getId());
            return null;
        });

        assertFalse(store.holdsVaultLock(vault.getId()));
        LedgerException e = assertThrows(LedgerException.class, () ->
            store.inVaultTransaction(vault.getId(), () -> null));
        assertEquals(ErrorKind.NOT_FOUND, e.getKind());
        assertFalse(store.holdsVaultLock(vault.getId()));
    }

    @Test
    @DisplayName("A failed delete keeps the vault and its lock")
    void testFailedDeleteKeepsLock() {
        assertThrows(IllegalStateException.class, () -> store.inVaultTransaction(vault.getId(), () -> {
            store.deleteVault(vault.getId());
            throw new IllegalStateException("abort");
        }));

        assertTrue(store.findVault(vault.getId()).isPresent());
        assertTrue(store.holdsVaultLock(vault.getId()));
    }

    @Test
    @DisplayName("A flow without transactions has no inflow")
    void testSumPostedInflowOfEmptyFlow() {
        assertEquals(0L, store.sumPostedInflow(vault.getId(), UUID.randomUUID()));
    }
}
