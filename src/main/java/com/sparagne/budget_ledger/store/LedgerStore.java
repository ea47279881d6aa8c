package com.sparagne.budget_ledger.store;

import com.sparagne.budget_ledger.ledger.DeltaTarget;
import com.sparagne.budget_ledger.ledger.LedgerCommit;
import com.sparagne.budget_ledger.ledger.Transaction;
import com.sparagne.budget_ledger.vault.CashFlow;
import com.sparagne.budget_ledger.vault.Membership;
import com.sparagne.budget_ledger.vault.Vault;
import com.sparagne.budget_ledger.vault.Wallet;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Durable store the ledger engine depends on.
 *
 * Implementations guarantee:
 * <ol>
 *   <li>{@link #inVaultTransaction} runs its work under mutual exclusion with
 *       every other unit of work on the same vault, and either all writes made
 *       inside it persist or none do.</li>
 *   <li>{@link #commit} applies the transaction record and every delta of a
 *       {@link LedgerCommit} atomically.</li>
 *   <li>Readers never observe a partially applied commit.</li>
 * </ol>
 * Failures of the underlying storage are reported as
 * {@code LedgerException(STORE_FAILURE)} and leave prior state unchanged.
 */
public interface LedgerStore {

    /**
     * Runs {@code work} in a unit of work serialized per vault. Exceptions thrown by
     * {@code work} roll back everything it wrote.
     */
    <T> T inVaultTransaction(UUID vaultId, Supplier<T> work);

    /**
     * Runs {@code work} in a write unit of work for vault creation by {@code owner}.
     * Implementations either serialize these units per owner or reject a second
     * vault with the same case-insensitive name for the owner with
     * {@code LedgerException(INVALID_INPUT)} when it is inserted.
     */
    <T> T inOwnerTransaction(String owner, Supplier<T> work);

    /**
     * Runs {@code work} in a read-only unit of work (read-committed or better).
     */
    <T> T readOnly(Supplier<T> work);

    // Vaults

    void insertVault(Vault vault);

    Optional<Vault> findVault(UUID vaultId);

    /**
     * Vaults the user owns or holds any membership in.
     */
    List<Vault> findVaultsVisibleTo(String username);

    boolean hasLedgerContent(UUID vaultId);

    /**
     * Removes the vault with its wallets, flows, memberships, transactions and legs.
     */
    void deleteVault(UUID vaultId);

    // Memberships

    /**
     * Inserts or replaces the membership keyed by (vault, cash flow, username).
     */
    void saveMembership(Membership membership);

    boolean deleteMembership(UUID vaultId, UUID cashFlowId, String username);

    Optional<Membership> findMembership(UUID vaultId, UUID cashFlowId, String username);

    List<Membership> findMemberships(UUID vaultId);

    List<Membership> findMembershipsOf(UUID vaultId, String username);

    // Wallets and cash flows. Detail updates (name, archived flag, cash flow mode
    // and cap) never touch balances.

    void insertWallet(Wallet wallet);

    void updateWalletDetails(Wallet wallet);

    Optional<Wallet> findWallet(UUID walletId);

    List<Wallet> findWallets(UUID vaultId);

    void insertCashFlow(CashFlow cashFlow);

    void updateCashFlowDetails(CashFlow cashFlow);

    Optional<CashFlow> findCashFlow(UUID cashFlowId);

    List<CashFlow> findCashFlows(UUID vaultId);

    // Transactions

    Optional<Transaction> findTransaction(UUID transactionId);

    List<Transaction> findRefundsOf(UUID originalId);

    List<Transaction> findTransactions(TransactionQuery query);

    /**
     * Posted transactions of the vault with {@code from <= occurredAt < to}; null bounds are open.
     */
    List<Transaction> findPostedTransactions(UUID vaultId, Instant from, Instant to);

    /**
     * Sum of the positive legs of posted transactions on the cash flow: the
     * running income total that INCOME_CAPPED flows are bounded by.
     */
    long sumPostedInflow(UUID vaultId, UUID cashFlowId);

    /**
     * Sum of the legs of posted transactions, per target, for balance verification.
     */
    Map<DeltaTarget, Map<UUID, Long>> sumPostedLegs(UUID vaultId);

    /**
     * Persists a ledger commit atomically.
     */
    void commit(LedgerCommit commit);
}
