package com.sparagne.budget_ledger.store.memory;

import com.sparagne.budget_ledger.exception.LedgerException;
import com.sparagne.budget_ledger.ledger.BalanceDelta;
import com.sparagne.budget_ledger.ledger.DeltaTarget;
import com.sparagne.budget_ledger.ledger.LedgerCommit;
import com.sparagne.budget_ledger.ledger.Transaction;
import com.sparagne.budget_ledger.ledger.TransactionCursor;
import com.sparagne.budget_ledger.store.LedgerStore;
import com.sparagne.budget_ledger.store.TransactionQuery;
import com.sparagne.budget_ledger.vault.CashFlow;
import com.sparagne.budget_ledger.vault.Membership;
import com.sparagne.budget_ledger.vault.Vault;
import com.sparagne.budget_ledger.vault.Wallet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * {@link LedgerStore} kept entirely in memory, for tests and single-process use.
 *
 * Published state is an immutable snapshot swapped atomically. A unit of work
 * reads and writes a private copy and records each write; on success the
 * recorded writes are replayed onto the latest snapshot and the result is
 * published in one step, so readers see either none or all of a commit.
 * Units of work on the same vault are serialized by a per-vault lock, which is
 * dropped once the vault is deleted. Vault creation is serialized per owner.
 */
@Component
@ConditionalOnProperty(name = "ledger.store", havingValue = "memory")
@Slf4j
public class InMemoryLedgerStore implements LedgerStore {

    static final Comparator<Transaction> NEWEST_FIRST = Comparator
        .comparing(Transaction::getOccurredAt).reversed()
        .thenComparing((Transaction tx) -> tx.getId().toString(), Comparator.reverseOrder());

    private final Map<UUID, ReentrantLock> vaultLocks = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> ownerLocks = new ConcurrentHashMap<>();
    private final ThreadLocal<UnitOfWork> currentUnit = new ThreadLocal<>();
    private final Object publishLock = new Object();
    private volatile Snapshot published = new Snapshot();

    @Override
    public <T> T inVaultTransaction(UUID vaultId, Supplier<T> work) {
        if (!read().vaults.containsKey(vaultId)) {
            throw LedgerException.notFound("vault", vaultId);
        }
        ReentrantLock lock = vaultLocks.computeIfAbsent(vaultId, id -> new ReentrantLock());
        lock.lock();
        try {
            // deleted while we waited for the lock
            if (!read().vaults.containsKey(vaultId)) {
                throw LedgerException.notFound("vault", vaultId);
            }
            return runUnit(work, false);
        } finally {
            lock.unlock();
            if (!published.vaults.containsKey(vaultId)) {
                vaultLocks.remove(vaultId, lock);
            }
        }
    }

    @Override
    public <T> T inOwnerTransaction(String owner, Supplier<T> work) {
        ReentrantLock lock = ownerLocks.computeIfAbsent(owner, name -> new ReentrantLock());
        lock.lock();
        try {
            return runUnit(work, false);
        } finally {
            lock.unlock();
        }
    }

    boolean holdsVaultLock(UUID vaultId) {
        return vaultLocks.containsKey(vaultId);
    }

    @Override
    public <T> T readOnly(Supplier<T> work) {
        return runUnit(work, true);
    }

    private <T> T runUnit(Supplier<T> work, boolean readOnly) {
        if (currentUnit.get() != null) {
            return work.get();
        }
        // published snapshots are never mutated, so readers can share one
        Snapshot base = published;
        UnitOfWork unit = new UnitOfWork(readOnly ? base : base.copy(), readOnly);
        currentUnit.set(unit);
        try {
            T result = work.get();
            if (!unit.writes.isEmpty()) {
                publish(unit.writes);
            }
            return result;
        } finally {
            currentUnit.remove();
        }
    }

    private void publish(List<Consumer<Snapshot>> writes) {
        synchronized (publishLock) {
            Snapshot next = published.copy();
            writes.forEach(write -> write.accept(next));
            published = next;
        }
    }

    private Snapshot read() {
        UnitOfWork unit = currentUnit.get();
        return unit != null ? unit.working : published;
    }

    private void write(Consumer<Snapshot> change) {
        UnitOfWork unit = currentUnit.get();
        if (unit == null) {
            publish(List.of(change));
            return;
        }
        if (unit.readOnly) {
            throw new IllegalStateException("Write attempted in a read-only unit of work");
        }
        change.accept(unit.working);
        unit.writes.add(change);
    }

    /**
     * Called before each delta of a commit is applied. Throwing from here aborts
     * the whole unit of work.
     */
    protected void beforeDelta(LedgerCommit commit, BalanceDelta delta, int position) {
    }

    // Vaults

    @Override
    public void insertVault(Vault vault) {
        write(s -> s.vaults.put(vault.getId(), vault));
    }

    @Override
    public Optional<Vault> findVault(UUID vaultId) {
        return Optional.ofNullable(read().vaults.get(vaultId));
    }

    @Override
    public List<Vault> findVaultsVisibleTo(String username) {
        Snapshot s = read();
        return s.vaults.values().stream()
            .filter(v -> v.isOwnedBy(username)
                || s.memberships.values().stream()
                    .anyMatch(m -> m.getVaultId().equals(v.getId()) && m.getUsername().equals(username)))
            .sorted(Comparator.comparing(Vault::getCreatedAt))
            .toList();
    }

    @Override
    public boolean hasLedgerContent(UUID vaultId) {
        Snapshot s = read();
        return s.wallets.values().stream().anyMatch(w -> w.getVaultId().equals(vaultId))
            || s.cashFlows.values().stream().anyMatch(f -> f.getVaultId().equals(vaultId))
            || s.transactions.values().stream().anyMatch(t -> t.getVaultId().equals(vaultId));
    }

    @Override
    public void deleteVault(UUID vaultId) {
        write(s -> {
            s.transactions.values().removeIf(t -> t.getVaultId().equals(vaultId));
            s.memberships.values().removeIf(m -> m.getVaultId().equals(vaultId));
            s.wallets.values().removeIf(w -> w.getVaultId().equals(vaultId));
            s.cashFlows.values().removeIf(f -> f.getVaultId().equals(vaultId));
            s.vaults.remove(vaultId);
        });
    }

    // Memberships

    @Override
    public void saveMembership(Membership membership) {
        String key = membershipKey(membership.getVaultId(), membership.getCashFlowId(), membership.getUsername());
        write(s -> {
            Membership existing = s.memberships.get(key);
            s.memberships.put(key, existing != null ? existing.withRole(membership.getRole()) : membership);
        });
    }

    @Override
    public boolean deleteMembership(UUID vaultId, UUID cashFlowId, String username) {
        String key = membershipKey(vaultId, cashFlowId, username);
        if (!read().memberships.containsKey(key)) {
            return false;
        }
        write(s -> s.memberships.remove(key));
        return true;
    }

    @Override
    public Optional<Membership> findMembership(UUID vaultId, UUID cashFlowId, String username) {
        return Optional.ofNullable(read().memberships.get(membershipKey(vaultId, cashFlowId, username)));
    }

    @Override
    public List<Membership> findMemberships(UUID vaultId) {
        return read().memberships.values().stream()
            .filter(m -> m.getVaultId().equals(vaultId))
            .sorted(Comparator.comparing(Membership::getGrantedAt))
            .toList();
    }

    @Override
    public List<Membership> findMembershipsOf(UUID vaultId, String username) {
        return findMemberships(vaultId).stream()
            .filter(m -> m.getUsername().equals(username))
            .toList();
    }

    private static String membershipKey(UUID vaultId, UUID cashFlowId, String username) {
        return vaultId + "|" + (cashFlowId == null ? "*" : cashFlowId) + "|" + username;
    }

    // Wallets and cash flows

    @Override
    public void insertWallet(Wallet wallet) {
        write(s -> s.wallets.put(wallet.getId(), wallet));
    }

    @Override
    public void updateWalletDetails(Wallet wallet) {
        if (!read().wallets.containsKey(wallet.getId())) {
            throw LedgerException.notFound("wallet", wallet.getId());
        }
        write(s -> s.wallets.computeIfPresent(wallet.getId(), (id, current) ->
            new Wallet(id, current.getVaultId(), wallet.getName(), current.getBalance(), wallet.isArchived(),
                current.getCreatedAt())));
    }

    @Override
    public Optional<Wallet> findWallet(UUID walletId) {
        return Optional.ofNullable(read().wallets.get(walletId));
    }

    @Override
    public List<Wallet> findWallets(UUID vaultId) {
        return read().wallets.values().stream()
            .filter(w -> w.getVaultId().equals(vaultId))
            .sorted(Comparator.comparing(Wallet::getCreatedAt))
            .toList();
    }

    @Override
    public void insertCashFlow(CashFlow cashFlow) {
        write(s -> s.cashFlows.put(cashFlow.getId(), cashFlow));
    }

    @Override
    public void updateCashFlowDetails(CashFlow cashFlow) {
        if (!read().cashFlows.containsKey(cashFlow.getId())) {
            throw LedgerException.notFound("cash_flow", cashFlow.getId());
        }
        write(s -> s.cashFlows.computeIfPresent(cashFlow.getId(), (id, current) ->
            new CashFlow(id, current.getVaultId(), cashFlow.getName(), current.getBalance(), cashFlow.getMode(),
                cashFlow.getCapMinor(), cashFlow.isArchived(), current.getCreatedAt())));
    }

    @Override
    public Optional<CashFlow> findCashFlow(UUID cashFlowId) {
        return Optional.ofNullable(read().cashFlows.get(cashFlowId));
    }

    @Override
    public List<CashFlow> findCashFlows(UUID vaultId) {
        return read().cashFlows.values().stream()
            .filter(f -> f.getVaultId().equals(vaultId))
            .sorted(Comparator.comparing(CashFlow::getCreatedAt))
            .toList();
    }

    // Transactions

    @Override
    public Optional<Transaction> findTransaction(UUID transactionId) {
        return Optional.ofNullable(read().transactions.get(transactionId));
    }

    @Override
    public List<Transaction> findRefundsOf(UUID originalId) {
        return read().transactions.values().stream()
            .filter(t -> originalId.equals(t.getRefundOf()))
            .sorted(Comparator.comparing(Transaction::getRecordedAt))
            .toList();
    }

    @Override
    public List<Transaction> findTransactions(TransactionQuery query) {
        TransactionCursor cursor = query.getAfter();
        return read().transactions.values().stream()
            .filter(t -> t.getVaultId().equals(query.getVaultId()))
            .filter(t -> query.isIncludeVoided() || t.isPosted())
            .filter(t -> query.getWalletId() == null || touchesWallet(t, query.getWalletId()))
            .filter(t -> query.getCashFlowId() == null || touchesCashFlow(t, query.getCashFlowId()))
            .filter(t -> query.getVisibleFlows() == null || touchesAny(t, query.getVisibleFlows()))
            .filter(t -> query.getType() == null || t.getType() == query.getType())
            .filter(t -> within(t, query.getFrom(), query.getTo()))
            .filter(t -> cursor == null || cursor.precedes(t))
            .sorted(NEWEST_FIRST)
            .limit(query.getLimit())
            .toList();
    }

    @Override
    public List<Transaction> findPostedTransactions(UUID vaultId, Instant from, Instant to) {
        return read().transactions.values().stream()
            .filter(t -> t.getVaultId().equals(vaultId) && t.isPosted())
            .filter(t -> within(t, from, to))
            .sorted(NEWEST_FIRST)
            .toList();
    }

    @Override
    public long sumPostedInflow(UUID vaultId, UUID cashFlowId) {
        return read().transactions.values().stream()
            .filter(t -> t.getVaultId().equals(vaultId) && t.isPosted())
            .flatMap(t -> t.getLegs().stream())
            .filter(leg -> !leg.targetsWallet() && leg.getTargetId().equals(cashFlowId) && leg.getAmount().isPositive())
            .mapToLong(leg -> leg.getAmount().getMinor())
            .sum();
    }

    @Override
    public Map<DeltaTarget, Map<UUID, Long>> sumPostedLegs(UUID vaultId) {
        Map<DeltaTarget, Map<UUID, Long>> sums = new EnumMap<>(DeltaTarget.class);
        for (DeltaTarget target : DeltaTarget.values()) {
            sums.put(target, new HashMap<>());
        }
        read().transactions.values().stream()
            .filter(t -> t.getVaultId().equals(vaultId) && t.isPosted())
            .flatMap(t -> t.getLegs().stream())
            .forEach(leg -> sums.get(leg.getTarget())
                .merge(leg.getTargetId(), leg.getAmount().getMinor(), Long::sum));
        return sums;
    }

    @Override
    public void commit(LedgerCommit commit) {
        Transaction tx = commit.getTransaction();
        Snapshot current = read();
        if (commit.getKind() != LedgerCommit.Kind.POST && !current.transactions.containsKey(tx.getId())) {
            throw LedgerException.notFound("transaction", tx.getId());
        }
        List<BalanceDelta> deltas = commit.getDeltas();
        for (int i = 0; i < deltas.size(); i++) {
            BalanceDelta delta = deltas.get(i);
            beforeDelta(commit, delta, i);
            boolean exists = delta.targetsWallet()
                ? current.wallets.containsKey(delta.getTargetId())
                : current.cashFlows.containsKey(delta.getTargetId());
            if (!exists) {
                throw LedgerException.notFound(delta.targetsWallet() ? "wallet" : "cash_flow", delta.getTargetId());
            }
        }
        write(s -> {
            s.transactions.put(tx.getId(), tx);
            deltas.forEach(delta -> s.apply(delta));
        });
        log.debug("Committed {} of transaction {} with {} deltas", commit.getKind(), tx.getId(), deltas.size());
    }

    private static boolean touchesWallet(Transaction t, UUID walletId) {
        return walletId.equals(t.getWalletId()) || walletId.equals(t.getToWalletId());
    }

    private static boolean touchesCashFlow(Transaction t, UUID cashFlowId) {
        return cashFlowId.equals(t.getCashFlowId()) || cashFlowId.equals(t.getToCashFlowId());
    }

    private static boolean touchesAny(Transaction t, Set<UUID> cashFlowIds) {
        return (t.getCashFlowId() != null && cashFlowIds.contains(t.getCashFlowId()))
            || (t.getToCashFlowId() != null && cashFlowIds.contains(t.getToCashFlowId()));
    }

    private static boolean within(Transaction t, Instant from, Instant to) {
        return (from == null || !t.getOccurredAt().isBefore(from))
            && (to == null || t.getOccurredAt().isBefore(to));
    }

    private static final class UnitOfWork {
        private final Snapshot working;
        private final boolean readOnly;
        private final List<Consumer<Snapshot>> writes = new ArrayList<>();

        private UnitOfWork(Snapshot working, boolean readOnly) {
            this.working = working;
            this.readOnly = readOnly;
        }
    }

    private static final class Snapshot {
        private final Map<UUID, Vault> vaults;
        private final Map<UUID, Wallet> wallets;
        private final Map<UUID, CashFlow> cashFlows;
        private final Map<String, Membership> memberships;
        private final Map<UUID, Transaction> transactions;

        private Snapshot() {
            this(new HashMap<>(), new HashMap<>(), new HashMap<>(), new LinkedHashMap<>(), new LinkedHashMap<>());
        }

        private Snapshot(Map<UUID, Vault> vaults, Map<UUID, Wallet> wallets, Map<UUID, CashFlow> cashFlows,
                         Map<String, Membership> memberships, Map<UUID, Transaction> transactions) {
            this.vaults = vaults;
            this.wallets = wallets;
            this.cashFlows = cashFlows;
            this.memberships = memberships;
            this.transactions = transactions;
        }

        private Snapshot copy() {
            return new Snapshot(new HashMap<>(vaults), new HashMap<>(wallets), new HashMap<>(cashFlows),
                new LinkedHashMap<>(memberships), new LinkedHashMap<>(transactions));
        }

        private void apply(BalanceDelta delta) {
            UUID id = delta.getTargetId();
            switch (delta.getTarget()) {
                case WALLET -> {
                    Wallet w = Objects.requireNonNull(wallets.get(id), "wallet " + id);
                    wallets.put(id, new Wallet(id, w.getVaultId(), w.getName(), w.getBalance().plus(delta.getAmount()),
                        w.isArchived(), w.getCreatedAt()));
                }
                case CASH_FLOW -> {
                    CashFlow f = Objects.requireNonNull(cashFlows.get(id), "cash flow " + id);
                    cashFlows.put(id, f.withBalance(f.getBalance().plus(delta.getAmount())));
                }
            }
        }
    }
}
