package com.sparagne.budget_ledger.statistics;

import com.sparagne.budget_ledger.ledger.BalanceDelta;
import com.sparagne.budget_ledger.ledger.DeltaTarget;
import com.sparagne.budget_ledger.ledger.LedgerCommittedEvent;
import com.sparagne.budget_ledger.ledger.Transaction;
import com.sparagne.budget_ledger.money.CurrencyCode;
import com.sparagne.budget_ledger.money.Money;
import com.sparagne.budget_ledger.observability.LedgerMetrics;
import com.sparagne.budget_ledger.store.LedgerStore;
import com.sparagne.budget_ledger.vault.AccessGate;
import com.sparagne.budget_ledger.vault.AccessGrant;
import com.sparagne.budget_ledger.vault.Capability;
import com.sparagne.budget_ledger.vault.CashFlow;
import com.sparagne.budget_ledger.vault.Wallet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Read-only aggregates over posted transactions.
 *
 * Results are cached per (vault, period), tagged with the vault generation
 * read before computing them. Every {@link LedgerCommittedEvent} for a vault
 * bumps the generation and drops the vault's entries. An entry is served only
 * while its tag equals the current generation, so a result stored after a
 * racing commit is treated as a miss.
 */
@Service
@Slf4j
public class StatisticsService {

    private final LedgerStore store;
    private final AccessGate accessGate;
    private final LedgerMetrics metrics;
    private final int maxCacheEntries;

    private final Map<CacheKey, CachedStatistics> cache = new ConcurrentHashMap<>();
    private final Map<UUID, AtomicLong> generations = new ConcurrentHashMap<>();

    public StatisticsService(LedgerStore store,
                             AccessGate accessGate,
                             LedgerMetrics metrics,
                             @Value("${ledger.statistics.cache-size:1000}") int maxCacheEntries) {
        this.store = store;
        this.accessGate = accessGate;
        this.metrics = metrics;
        this.maxCacheEntries = maxCacheEntries;
    }

    public VaultStatistics getStatistics(UUID vaultId, String caller, StatisticsPeriod period) {
        StatisticsPeriod window = period != null ? period : StatisticsPeriod.ALL_TIME;
        AccessGrant grant = store.readOnly(() -> accessGate.require(vaultId, caller, Capability.VIEW));

        CacheKey key = new CacheKey(vaultId, window.getFrom(), window.getTo());
        long generation = generationOf(vaultId).get();
        CachedStatistics cached = cache.get(key);
        VaultStatistics statistics;
        if (cached != null && cached.getGeneration() == generation) {
            metrics.recordStatisticsCacheHit();
            statistics = cached.getStatistics();
        } else {
            metrics.recordStatisticsCacheMiss();
            statistics = store.readOnly(() -> compute(vaultId, window));
            if (cache.size() >= maxCacheEntries) {
                cache.clear();
            }
            cache.merge(key, new CachedStatistics(generation, statistics),
                (current, fresh) -> current.getGeneration() >= fresh.getGeneration() ? current : fresh);
        }
        return grant.isVaultWide() ? statistics : statistics.restrictedTo(grant.getCashFlowIds());
    }

    @EventListener
    public void onLedgerCommitted(LedgerCommittedEvent event) {
        generationOf(event.getVaultId()).incrementAndGet();
        cache.keySet().removeIf(key -> key.getVaultId().equals(event.getVaultId()));
        log.debug("Statistics cache invalidated: vaultId={}, operation={}", event.getVaultId(), event.getOperation());
    }

    private AtomicLong generationOf(UUID vaultId) {
        return generations.computeIfAbsent(vaultId, id -> new AtomicLong());
    }

    private VaultStatistics compute(UUID vaultId, StatisticsPeriod period) {
        CurrencyCode currency = store.findVault(vaultId)
            .orElseThrow(() -> new IllegalStateException("Vault disappeared: " + vaultId))
            .getCurrency();
        List<Wallet> wallets = store.findWallets(vaultId);
        List<CashFlow> cashFlows = store.findCashFlows(vaultId);
        List<Transaction> transactions = store.findPostedTransactions(vaultId, period.getFrom(), period.getTo());

        Map<UUID, Accumulator> perTarget = new HashMap<>();
        Money zero = Money.zero(currency);
        Money income = zero;
        Money expenses = zero;
        Money expenseRefunds = zero;
        Money incomeRefunds = zero;

        for (Transaction tx : transactions) {
            for (BalanceDelta leg : tx.getLegs()) {
                perTarget.computeIfAbsent(leg.getTargetId(), id -> new Accumulator(currency)).add(leg.getAmount());
            }
            switch (tx.getType()) {
                case INCOME -> income = income.plus(tx.getAmount());
                case EXPENSE -> expenses = expenses.plus(tx.getAmount());
                case REFUND -> {
                    // a refund of an expense credits its targets, a refund of an income debits them
                    if (!tx.getLegs().isEmpty() && tx.getLegs().get(0).getAmount().isPositive()) {
                        expenseRefunds = expenseRefunds.plus(tx.getAmount());
                    } else {
                        incomeRefunds = incomeRefunds.plus(tx.getAmount());
                    }
                }
                case TRANSFER_WALLET, TRANSFER_FLOW -> {
                    // internal moves, no vault-level effect
                }
            }
        }

        Money balance = wallets.stream()
            .filter(w -> !w.isArchived())
            .map(Wallet::getBalance)
            .reduce(zero, Money::plus);

        return VaultStatistics.builder()
            .vaultId(vaultId)
            .currency(currency)
            .period(period)
            .wallets(wallets.stream()
                .map(w -> totals(DeltaTarget.WALLET, w.getId(), w.getName(), w.isArchived(), w.getBalance(),
                    perTarget.get(w.getId()), zero))
                .toList())
            .cashFlows(cashFlows.stream()
                .map(f -> totals(DeltaTarget.CASH_FLOW, f.getId(), f.getName(), f.isArchived(), f.getBalance(),
                    perTarget.get(f.getId()), zero))
                .toList())
            .totalIncome(income)
            .totalExpenses(expenses.minus(expenseRefunds))
            .incomeRefunds(incomeRefunds)
            .balance(balance)
            .transactionCount(transactions.size())
            .generatedAt(Instant.now())
            .build();
    }

    private static TargetTotals totals(DeltaTarget target, UUID id, String name, boolean archived, Money balance,
                                       Accumulator accumulator, Money zero) {
        Money inflow = accumulator != null ? accumulator.inflow : zero;
        Money outflow = accumulator != null ? accumulator.outflow : zero;
        return new TargetTotals(target, id, name, archived, inflow, outflow, inflow.minus(outflow), balance);
    }

    private static final class Accumulator {
        private Money inflow;
        private Money outflow;

        private Accumulator(CurrencyCode currency) {
            this.inflow = Money.zero(currency);
            this.outflow = Money.zero(currency);
        }

        private void add(Money amount) {
            if (amount.isNegative()) {
                outflow = outflow.plus(amount.negate());
            } else {
                inflow = inflow.plus(amount);
            }
        }
    }

    @lombok.Value
    private static class CachedStatistics {
        long generation;
        VaultStatistics statistics;
    }

    @lombok.Value
    private static class CacheKey {
        UUID vaultId;
        Instant from;
        Instant to;
    }
}
