package com.sparagne.budget_ledger.statistics;

import com.sparagne.budget_ledger.money.CurrencyCode;
import com.sparagne.budget_ledger.money.Money;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Aggregates of a vault's posted transactions over a period.
 *
 * <ul>
 *   <li>{@code totalIncome}: INCOME amounts</li>
 *   <li>{@code totalExpenses}: EXPENSE amounts minus refunds of expenses</li>
 *   <li>{@code incomeRefunds}: refunds of incomes</li>
 *   <li>{@code balance}: current balance of non-archived wallets, independent of the period</li>
 * </ul>
 * Vault-level totals are null in a view restricted to some cash flows.
 */
@Value
@Builder(toBuilder = true)
public class VaultStatistics {
    UUID vaultId;
    CurrencyCode currency;
    StatisticsPeriod period;
    List<TargetTotals> wallets;
    List<TargetTotals> cashFlows;
    Money totalIncome;
    Money totalExpenses;
    Money incomeRefunds;
    Money balance;
    int transactionCount;
    Instant generatedAt;

    /**
     * View for a caller whose access is limited to {@code cashFlowIds}: only
     * those flows, no wallets, no vault totals.
     */
    public VaultStatistics restrictedTo(Set<UUID> cashFlowIds) {
        return toBuilder()
            .wallets(List.of())
            .cashFlows(cashFlows.stream().filter(f -> cashFlowIds.contains(f.getId())).toList())
            .totalIncome(null)
            .totalExpenses(null)
            .incomeRefunds(null)
            .balance(null)
            .transactionCount(0)
            .build();
    }
}
