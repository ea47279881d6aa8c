package com.sparagne.budget_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.sparagne.budget_ledger.money.Money;
import com.sparagne.budget_ledger.statistics.TargetTotals;
import com.sparagne.budget_ledger.statistics.VaultStatistics;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Vault statistics. Vault-level totals are omitted for callers restricted to
 * some cash flows.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StatisticsResponse {

    @JsonProperty("vault_id")
    UUID vaultId;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("from")
    Instant from;

    @JsonProperty("to")
    Instant to;

    @JsonProperty("total_income_minor")
    Long totalIncomeMinor;

    @JsonProperty("total_expenses_minor")
    Long totalExpensesMinor;

    @JsonProperty("income_refunds_minor")
    Long incomeRefundsMinor;

    @JsonProperty("balance_minor")
    Long balanceMinor;

    @JsonProperty("transaction_count")
    Integer transactionCount;

    @JsonProperty("wallets")
    List<Totals> wallets;

    @JsonProperty("cash_flows")
    List<Totals> cashFlows;

    @JsonProperty("generated_at")
    Instant generatedAt;

    public static StatisticsResponse from(VaultStatistics statistics) {
        boolean restricted = statistics.getTotalIncome() == null;
        return StatisticsResponse.builder()
            .vaultId(statistics.getVaultId())
            .currency(statistics.getCurrency().name())
            .from(statistics.getPeriod().getFrom())
            .to(statistics.getPeriod().getTo())
            .totalIncomeMinor(minorOrNull(statistics.getTotalIncome()))
            .totalExpensesMinor(minorOrNull(statistics.getTotalExpenses()))
            .incomeRefundsMinor(minorOrNull(statistics.getIncomeRefunds()))
            .balanceMinor(minorOrNull(statistics.getBalance()))
            .transactionCount(restricted ? null : statistics.getTransactionCount())
            .wallets(statistics.getWallets().stream().map(Totals::from).toList())
            .cashFlows(statistics.getCashFlows().stream().map(Totals::from).toList())
            .generatedAt(statistics.getGeneratedAt())
            .build();
    }

    private static Long minorOrNull(Money money) {
        return money == null ? null : money.getMinor();
    }

    @Value
    public static class Totals {

        @JsonProperty("id")
        UUID id;

        @JsonProperty("name")
        String name;

        @JsonProperty("archived")
        boolean archived;

        @JsonProperty("inflow_minor")
        long inflowMinor;

        @JsonProperty("outflow_minor")
        long outflowMinor;

        @JsonProperty("net_minor")
        long netMinor;

        @JsonProperty("balance_minor")
        long balanceMinor;

        static Totals from(TargetTotals totals) {
            return new Totals(totals.getId(), totals.getName(), totals.isArchived(),
                totals.getInflow().getMinor(), totals.getOutflow().getMinor(),
                totals.getNet().getMinor(), totals.getBalance().getMinor());
        }
    }
}
