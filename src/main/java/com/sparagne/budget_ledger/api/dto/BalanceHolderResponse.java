package com.sparagne.budget_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.sparagne.budget_ledger.money.Money;
import com.sparagne.budget_ledger.vault.CashFlow;
import com.sparagne.budget_ledger.vault.Wallet;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Wallet or cash flow as returned by the API. Both share the same shape;
 * {@code mode} and {@code cap_minor} are cash flow only.
 */
@Value
@Builder(toBuilder = true)
public class BalanceHolderResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("vault_id")
    UUID vaultId;

    @JsonProperty("name")
    String name;

    @JsonProperty("balance_minor")
    long balanceMinor;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("balance")
    String balance;

    @JsonProperty("mode")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    String mode;

    @JsonProperty("cap_minor")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    Long capMinor;

    @JsonProperty("archived")
    boolean archived;

    @JsonProperty("created_at")
    Instant createdAt;

    public static BalanceHolderResponse from(Wallet wallet) {
        return of(wallet.getId(), wallet.getVaultId(), wallet.getName(), wallet.getBalance(),
            wallet.isArchived(), wallet.getCreatedAt());
    }

    public static BalanceHolderResponse from(CashFlow cashFlow) {
        return of(cashFlow.getId(), cashFlow.getVaultId(), cashFlow.getName(), cashFlow.getBalance(),
            cashFlow.isArchived(), cashFlow.getCreatedAt()).toBuilder()
            .mode(cashFlow.getMode().name())
            .capMinor(cashFlow.getCapMinor())
            .build();
    }

    private static BalanceHolderResponse of(UUID id, UUID vaultId, String name, Money balance,
                                            boolean archived, Instant createdAt) {
        return BalanceHolderResponse.builder()
            .id(id)
            .vaultId(vaultId)
            .name(name)
            .balanceMinor(balance.getMinor())
            .currency(balance.getCurrency().name())
            .balance(balance.format())
            .archived(archived)
            .createdAt(createdAt)
            .build();
    }
}
