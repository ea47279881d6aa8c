package com.sparagne.budget_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.sparagne.budget_ledger.vault.VaultView;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * A vault with the wallets, cash flows and members visible to the caller.
 */
@Value
@Builder
public class VaultDetailResponse {

    @JsonProperty("vault")
    VaultResponse vault;

    @JsonProperty("role")
    String role;

    @JsonProperty("wallets")
    List<BalanceHolderResponse> wallets;

    @JsonProperty("cash_flows")
    List<BalanceHolderResponse> cashFlows;

    @JsonProperty("members")
    List<MembershipResponse> members;

    public static VaultDetailResponse from(VaultView view) {
        return VaultDetailResponse.builder()
            .vault(VaultResponse.from(view.getVault()))
            .role(view.getRole().name())
            .wallets(view.getWallets().stream().map(BalanceHolderResponse::from).toList())
            .cashFlows(view.getCashFlows().stream().map(BalanceHolderResponse::from).toList())
            .members(view.getMembers().stream().map(MembershipResponse::from).toList())
            .build();
    }
}
