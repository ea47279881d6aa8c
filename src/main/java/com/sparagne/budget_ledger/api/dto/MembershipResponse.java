package com.sparagne.budget_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.sparagne.budget_ledger.vault.Membership;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class MembershipResponse {

    @JsonProperty("vault_id")
    UUID vaultId;

    @JsonProperty("cash_flow_id")
    UUID cashFlowId;

    @JsonProperty("username")
    String username;

    @JsonProperty("role")
    String role;

    @JsonProperty("granted_at")
    Instant grantedAt;

    public static MembershipResponse from(Membership membership) {
        return MembershipResponse.builder()
            .vaultId(membership.getVaultId())
            .cashFlowId(membership.getCashFlowId())
            .username(membership.getUsername())
            .role(membership.getRole().name())
            .grantedAt(membership.getGrantedAt())
            .build();
    }
}
