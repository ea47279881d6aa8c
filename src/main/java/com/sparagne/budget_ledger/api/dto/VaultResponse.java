package com.sparagne.budget_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.sparagne.budget_ledger.vault.Vault;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class VaultResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("name")
    String name;

    @JsonProperty("owner")
    String owner;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("created_at")
    Instant createdAt;

    public static VaultResponse from(Vault vault) {
        return VaultResponse.builder()
            .id(vault.getId())
            .name(vault.getName())
            .owner(vault.getOwner())
            .currency(vault.getCurrency().name())
            .createdAt(vault.getCreatedAt())
            .build();
    }
}
