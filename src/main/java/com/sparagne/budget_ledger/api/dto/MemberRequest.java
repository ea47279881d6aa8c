package com.sparagne.budget_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

@Value
public class MemberRequest {

    @NotBlank(message = "Role is required")
    @JsonProperty("role")
    String role;
}
