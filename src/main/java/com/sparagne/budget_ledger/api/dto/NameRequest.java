package com.sparagne.budget_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

/**
 * Creates a wallet or cash flow. Length and uniqueness are checked by the service.
 */
@Value
public class NameRequest {

    @NotBlank(message = "Name is required")
    @JsonProperty("name")
    String name;
}
