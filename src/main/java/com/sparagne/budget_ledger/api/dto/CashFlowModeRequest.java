package com.sparagne.budget_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

/**
 * Sets the cap of a cash flow. {@code cap_minor} is required for the capped
 * modes and must be absent for UNLIMITED.
 */
@Value
public class CashFlowModeRequest {

    @NotBlank(message = "Mode is required")
    @JsonProperty("mode")
    String mode;

    @JsonProperty("cap_minor")
    Long capMinor;
}
