package com.sparagne.budget_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * Partial update of a wallet or cash flow. Absent fields are left unchanged.
 */
@Value
public class UpdateTargetRequest {

    @JsonProperty("name")
    String name;

    @JsonProperty("archived")
    Boolean archived;
}
