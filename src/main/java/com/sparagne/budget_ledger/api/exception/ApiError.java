package com.sparagne.budget_ledger.api.exception;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Standard API error response.
 *
 * {@code kind} carries the ledger error kind when the failure came from the
 * engine, so clients can branch on it without parsing messages.
 */
@Value
@Builder
public class ApiError {

    @JsonProperty("error")
    String error;

    @JsonProperty("kind")
    String kind;

    @JsonProperty("message")
    String message;

    @JsonProperty("details")
    Map<String, String> details;

    @JsonProperty("timestamp")
    Instant timestamp;
}
