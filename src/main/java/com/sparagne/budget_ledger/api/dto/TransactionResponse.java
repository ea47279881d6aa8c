package com.sparagne.budget_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.sparagne.budget_ledger.ledger.BalanceDelta;
import com.sparagne.budget_ledger.ledger.Transaction;
import com.sparagne.budget_ledger.ledger.TransactionState;
import com.sparagne.budget_ledger.ledger.TransactionType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class TransactionResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("vault_id")
    UUID vaultId;

    @JsonProperty("type")
    TransactionType type;

    @JsonProperty("state")
    TransactionState state;

    @JsonProperty("amount_minor")
    long amountMinor;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("wallet_id")
    UUID walletId;

    @JsonProperty("cash_flow_id")
    UUID cashFlowId;

    @JsonProperty("to_wallet_id")
    UUID toWalletId;

    @JsonProperty("to_cash_flow_id")
    UUID toCashFlowId;

    @JsonProperty("refund_of")
    UUID refundOf;

    @JsonProperty("note")
    String note;

    @JsonProperty("category")
    String category;

    @JsonProperty("occurred_at")
    Instant occurredAt;

    @JsonProperty("recorded_at")
    Instant recordedAt;

    @JsonProperty("created_by")
    String createdBy;

    @JsonProperty("voided_at")
    Instant voidedAt;

    @JsonProperty("voided_by")
    String voidedBy;

    @JsonProperty("updated_at")
    Instant updatedAt;

    @JsonProperty("legs")
    List<Leg> legs;

    public static TransactionResponse from(Transaction transaction) {
        return TransactionResponse.builder()
            .id(transaction.getId())
            .vaultId(transaction.getVaultId())
            .type(transaction.getType())
            .state(transaction.getState())
            .amountMinor(transaction.getAmount().getMinor())
            .currency(transaction.getAmount().getCurrency().name())
            .walletId(transaction.getWalletId())
            .cashFlowId(transaction.getCashFlowId())
            .toWalletId(transaction.getToWalletId())
            .toCashFlowId(transaction.getToCashFlowId())
            .refundOf(transaction.getRefundOf())
            .note(transaction.getNote())
            .category(transaction.getCategory())
            .occurredAt(transaction.getOccurredAt())
            .recordedAt(transaction.getRecordedAt())
            .createdBy(transaction.getCreatedBy())
            .voidedAt(transaction.getVoidedAt())
            .voidedBy(transaction.getVoidedBy())
            .updatedAt(transaction.getUpdatedAt())
            .legs(transaction.getLegs().stream().map(Leg::from).toList())
            .build();
    }

    @Value
    public static class Leg {

        @JsonProperty("target")
        String target;

        @JsonProperty("target_id")
        UUID targetId;

        @JsonProperty("amount_minor")
        long amountMinor;

        static Leg from(BalanceDelta delta) {
            return new Leg(delta.getTarget().name(), delta.getTargetId(), delta.getAmount().getMinor());
        }
    }
}
