package com.sparagne.budget_ledger.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Structured ledger failure: a kind plus the entity and field it concerns.
 *
 * All validation failures are raised before any write is attempted.
 */
public class LedgerException extends RuntimeException {

    private final ErrorKind kind;
    private final String entity;
    private final String entityId;
    private final String field;

    public LedgerException(ErrorKind kind, String message, String entity, String entityId, String field) {
        this(kind, message, entity, entityId, field, null);
    }

    public LedgerException(ErrorKind kind, String message, String entity, String entityId, String field,
                           Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.entity = entity;
        this.entityId = entityId;
        this.field = field;
    }

    public static LedgerException notFound(String entity, Object id) {
        return new LedgerException(ErrorKind.NOT_FOUND,
            String.format("%s not found: %s", entity, id), entity, asString(id), null);
    }

    public static LedgerException unauthorized(String username, String entity, Object id, String reason) {
        return new LedgerException(ErrorKind.UNAUTHORIZED,
            String.format("User '%s' is not allowed to %s", username, reason), entity, asString(id), null);
    }

    public static LedgerException invalidAmount(String field, String message) {
        return new LedgerException(ErrorKind.INVALID_AMOUNT, message, "transaction", null, field);
    }

    public static LedgerException invalidAmount(UUID transactionId, String field, String message) {
        return new LedgerException(ErrorKind.INVALID_AMOUNT, message, "transaction", asString(transactionId), field);
    }

    public static LedgerException invalidState(String entity, Object id, String message) {
        return new LedgerException(ErrorKind.INVALID_STATE, message, entity, asString(id), null);
    }

    public static LedgerException alreadyVoided(UUID transactionId) {
        return new LedgerException(ErrorKind.ALREADY_VOIDED,
            "Transaction " + transactionId + " is already voided", "transaction", asString(transactionId), "state");
    }

    public static LedgerException immutable(UUID transactionId, String field) {
        return new LedgerException(ErrorKind.IMMUTABLE,
            String.format("Field '%s' of posted transaction %s cannot be changed", field, transactionId),
            "transaction", asString(transactionId), field);
    }

    public static LedgerException sameWallet(UUID walletId) {
        return new LedgerException(ErrorKind.SAME_WALLET,
            "Source and destination wallet must differ: " + walletId, "wallet", asString(walletId), "to_wallet_id");
    }

    public static LedgerException sameFlow(UUID flowId) {
        return new LedgerException(ErrorKind.SAME_FLOW,
            "Source and destination cash flow must differ: " + flowId, "cash_flow", asString(flowId),
            "to_cash_flow_id");
    }

    public static LedgerException currencyMismatch(String expected, String actual) {
        return new LedgerException(ErrorKind.CURRENCY_MISMATCH,
            String.format("Currency mismatch: expected %s but got %s", expected, actual), "money", null, "currency");
    }

    public static LedgerException maxBalanceReached(UUID cashFlowId, String name, long capMinor) {
        return new LedgerException(ErrorKind.MAX_BALANCE_REACHED,
            String.format("Cash flow '%s' would exceed its cap of %d", name, capMinor),
            "cash_flow", asString(cashFlowId), "cap_minor");
    }

    public static LedgerException invalidInput(String entity, String field, String message) {
        return new LedgerException(ErrorKind.INVALID_INPUT, message, entity, null, field);
    }

    public static LedgerException storeFailure(String operation, Throwable cause) {
        return new LedgerException(ErrorKind.STORE_FAILURE,
            "Store failure during " + operation + ": " + cause.getMessage(), "store", null, null, cause);
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getEntity() {
        return entity;
    }

    public String getEntityId() {
        return entityId;
    }

    public String getField() {
        return field;
    }

    /**
     * Context as a flat map, for error responses and log lines.
     */
    public Map<String, String> getContext() {
        Map<String, String> context = new LinkedHashMap<>();
        if (entity != null) {
            context.put("entity", entity);
        }
        if (entityId != null) {
            context.put("entity_id", entityId);
        }
        if (field != null) {
            context.put("field", field);
        }
        return Collections.unmodifiableMap(context);
    }

    private static String asString(Object id) {
        return id == null ? null : id.toString();
    }
}
