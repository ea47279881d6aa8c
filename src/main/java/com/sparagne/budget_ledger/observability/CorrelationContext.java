package com.sparagne.budget_ledger.observability;

import org.slf4j.MDC;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * MDC keys and helpers for the per-request logging context.
 *
 * A request binds its correlation id and caller once, in
 * {@link CorrelationIdFilter}; ledger operations add the vault and
 * transaction they are working on. Everything is removed when the request ends.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CALLER_HEADER = "X-User";

    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String CALLER_MDC_KEY = "caller";
    public static final String VAULT_ID_MDC_KEY = "vaultId";
    public static final String TRANSACTION_ID_MDC_KEY = "transactionId";

    private static final int MAX_CORRELATION_ID_LENGTH = 64;
    private static final Pattern SAFE_CORRELATION_ID = Pattern.compile("[A-Za-z0-9._:-]+");

    private CorrelationContext() {
    }

    /**
     * Binds the request's correlation id and caller to the MDC.
     *
     * @return the correlation id actually bound
     */
    public static String bind(String requestedCorrelationId, String caller) {
        String correlationId = acceptOrGenerate(requestedCorrelationId);
        MDC.put(CORRELATION_ID_MDC_KEY, correlationId);
        if (caller != null && !caller.isBlank()) {
            MDC.put(CALLER_MDC_KEY, caller.trim());
        }
        return correlationId;
    }

    public static String currentCorrelationId() {
        return MDC.get(CORRELATION_ID_MDC_KEY);
    }

    public static void clear() {
        MDC.remove(CORRELATION_ID_MDC_KEY);
        MDC.remove(CALLER_MDC_KEY);
        MDC.remove(VAULT_ID_MDC_KEY);
        MDC.remove(TRANSACTION_ID_MDC_KEY);
    }

    /**
     * Keeps a client-supplied id only if it is short and log-safe; anything
     * else is replaced so a header cannot inject text into log lines.
     */
    static String acceptOrGenerate(String requested) {
        if (requested != null) {
            String trimmed = requested.trim();
            if (!trimmed.isEmpty() && trimmed.length() <= MAX_CORRELATION_ID_LENGTH
                    && SAFE_CORRELATION_ID.matcher(trimmed).matches()) {
                return trimmed;
            }
        }
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
