package com.sparagne.budget_ledger.api;

import com.sparagne.budget_ledger.observability.CorrelationContext;

final class RequestHeaders {

    /**
     * Authenticated username, injected by the gateway.
     */
    static final String USER_HEADER = CorrelationContext.CALLER_HEADER;

    private RequestHeaders() {
    }
}
