package com.sparagne.budget_ledger.vault;

import com.sparagne.budget_ledger.exception.LedgerException;

import java.util.Locale;

/**
 * Upper bound a cash flow enforces on posted transactions.
 */
public enum CashFlowMode {
    /**
     * No upper bound.
     */
    UNLIMITED,

    /**
     * The balance may not go above the cap.
     */
    NET_CAPPED,

    /**
     * The running total of money flowing in (positive legs of posted
     * transactions) may not go above the cap. Outflows do not free room.
     */
    INCOME_CAPPED;

    public static CashFlowMode parse(String value) {
        if (value == null || value.isBlank()) {
            throw LedgerException.invalidInput("cash_flow", "mode", "Mode is required");
        }
        try {
            return CashFlowMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw LedgerException.invalidInput("cash_flow", "mode", "Unknown cash flow mode: " + value);
        }
    }

    public boolean isCapped() {
        return this != UNLIMITED;
    }

    /**
     * Checks that {@code capMinor} fits this mode: absent when unlimited,
     * present and positive otherwise.
     */
    public void requireValidCap(Long capMinor) {
        if (!isCapped() && capMinor != null) {
            throw LedgerException.invalidInput("cash_flow", "cap_minor", "An unlimited cash flow takes no cap");
        }
        if (isCapped() && (capMinor == null || capMinor <= 0)) {
            throw LedgerException.invalidInput("cash_flow", "cap_minor", "Mode " + this + " requires a positive cap");
        }
    }
}
