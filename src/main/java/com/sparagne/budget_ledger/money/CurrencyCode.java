package com.sparagne.budget_ledger.money;

import com.sparagne.budget_ledger.exception.LedgerException;

import java.util.Locale;

/**
 * Currency code enum following ISO-4217.
 *
 * Each code carries the number of minor-unit digits used when converting
 * between major units (user input, "10.50") and stored minor units (1050).
 */
public enum CurrencyCode {
    USD(2), // US Dollar
    EUR(2), // Euro
    GBP(2), // British Pound
    INR(2), // Indian Rupee
    JPY(0); // Japanese Yen

    private final int minorUnits;

    CurrencyCode(int minorUnits) {
        this.minorUnits = minorUnits;
    }

    public int minorUnits() {
        return minorUnits;
    }

    /**
     * Parses a currency code, case-insensitively.
     *
     * @throws LedgerException INVALID_INPUT for unsupported codes
     */
    public static CurrencyCode parse(String code) {
        if (code == null || code.isBlank()) {
            throw LedgerException.invalidInput("vault", "currency", "Currency is required");
        }
        try {
            return CurrencyCode.valueOf(code.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw LedgerException.invalidInput("vault", "currency", "Unsupported currency code: " + code);
        }
    }
}
