package com.sparagne.budget_ledger.money;

import com.sparagne.budget_ledger.exception.LedgerException;
import lombok.Value;

import java.util.Objects;

/**
 * Signed monetary amount in integer minor units, tagged with a currency.
 *
 * Every balance, leg and transaction amount in the engine is a Money. Arithmetic
 * between different currencies is rejected, and overflow is reported instead of
 * wrapping.
 */
@Value
public class Money implements Comparable<Money> {
    long minor;
    CurrencyCode currency;

    private Money(long minor, CurrencyCode currency) {
        this.minor = minor;
        this.currency = Objects.requireNonNull(currency, "currency");
    }

    public static Money of(long minor, CurrencyCode currency) {
        return new Money(minor, currency);
    }

    public static Money zero(CurrencyCode currency) {
        return new Money(0L, currency);
    }

    public Money plus(Money other) {
        requireSameCurrency(other);
        try {
            return new Money(Math.addExact(minor, other.minor), currency);
        } catch (ArithmeticException e) {
            throw LedgerException.invalidAmount("amount_minor", "Amount too large");
        }
    }

    public Money minus(Money other) {
        requireSameCurrency(other);
        try {
            return new Money(Math.subtractExact(minor, other.minor), currency);
        } catch (ArithmeticException e) {
            throw LedgerException.invalidAmount("amount_minor", "Amount too large");
        }
    }

    public Money negate() {
        if (minor == Long.MIN_VALUE) {
            throw LedgerException.invalidAmount("amount_minor", "Amount too large");
        }
        return new Money(-minor, currency);
    }

    public boolean isPositive() {
        return minor > 0;
    }

    public boolean isNegative() {
        return minor < 0;
    }

    public boolean isZero() {
        return minor == 0;
    }

    public void requireSameCurrency(Money other) {
        if (other.currency != currency) {
            throw LedgerException.currencyMismatch(currency.name(), other.currency.name());
        }
    }

    @Override
    public int compareTo(Money other) {
        requireSameCurrency(other);
        return Long.compare(minor, other.minor);
    }

    /**
     * Formats as {@code <sign><major>.<minor> <CODE>}, e.g. {@code -12.34 EUR}.
     */
    public String format() {
        String sign = minor < 0 ? "-" : "";
        String digits = Long.toString(minor).replace("-", "");
        int scale = currency.minorUnits();
        if (scale == 0) {
            return sign + digits + " " + currency.name();
        }
        if (digits.length() <= scale) {
            digits = "0".repeat(scale - digits.length() + 1) + digits;
        }
        int split = digits.length() - scale;
        return sign + digits.substring(0, split) + "." + digits.substring(split) + " " + currency.name();
    }

    /**
     * Parses a major-unit decimal string into minor units.
     *
     * Accepts '.' or ',' as decimal separator and an optional leading sign.
     * Rejects more fractional digits than the currency allows.
     *
     * @throws LedgerException INVALID_AMOUNT for malformed or oversized input
     */
    public static Money parseMajor(String input, CurrencyCode currency) {
        if (input == null || input.isBlank()) {
            throw LedgerException.invalidAmount("amount", "Empty amount");
        }
        String text = input.trim();
        boolean negative = false;
        if (text.startsWith("-") || text.startsWith("+")) {
            negative = text.charAt(0) == '-';
            text = text.substring(1).trim();
        }
        if (text.isEmpty()) {
            throw LedgerException.invalidAmount("amount", "Empty amount");
        }

        String[] parts = text.replace(',', '.').split("\\.", -1);
        if (parts.length > 2 || parts[0].isEmpty() || !isDigits(parts[0])) {
            throw LedgerException.invalidAmount("amount", "Invalid amount: " + input);
        }
        String fraction = parts.length == 2 ? parts[1] : "";
        if (!isDigits(fraction)) {
            throw LedgerException.invalidAmount("amount", "Invalid amount: " + input);
        }
        if (fraction.length() > currency.minorUnits()) {
            throw LedgerException.invalidAmount("amount", "Too many decimals for " + currency + ": " + input);
        }
        fraction = fraction + "0".repeat(currency.minorUnits() - fraction.length());

        try {
            long scale = (long) Math.pow(10, currency.minorUnits());
            long major = Long.parseLong(parts[0]);
            long total = Math.addExact(Math.multiplyExact(major, scale),
                fraction.isEmpty() ? 0L : Long.parseLong(fraction));
            return new Money(negative ? Math.negateExact(total) : total, currency);
        } catch (ArithmeticException | NumberFormatException e) {
            throw LedgerException.invalidAmount("amount", "Amount too large: " + input);
        }
    }

    private static boolean isDigits(String value) {
        for (int i = 0; i < value.length(); i++) {
            if (!Character.isDigit(value.charAt(i)) || value.charAt(i) > '9') {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return format();
    }
}
