package com.sparagne.budget_ledger.money;

import com.sparagne.budget_ledger.exception.ErrorKind;
import com.sparagne.budget_ledger.exception.LedgerException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MoneyTest {

    @Test
    @DisplayName("Formats minor units with the currency's decimal places")
    void testFormat() {
        assertEquals("12.34 EUR", Money.of(1234, CurrencyCode.EUR).format());
        assertEquals("-0.05 USD", Money.of(-5, CurrencyCode.USD).format());
        assertEquals("0.00 GBP", Money.zero(CurrencyCode.GBP).format());
        assertEquals("1500 JPY", Money.of(1500, CurrencyCode.JPY).format());
        assertEquals("-92233720368547758.08 EUR", Money.of(Long.MIN_VALUE, CurrencyCode.EUR).format());
    }

    @Test
    @DisplayName("Parses major-unit strings with dot or comma separators")
    void testParseMajor() {
        assertEquals(1050, Money.parseMajor("10.5", CurrencyCode.EUR).getMinor());
        assertEquals(1050, Money.parseMajor("10,50", CurrencyCode.EUR).getMinor());
        assertEquals(-700, Money.parseMajor(" -7 ", CurrencyCode.EUR).getMinor());
        assertEquals(300, Money.parseMajor("300", CurrencyCode.JPY).getMinor());
    }

    @Test
    @DisplayName("Rejects malformed or over-precise amounts with INVALID_AMOUNT")
    void testParseMajorRejectsBadInput() {
        for (String input : new String[]{"", "abc", "1.2.3", "1.234", "-", "12a"}) {
            LedgerException e = assertThrows(LedgerException.class,
                () -> Money.parseMajor(input, CurrencyCode.EUR), "input: " + input);
            assertEquals(ErrorKind.INVALID_AMOUNT, e.getKind());
        }
        assertThrows(LedgerException.class, () -> Money.parseMajor("1.5", CurrencyCode.JPY));
        assertThrows(LedgerException.class, () -> Money.parseMajor("99999999999999999999", CurrencyCode.EUR));
    }

    @Test
    @DisplayName("Overflow is reported instead of wrapping")
    void testOverflow() {
        Money max = Money.of(Long.MAX_VALUE, CurrencyCode.EUR);

        LedgerException e = assertThrows(LedgerException.class, () -> max.plus(Money.of(1, CurrencyCode.EUR)));
        assertEquals(ErrorKind.INVALID_AMOUNT, e.getKind());
        assertThrows(LedgerException.class, () -> Money.of(Long.MIN_VALUE, CurrencyCode.EUR).negate());
        assertThrows(LedgerException.class,
            () -> Money.of(Long.MIN_VALUE, CurrencyCode.EUR).minus(Money.of(1, CurrencyCode.EUR)));
    }

    @Test
    @DisplayName("Arithmetic across currencies fails with CURRENCY_MISMATCH")
    void testCurrencyMismatch() {
        Money euros = Money.of(100, CurrencyCode.EUR);
        Money dollars = Money.of(100, CurrencyCode.USD);

        LedgerException e = assertThrows(LedgerException.class, () -> euros.plus(dollars));
        assertEquals(ErrorKind.CURRENCY_MISMATCH, e.getKind());
        assertThrows(LedgerException.class, () -> euros.compareTo(dollars));
    }

    @Test
    @DisplayName("Currency codes parse case-insensitively")
    void testCurrencyParse() {
        assertEquals(CurrencyCode.EUR, CurrencyCode.parse(" eur "));
        LedgerException e = assertThrows(LedgerException.class, () -> CurrencyCode.parse("XYZ"));
        assertEquals(ErrorKind.INVALID_INPUT, e.getKind());
    }
}
