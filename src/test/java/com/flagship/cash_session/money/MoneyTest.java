package com.flagship.cash_session.money;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class MoneyTest {

    @Test
    @DisplayName("Amounts are printed with exactly two decimals, rounded half up")
    void testFormatAmount() {
        assertEquals("80.00", Money.of("80", CurrencyCode.EUR).formatAmount());
        assertEquals("0.01", Money.of("0.005", CurrencyCode.EUR).formatAmount());
        assertEquals("-30.00", Money.of("-30", CurrencyCode.EUR).formatAmount());
        assertEquals("12.35 USD", Money.of("12.345", CurrencyCode.USD).toString());
    }

    @Test
    @DisplayName("Arithmetic between different currencies is rejected")
    void testMixedCurrencies() {
        Money eur = Money.of("10", CurrencyCode.EUR);
        Money usd = Money.of("10", CurrencyCode.USD);

        assertThrows(IllegalArgumentException.class, () -> eur.plus(usd));
        assertThrows(IllegalArgumentException.class, () -> eur.minus(usd));
        assertEquals(Money.of("20", CurrencyCode.EUR), eur.plus(Money.of("10", CurrencyCode.EUR)));
    }

    @Test
    @DisplayName("Tolerance check is strict and ignores the sign")
    void testExceeds() {
        BigDecimal tolerance = new BigDecimal("0.01");

        assertFalse(Money.of("0.01", CurrencyCode.EUR).exceeds(tolerance));
        assertFalse(Money.of("-0.01", CurrencyCode.EUR).exceeds(tolerance));
        assertTrue(Money.of("0.011", CurrencyCode.EUR).exceeds(tolerance));
        assertTrue(Money.of("-20", CurrencyCode.EUR).exceeds(tolerance));
    }

    @Test
    @DisplayName("Same value ignores scale but not currency")
    void testIsSameValueAs() {
        Money amount = Money.of("200", CurrencyCode.EUR);

        assertTrue(amount.isSameValueAs(Money.of("200.00", CurrencyCode.EUR)));
        assertFalse(amount.isSameValueAs(Money.of("200", CurrencyCode.USD)));
        assertFalse(amount.isSameValueAs(Money.of("199.99", CurrencyCode.EUR)));
        assertFalse(amount.isSameValueAs(null));
    }
}
