package com.flagship.cash_session.money;

/**
 * Currency tags a till can be counted in.
 *
 * ISO-4217 codes plus the bitcoin units accepted at the counter.
 * Amounts are tracked per currency and never converted.
 */
public enum CurrencyCode {
    EUR,
    USD,
    GBP,
    CHF,
    JPY,
    BTC,
    SAT
}
