package com.flagship.cash_session.money;

import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Amount tagged with its currency.
 *
 * Arithmetic is only defined between amounts of the same currency;
 * mixing currencies is rejected rather than converted.
 */
@Value
public class Money {
    BigDecimal amount;
    CurrencyCode currency;

    private Money(BigDecimal amount, CurrencyCode currency) {
        this.amount = Objects.requireNonNull(amount, "amount");
        this.currency = Objects.requireNonNull(currency, "currency");
    }

    public static Money of(BigDecimal amount, CurrencyCode currency) {
        return new Money(amount, currency);
    }

    public static Money of(String amount, CurrencyCode currency) {
        return new Money(new BigDecimal(amount), currency);
    }

    public static Money zero(CurrencyCode currency) {
        return new Money(BigDecimal.ZERO, currency);
    }

    public Money plus(Money other) {
        requireSameCurrency(other);
        return new Money(amount.add(other.amount), currency);
    }

    public Money minus(Money other) {
        requireSameCurrency(other);
        return new Money(amount.subtract(other.amount), currency);
    }

    public boolean isNegative() {
        return amount.signum() < 0;
    }

    /**
     * True when the absolute amount is strictly greater than the tolerance.
     */
    public boolean exceeds(BigDecimal tolerance) {
        return amount.abs().compareTo(tolerance) > 0;
    }

    /**
     * Same amount and currency, ignoring the scale of the amount.
     */
    public boolean isSameValueAs(Money other) {
        return other != null
            && currency == other.currency
            && amount.compareTo(other.amount) == 0;
    }

    /**
     * Amount with exactly two decimals, e.g. {@code 80.00}.
     */
    public String formatAmount() {
        return amount.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }

    @Override
    public String toString() {
        return formatAmount() + " " + currency;
    }

    private void requireSameCurrency(Money other) {
        if (other.currency != currency) {
            throw new IllegalArgumentException(
                String.format("Cannot combine %s with %s amounts", currency, other.currency));
        }
    }
}
