package com.flagship.cash_session.income;

import com.flagship.cash_session.money.CurrencyCode;
import com.flagship.cash_session.money.Money;
import com.flagship.cash_session.order.PaymentMethod;
import com.flagship.cash_session.session.SessionIncome;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Income per payment method at one point in time, in first-seen order.
 */
public final class IncomeSnapshot {

    private final Map<PaymentMethod, Money> byMethod;

    private IncomeSnapshot(Map<PaymentMethod, Money> byMethod) {
        this.byMethod = Collections.unmodifiableMap(new LinkedHashMap<>(byMethod));
    }

    static IncomeSnapshot of(Map<PaymentMethod, Money> byMethod) {
        return new IncomeSnapshot(byMethod);
    }

    public static IncomeSnapshot empty() {
        return new IncomeSnapshot(Map.of());
    }

    public static IncomeSnapshot fromIncomes(List<SessionIncome> incomes) {
        Map<PaymentMethod, Money> byMethod = new LinkedHashMap<>();
        incomes.forEach(income -> byMethod.put(income.getPaymentMethod(), income.getAmount()));
        return new IncomeSnapshot(byMethod);
    }

    public Map<PaymentMethod, Money> asMap() {
        return byMethod;
    }

    public boolean isEmpty() {
        return byMethod.isEmpty();
    }

    /**
     * Income for one method; zero in the fallback currency when the method was
     * not used.
     */
    public Money amountFor(PaymentMethod method, CurrencyCode fallbackCurrency) {
        return byMethod.getOrDefault(method, Money.zero(fallbackCurrency));
    }

    /**
     * Plain sum of every method's amount. Methods are not reconciled across
     * currencies, so the caller decides which currency tag the total carries.
     */
    public BigDecimal totalAmount() {
        return byMethod.values().stream()
            .map(Money::getAmount)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public List<SessionIncome> toIncomes() {
        return byMethod.entrySet().stream()
            .map(entry -> new SessionIncome(entry.getKey(), entry.getValue()))
            .toList();
    }

    @Override
    public String toString() {
        return "IncomeSnapshot" + byMethod;
    }
}
