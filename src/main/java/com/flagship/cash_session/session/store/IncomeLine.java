package com.flagship.cash_session.session.store;

import com.flagship.cash_session.money.CurrencyCode;
import com.flagship.cash_session.money.Money;
import com.flagship.cash_session.order.PaymentMethod;
import com.flagship.cash_session.session.SessionIncome;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Row of {@code pos_session_incomes}.
 */
@Embeddable
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class IncomeLine {

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_method", nullable = false, length = 20)
    private PaymentMethod paymentMethod;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 3)
    private CurrencyCode currency;

    static IncomeLine fromDomain(SessionIncome income) {
        return new IncomeLine(
            income.getPaymentMethod(),
            income.getAmount().getAmount(),
            income.getAmount().getCurrency()
        );
    }

    SessionIncome toDomain() {
        return new SessionIncome(paymentMethod, Money.of(amount, currency));
    }
}
