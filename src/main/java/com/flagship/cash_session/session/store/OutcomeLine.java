package com.flagship.cash_session.session.store;

import com.flagship.cash_session.money.CurrencyCode;
import com.flagship.cash_session.money.Money;
import com.flagship.cash_session.session.SessionOutcome;
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
 * Row of {@code pos_session_outcomes}.
 */
@Embeddable
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class OutcomeLine {

    @Column(nullable = false, length = 100)
    private String category;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 3)
    private CurrencyCode currency;

    static OutcomeLine fromDomain(SessionOutcome outcome) {
        return new OutcomeLine(
            outcome.getCategory(),
            outcome.getAmount().getAmount(),
            outcome.getAmount().getCurrency()
        );
    }

    SessionOutcome toDomain() {
        return new SessionOutcome(category, Money.of(amount, currency));
    }
}
