package com.flagship.cash_session.session;

import com.flagship.cash_session.money.Money;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Facts captured when the drawer is counted and the session closed.
 *
 * {@code cashDelta} is declared minus theoretical, in the opening currency.
 * {@code justification} is null when none was given.
 */
@Value
public class SessionClosing {
    Instant closedAt;
    SessionOperator closedBy;
    Money cashClosing;
    Money cashClosingTheoretical;
    Money cashDelta;
    String justification;

    public boolean hasBalanceError(BigDecimal tolerance) {
        return cashDelta.exceeds(tolerance);
    }

    public boolean hasJustification() {
        return justification != null && !justification.isBlank();
    }
}
