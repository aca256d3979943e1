package com.flagship.cash_session.session.exception;

import com.flagship.cash_session.money.Money;

/**
 * The counted cash differs from the theoretical cash and no reason was given.
 */
public class JustificationRequiredException extends PosSessionException {

    private final Money cashDelta;

    public JustificationRequiredException(Money cashDelta) {
        super(ErrorKind.JUSTIFICATION_REQUIRED,
            "Cash delta justification is required when there is a difference (delta " + cashDelta + ")");
        this.cashDelta = cashDelta;
    }

    public Money getCashDelta() {
        return cashDelta;
    }
}
