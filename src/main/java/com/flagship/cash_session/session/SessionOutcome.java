package com.flagship.cash_session.session;

import com.flagship.cash_session.money.Money;
import lombok.Value;

/**
 * Cash taken out of the drawer during the day, e.g. a bank deposit.
 */
@Value
public class SessionOutcome {
    public static final String BANK_DEPOSIT = "bank-deposit";

    String category;
    Money amount;

    public static SessionOutcome bankDeposit(Money amount) {
        return new SessionOutcome(BANK_DEPOSIT, amount);
    }
}
