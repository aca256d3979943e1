package com.flagship.cash_session.session;

import com.flagship.cash_session.money.Money;
import com.flagship.cash_session.order.PaymentMethod;
import lombok.Value;

/**
 * Total income of one payment method over a session.
 */
@Value
public class SessionIncome {
    PaymentMethod paymentMethod;
    Money amount;
}
