package com.flagship.cash_session.session;

import com.flagship.cash_session.money.Money;
import lombok.Value;

import java.time.Instant;

/**
 * Facts captured when the drawer is opened. Never change afterwards.
 */
@Value
public class SessionOpening {
    Instant openedAt;
    SessionOperator openedBy;
    Money cashOpening;
}
