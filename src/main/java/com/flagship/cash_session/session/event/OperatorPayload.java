package com.flagship.cash_session.session.event;

import com.flagship.cash_session.session.SessionOperator;
import lombok.Value;

/**
 * Operator as written into event payloads.
 */
@Value
public class OperatorPayload {
    String userId;
    String login;
    String alias;

    static OperatorPayload from(SessionOperator operator) {
        return new OperatorPayload(operator.getUserId(), operator.getLogin(), operator.getAlias());
    }
}
