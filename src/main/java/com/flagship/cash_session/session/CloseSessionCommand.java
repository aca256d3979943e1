package com.flagship.cash_session.session;

import com.flagship.cash_session.money.CurrencyCode;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Closing count submitted by the operator.
 *
 * Values are unchecked here; {@link PosSessionService#closeSession} validates them.
 */
@Value
@Builder
public class CloseSessionCommand {
    UUID sessionId;
    BigDecimal cashClosingAmount;
    CurrencyCode cashClosingCurrency;
    @Singular
    List<SessionOutcome> outcomes;
    String justification;
    SessionOperator operator;
}
