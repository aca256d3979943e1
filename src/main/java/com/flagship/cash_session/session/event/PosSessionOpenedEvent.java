package com.flagship.cash_session.session.event;

import com.flagship.cash_session.session.ActivePosSession;
import com.flagship.cash_session.session.SessionOpening;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class PosSessionOpenedEvent implements PosSessionEvent {
    UUID eventId;
    UUID sessionId;
    OperatorPayload openedBy;
    BigDecimal cashOpeningAmount;
    String cashOpeningCurrency;
    Instant occurredAt;

    public static final String EVENT_TYPE = "PosSessionOpened";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static PosSessionOpenedEvent from(ActivePosSession session) {
        SessionOpening opening = session.getOpening();
        return new PosSessionOpenedEvent(
            UUID.randomUUID(),
            session.getId(),
            OperatorPayload.from(opening.getOpenedBy()),
            opening.getCashOpening().getAmount(),
            opening.getCashOpening().getCurrency().name(),
            opening.getOpenedAt()
        );
    }
}
