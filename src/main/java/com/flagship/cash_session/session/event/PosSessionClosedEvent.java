package com.flagship.cash_session.session.event;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.cash_session.session.ClosedPosSession;
import com.flagship.cash_session.session.SessionClosing;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * The drawer was counted and the session closed. {@code zTicket} is the
 * final ticket exactly as returned to the closer.
 */
@Value
public class PosSessionClosedEvent implements PosSessionEvent {
    UUID eventId;
    UUID sessionId;
    OperatorPayload closedBy;
    String currency;
    BigDecimal cashClosingAmount;
    BigDecimal cashClosingTheoreticalAmount;
    BigDecimal cashDeltaAmount;
    String cashDeltaJustification;
    @JsonProperty("zTicket")
    String zTicket;
    Instant occurredAt;

    public static final String EVENT_TYPE = "PosSessionClosed";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static PosSessionClosedEvent from(ClosedPosSession session, String zTicket) {
        SessionClosing closing = session.getClosing();
        return new PosSessionClosedEvent(
            UUID.randomUUID(),
            session.getId(),
            OperatorPayload.from(closing.getClosedBy()),
            closing.getCashDelta().getCurrency().name(),
            closing.getCashClosing().getAmount(),
            closing.getCashClosingTheoretical().getAmount(),
            closing.getCashDelta().getAmount(),
            closing.getJustification(),
            zTicket,
            closing.getClosedAt()
        );
    }
}
