package com.flagship.cash_session.session.event;

import com.flagship.cash_session.session.XTicketEntry;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * An interim X ticket was printed. Carries the printed text for audit.
 */
@Value
public class XTicketGeneratedEvent implements PosSessionEvent {
    UUID eventId;
    UUID sessionId;
    OperatorPayload generatedBy;
    String ticketText;
    Instant occurredAt;

    public static final String EVENT_TYPE = "XTicketGenerated";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static XTicketGeneratedEvent from(UUID sessionId, XTicketEntry entry, String ticketText) {
        return new XTicketGeneratedEvent(
            UUID.randomUUID(),
            sessionId,
            OperatorPayload.from(entry.getGeneratedBy()),
            ticketText,
            entry.getGeneratedAt()
        );
    }
}
