package com.flagship.cash_session.session;

import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Session after the closing count. Immutable: no operation changes it again.
 */
@Value
public class ClosedPosSession implements PosSession {
    UUID id;
    SessionOpening opening;
    SessionClosing closing;
    List<SessionIncome> dailyIncomes;
    List<SessionOutcome> dailyOutcomes;
    List<XTicketEntry> xTickets;
    Instant createdAt;
    Instant updatedAt;

    public ClosedPosSession(UUID id, SessionOpening opening, SessionClosing closing,
                            List<SessionIncome> dailyIncomes, List<SessionOutcome> dailyOutcomes,
                            List<XTicketEntry> xTickets, Instant createdAt, Instant updatedAt) {
        this.id = id;
        this.opening = opening;
        this.closing = closing;
        this.dailyIncomes = List.copyOf(dailyIncomes);
        this.dailyOutcomes = List.copyOf(dailyOutcomes);
        this.xTickets = List.copyOf(xTickets);
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
    }

    @Override
    public PosSessionStatus getStatus() {
        return PosSessionStatus.CLOSED;
    }
}
