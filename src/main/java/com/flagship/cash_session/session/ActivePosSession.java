package com.flagship.cash_session.session;

import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Session currently open on the register. At most one exists at any time.
 */
@Value
public class ActivePosSession implements PosSession {
    UUID id;
    SessionOpening opening;
    List<XTicketEntry> xTickets;
    Instant createdAt;
    Instant updatedAt;

    public ActivePosSession(UUID id, SessionOpening opening, List<XTicketEntry> xTickets,
                            Instant createdAt, Instant updatedAt) {
        this.id = id;
        this.opening = opening;
        this.xTickets = List.copyOf(xTickets);
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
    }

    public static ActivePosSession open(UUID id, SessionOpening opening) {
        Instant now = opening.getOpenedAt();
        return new ActivePosSession(id, opening, List.of(), now, now);
    }

    @Override
    public PosSessionStatus getStatus() {
        return PosSessionStatus.ACTIVE;
    }

    @Override
    public List<SessionIncome> getDailyIncomes() {
        return List.of();
    }

    @Override
    public List<SessionOutcome> getDailyOutcomes() {
        return List.of();
    }

    /**
     * Terminal transition. The X ticket log is carried over unchanged.
     */
    public ClosedPosSession close(SessionClosing closing,
                                  List<SessionIncome> dailyIncomes,
                                  List<SessionOutcome> dailyOutcomes) {
        return new ClosedPosSession(
            id,
            opening,
            closing,
            dailyIncomes,
            dailyOutcomes,
            xTickets,
            createdAt,
            closing.getClosedAt()
        );
    }
}
