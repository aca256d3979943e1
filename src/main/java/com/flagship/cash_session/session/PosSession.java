package com.flagship.cash_session.session;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A cash register session, either {@link ActivePosSession} or
 * {@link ClosedPosSession}. Closing facts exist only on the closed variant.
 */
public interface PosSession {

    UUID getId();

    PosSessionStatus getStatus();

    SessionOpening getOpening();

    /**
     * Incomes snapshotted at close, empty while the session is active.
     */
    List<SessionIncome> getDailyIncomes();

    List<SessionOutcome> getDailyOutcomes();

    /**
     * X tickets printed during the session, oldest first.
     */
    List<XTicketEntry> getXTickets();

    Instant getCreatedAt();

    Instant getUpdatedAt();
}
