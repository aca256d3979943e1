package com.flagship.cash_session.session.store;

import com.flagship.cash_session.session.ActivePosSession;
import com.flagship.cash_session.session.ClosedPosSession;
import com.flagship.cash_session.session.PosSession;
import com.flagship.cash_session.session.XTicketEntry;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence boundary for POS sessions.
 *
 * Implementations enforce the concurrency rules themselves and report
 * violations with the session exceptions:
 * <ul>
 *   <li>{@link #insert} fails with {@code SessionAlreadyActiveException} if
 *       another session is active, even one inserted concurrently.</li>
 *   <li>{@link #replace} fails with {@code SessionAlreadyClosedException} if
 *       the stored session is no longer active.</li>
 *   <li>{@link #appendXTicket} fails with {@code SessionNotActiveException}
 *       once the session is closed.</li>
 * </ul>
 */
public interface PosSessionStore {

    Optional<PosSession> findById(UUID id);

    Optional<ActivePosSession> findActive();

    /**
     * Most recently closed session, by closing time.
     */
    Optional<ClosedPosSession> findLastClosed();

    /**
     * Closed sessions, most recent first.
     */
    List<ClosedPosSession> findRecentlyClosed(int limit);

    void insert(ActivePosSession session);

    /**
     * Replaces the stored active session with its closed form.
     */
    void replace(ClosedPosSession session);

    /**
     * Adds an entry at the end of the session's X ticket log and bumps its
     * update time.
     */
    void appendXTicket(UUID sessionId, XTicketEntry entry);
}
