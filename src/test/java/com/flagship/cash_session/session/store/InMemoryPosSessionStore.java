package com.flagship.cash_session.session.store;

import com.flagship.cash_session.session.ActivePosSession;
import com.flagship.cash_session.session.ClosedPosSession;
import com.flagship.cash_session.session.PosSession;
import com.flagship.cash_session.session.XTicketEntry;
import com.flagship.cash_session.session.exception.SessionAlreadyActiveException;
import com.flagship.cash_session.session.exception.SessionAlreadyClosedException;
import com.flagship.cash_session.session.exception.SessionNotActiveException;
import com.flagship.cash_session.session.exception.SessionNotFoundException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Map-backed {@link PosSessionStore} with the same rejection rules as the JPA
 * store, for service tests that do not need a database.
 */
public class InMemoryPosSessionStore implements PosSessionStore {

    private final Map<UUID, PosSession> sessions = new LinkedHashMap<>();

    @Override
    public synchronized Optional<PosSession> findById(UUID id) {
        return Optional.ofNullable(sessions.get(id));
    }

    @Override
    public synchronized Optional<ActivePosSession> findActive() {
        return sessions.values().stream()
            .filter(ActivePosSession.class::isInstance)
            .map(ActivePosSession.class::cast)
            .findFirst();
    }

    @Override
    public synchronized Optional<ClosedPosSession> findLastClosed() {
        return closedNewestFirst().stream().findFirst();
    }

    @Override
    public synchronized List<ClosedPosSession> findRecentlyClosed(int limit) {
        return closedNewestFirst().stream().limit(limit).toList();
    }

    @Override
    public synchronized void insert(ActivePosSession session) {
        Optional<ActivePosSession> active = findActive();
        if (active.isPresent()) {
            throw new SessionAlreadyActiveException(active.get().getId());
        }
        sessions.put(session.getId(), session);
    }

    @Override
    public synchronized void replace(ClosedPosSession session) {
        PosSession stored = sessions.get(session.getId());
        if (stored == null) {
            throw new SessionNotFoundException(session.getId());
        }
        if (!(stored instanceof ActivePosSession)) {
            throw new SessionAlreadyClosedException(session.getId());
        }
        sessions.put(session.getId(), session);
    }

    @Override
    public synchronized void appendXTicket(UUID sessionId, XTicketEntry entry) {
        PosSession stored = sessions.get(sessionId);
        if (stored == null) {
            throw new SessionNotFoundException(sessionId);
        }
        if (!(stored instanceof ActivePosSession active)) {
            throw new SessionNotActiveException(sessionId);
        }
        List<XTicketEntry> entries = new ArrayList<>(active.getXTickets());
        entries.add(entry);
        sessions.put(sessionId, new ActivePosSession(
            sessionId, active.getOpening(), entries, active.getCreatedAt(), entry.getGeneratedAt()));
    }

    public synchronized int size() {
        return sessions.size();
    }

    private List<ClosedPosSession> closedNewestFirst() {
        return sessions.values().stream()
            .filter(ClosedPosSession.class::isInstance)
            .map(ClosedPosSession.class::cast)
            .sorted(Comparator.comparing((ClosedPosSession closed) -> closed.getClosing().getClosedAt()).reversed())
            .toList();
    }
}
