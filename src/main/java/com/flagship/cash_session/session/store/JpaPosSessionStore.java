package com.flagship.cash_session.session.store;

import com.flagship.cash_session.session.ActivePosSession;
import com.flagship.cash_session.session.ClosedPosSession;
import com.flagship.cash_session.session.PosSession;
import com.flagship.cash_session.session.PosSessionStatus;
import com.flagship.cash_session.session.XTicketEntry;
import com.flagship.cash_session.session.exception.SessionAlreadyActiveException;
import com.flagship.cash_session.session.exception.SessionAlreadyClosedException;
import com.flagship.cash_session.session.exception.SessionNotActiveException;
import com.flagship.cash_session.session.exception.SessionNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * {@link PosSessionStore} on PostgreSQL through Spring Data JPA.
 *
 * Database failures that stand for a lost race are translated here:
 * a unique violation on insert means another session became active first,
 * an optimistic lock failure on replace means another close won.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JpaPosSessionStore implements PosSessionStore {

    private final PosSessionRepository sessionRepository;
    private final XTicketLogRepository xTicketRepository;

    @Override
    @Transactional(readOnly = true)
    public Optional<PosSession> findById(UUID id) {
        return sessionRepository.findById(id)
            .map(entity -> entity.toDomain(xTicketsOf(id)));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ActivePosSession> findActive() {
        return sessionRepository.findFirstByStatusOrderByOpenedAtDesc(PosSessionStatus.ACTIVE)
            .map(entity -> entity.toActive(xTicketsOf(entity.getId())));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ClosedPosSession> findLastClosed() {
        return sessionRepository.findFirstByStatusOrderByClosedAtDesc(PosSessionStatus.CLOSED)
            .map(entity -> entity.toClosed(xTicketsOf(entity.getId())));
    }

    @Override
    @Transactional(readOnly = true)
    public List<ClosedPosSession> findRecentlyClosed(int limit) {
        return sessionRepository.findByStatusOrderByClosedAtDesc(PosSessionStatus.CLOSED, PageRequest.of(0, limit))
            .stream()
            .map(entity -> entity.toClosed(xTicketsOf(entity.getId())))
            .toList();
    }

    @Override
    @Transactional
    public void insert(ActivePosSession session) {
        try {
            sessionRepository.saveAndFlush(PosSessionEntity.fromDomain(session));
        } catch (DataIntegrityViolationException e) {
            log.warn("Insert of session {} rejected by the single active session index", session.getId());
            throw new SessionAlreadyActiveException(e);
        }
        log.debug("Inserted active session {}", session.getId());
    }

    @Override
    @Transactional
    public void replace(ClosedPosSession session) {
        UUID id = session.getId();
        PosSessionEntity entity = sessionRepository.findById(id)
            .orElseThrow(() -> new SessionNotFoundException(id));

        if (entity.getStatus() != PosSessionStatus.ACTIVE) {
            throw new SessionAlreadyClosedException(id);
        }

        entity.close(session);
        try {
            sessionRepository.saveAndFlush(entity);
        } catch (OptimisticLockingFailureException e) {
            log.warn("Close of session {} lost to a concurrent close", id);
            throw new SessionAlreadyClosedException(id, e);
        }
        log.debug("Replaced session {} with its closed form (version {})", id, entity.getVersion());
    }

    @Override
    @Transactional
    public void appendXTicket(UUID sessionId, XTicketEntry entry) {
        int touched = sessionRepository.touchIfActive(sessionId, entry.getGeneratedAt());
        if (touched == 0) {
            if (!sessionRepository.existsById(sessionId)) {
                throw new SessionNotFoundException(sessionId);
            }
            throw new SessionNotActiveException(sessionId);
        }

        xTicketRepository.save(XTicketLogEntity.fromDomain(sessionId, entry));
        log.debug("Appended X ticket entry to session {}", sessionId);
    }

    private List<XTicketEntry> xTicketsOf(UUID sessionId) {
        return xTicketRepository.findBySessionIdOrderBySequenceNumberAsc(sessionId)
            .stream()
            .map(XTicketLogEntity::toDomain)
            .toList();
    }
}
