package com.flagship.cash_session.session.store;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface XTicketLogRepository extends JpaRepository<XTicketLogEntity, UUID> {

    List<XTicketLogEntity> findBySessionIdOrderBySequenceNumberAsc(UUID sessionId);

    long countBySessionId(UUID sessionId);
}
