package com.flagship.cash_session.session.store;

import com.flagship.cash_session.session.PosSessionStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface PosSessionRepository extends JpaRepository<PosSessionEntity, UUID> {

    Optional<PosSessionEntity> findFirstByStatusOrderByOpenedAtDesc(PosSessionStatus status);

    Optional<PosSessionEntity> findFirstByStatusOrderByClosedAtDesc(PosSessionStatus status);

    List<PosSessionEntity> findByStatusOrderByClosedAtDesc(PosSessionStatus status, Pageable pageable);

    /**
     * Bumps {@code updated_at} only while the session is active. Takes the
     * row lock, so it waits for a concurrent close and then matches nothing.
     *
     * @return 1 if the session was active, 0 otherwise
     */
    @Modifying
    @Query("""
        UPDATE PosSessionEntity s
        SET s.updatedAt = :now
        WHERE s.id = :id
        AND s.status = com.flagship.cash_session.session.PosSessionStatus.ACTIVE
        """)
    int touchIfActive(@Param("id") UUID id, @Param("now") Instant now);
}
