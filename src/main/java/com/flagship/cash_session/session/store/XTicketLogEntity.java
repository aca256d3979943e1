package com.flagship.cash_session.session.store;

import com.flagship.cash_session.session.XTicketEntry;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Row of the append-only {@code pos_session_x_tickets} log. Rows are never
 * updated or deleted; {@code sequence_number} is assigned by the database and
 * gives the log order.
 */
@Entity
@Table(
    name = "pos_session_x_tickets",
    indexes = {
        @Index(name = "idx_pos_session_x_tickets_session", columnList = "session_id, sequence_number")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class XTicketLogEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "session_id", nullable = false, updatable = false)
    private UUID sessionId;

    @Column(name = "sequence_number", insertable = false, updatable = false)
    private Long sequenceNumber;

    @Column(name = "generated_at", nullable = false, updatable = false)
    private Instant generatedAt;

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "userId", column = @Column(name = "generated_by_user_id", nullable = false, updatable = false)),
        @AttributeOverride(name = "login", column = @Column(name = "generated_by_login", updatable = false)),
        @AttributeOverride(name = "alias", column = @Column(name = "generated_by_alias", updatable = false))
    })
    private OperatorColumns generatedBy;

    static XTicketLogEntity fromDomain(UUID sessionId, XTicketEntry entry) {
        return new XTicketLogEntity(
            UUID.randomUUID(),
            sessionId,
            null, // assigned by the database
            entry.getGeneratedAt(),
            OperatorColumns.fromDomain(entry.getGeneratedBy())
        );
    }

    XTicketEntry toDomain() {
        return new XTicketEntry(generatedAt, generatedBy.toDomain());
    }
}
