package com.flagship.cash_session.session.store;

import com.flagship.cash_session.money.CurrencyCode;
import com.flagship.cash_session.money.Money;
import com.flagship.cash_session.session.ActivePosSession;
import com.flagship.cash_session.session.ClosedPosSession;
import com.flagship.cash_session.session.PosSession;
import com.flagship.cash_session.session.PosSessionStatus;
import com.flagship.cash_session.session.SessionClosing;
import com.flagship.cash_session.session.SessionOpening;
import com.flagship.cash_session.session.XTicketEntry;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * JPA entity for {@code pos_sessions}.
 *
 * Closing columns stay null while the session is active. The only update a
 * row receives after insert is {@link #close}; {@code version} makes two
 * concurrent closes collide. Uniqueness of the active row is enforced by the
 * partial index {@code uq_pos_sessions_single_active}.
 *
 * The X ticket log lives in {@link XTicketLogEntity} so that appending does
 * not rewrite this row's collections.
 */
@Entity
@Table(
    name = "pos_sessions",
    indexes = {
        @Index(name = "idx_pos_sessions_status_closed_at", columnList = "status, closed_at")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class PosSessionEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Version
    @Column(nullable = false)
    private Long version;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private PosSessionStatus status;

    @Column(name = "opened_at", nullable = false, updatable = false)
    private Instant openedAt;

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "userId", column = @Column(name = "opened_by_user_id", nullable = false, updatable = false)),
        @AttributeOverride(name = "login", column = @Column(name = "opened_by_login", updatable = false)),
        @AttributeOverride(name = "alias", column = @Column(name = "opened_by_alias", updatable = false))
    })
    private OperatorColumns openedBy;

    @Column(name = "cash_opening_amount", nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal cashOpeningAmount;

    @Enumerated(EnumType.STRING)
    @Column(name = "cash_opening_currency", nullable = false, updatable = false, length = 3)
    private CurrencyCode cashOpeningCurrency;

    @Column(name = "closed_at")
    private Instant closedAt;

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "userId", column = @Column(name = "closed_by_user_id")),
        @AttributeOverride(name = "login", column = @Column(name = "closed_by_login")),
        @AttributeOverride(name = "alias", column = @Column(name = "closed_by_alias"))
    })
    private OperatorColumns closedBy;

    @Column(name = "cash_closing_amount", precision = 19, scale = 4)
    private BigDecimal cashClosingAmount;

    @Enumerated(EnumType.STRING)
    @Column(name = "cash_closing_currency", length = 3)
    private CurrencyCode cashClosingCurrency;

    @Column(name = "cash_closing_theoretical_amount", precision = 19, scale = 4)
    private BigDecimal cashClosingTheoreticalAmount;

    @Enumerated(EnumType.STRING)
    @Column(name = "cash_closing_theoretical_currency", length = 3)
    private CurrencyCode cashClosingTheoreticalCurrency;

    @Column(name = "cash_delta_amount", precision = 19, scale = 4)
    private BigDecimal cashDeltaAmount;

    @Enumerated(EnumType.STRING)
    @Column(name = "cash_delta_currency", length = 3)
    private CurrencyCode cashDeltaCurrency;

    @Column(name = "cash_delta_justification", columnDefinition = "TEXT")
    private String cashDeltaJustification;

    @ElementCollection
    @CollectionTable(name = "pos_session_incomes", joinColumns = @JoinColumn(name = "session_id"))
    @OrderColumn(name = "position")
    private List<IncomeLine> dailyIncomes = new ArrayList<>();

    @ElementCollection
    @CollectionTable(name = "pos_session_outcomes", joinColumns = @JoinColumn(name = "session_id"))
    @OrderColumn(name = "position")
    private List<OutcomeLine> dailyOutcomes = new ArrayList<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    static PosSessionEntity fromDomain(ActivePosSession session) {
        SessionOpening opening = session.getOpening();

        PosSessionEntity entity = new PosSessionEntity();
        entity.id = session.getId();
        entity.status = PosSessionStatus.ACTIVE;
        entity.openedAt = opening.getOpenedAt();
        entity.openedBy = OperatorColumns.fromDomain(opening.getOpenedBy());
        entity.cashOpeningAmount = opening.getCashOpening().getAmount();
        entity.cashOpeningCurrency = opening.getCashOpening().getCurrency();
        entity.createdAt = session.getCreatedAt();
        entity.updatedAt = session.getUpdatedAt();
        return entity;
    }

    /**
     * Writes every closing fact. Callers check that the row is still active.
     */
    void close(ClosedPosSession session) {
        SessionClosing closing = session.getClosing();

        this.status = PosSessionStatus.CLOSED;
        this.closedAt = closing.getClosedAt();
        this.closedBy = OperatorColumns.fromDomain(closing.getClosedBy());
        this.cashClosingAmount = closing.getCashClosing().getAmount();
        this.cashClosingCurrency = closing.getCashClosing().getCurrency();
        this.cashClosingTheoreticalAmount = closing.getCashClosingTheoretical().getAmount();
        this.cashClosingTheoreticalCurrency = closing.getCashClosingTheoretical().getCurrency();
        this.cashDeltaAmount = closing.getCashDelta().getAmount();
        this.cashDeltaCurrency = closing.getCashDelta().getCurrency();
        this.cashDeltaJustification = closing.getJustification();

        this.dailyIncomes.clear();
        session.getDailyIncomes().forEach(income -> this.dailyIncomes.add(IncomeLine.fromDomain(income)));
        this.dailyOutcomes.clear();
        session.getDailyOutcomes().forEach(outcome -> this.dailyOutcomes.add(OutcomeLine.fromDomain(outcome)));

        this.updatedAt = session.getUpdatedAt();
    }

    PosSession toDomain(List<XTicketEntry> xTickets) {
        return status == PosSessionStatus.ACTIVE ? toActive(xTickets) : toClosed(xTickets);
    }

    ActivePosSession toActive(List<XTicketEntry> xTickets) {
        return new ActivePosSession(id, opening(), xTickets, createdAt, updatedAt);
    }

    ClosedPosSession toClosed(List<XTicketEntry> xTickets) {
        SessionClosing closing = new SessionClosing(
            closedAt,
            closedBy.toDomain(),
            Money.of(cashClosingAmount, cashClosingCurrency),
            Money.of(cashClosingTheoreticalAmount, cashClosingTheoreticalCurrency),
            Money.of(cashDeltaAmount, cashDeltaCurrency),
            cashDeltaJustification
        );
        return new ClosedPosSession(
            id,
            opening(),
            closing,
            dailyIncomes.stream().map(IncomeLine::toDomain).toList(),
            dailyOutcomes.stream().map(OutcomeLine::toDomain).toList(),
            xTickets,
            createdAt,
            updatedAt
        );
    }

    private SessionOpening opening() {
        return new SessionOpening(
            openedAt,
            openedBy.toDomain(),
            Money.of(cashOpeningAmount, cashOpeningCurrency)
        );
    }
}
