package com.flagship.cash_session.session;

import com.flagship.cash_session.config.PosSessionProperties;
import com.flagship.cash_session.income.IncomeAggregator;
import com.flagship.cash_session.income.IncomeSnapshot;
import com.flagship.cash_session.money.CurrencyCode;
import com.flagship.cash_session.money.Money;
import com.flagship.cash_session.observability.CorrelationContext;
import com.flagship.cash_session.observability.PosSessionMetrics;
import com.flagship.cash_session.outbox.OutboxService;
import com.flagship.cash_session.session.event.PosSessionClosedEvent;
import com.flagship.cash_session.session.event.PosSessionOpenedEvent;
import com.flagship.cash_session.session.event.XTicketGeneratedEvent;
import com.flagship.cash_session.session.exception.InvalidSessionInputException;
import com.flagship.cash_session.session.exception.JustificationRequiredException;
import com.flagship.cash_session.session.exception.PosSessionException;
import com.flagship.cash_session.session.exception.PosSessionsDisabledException;
import com.flagship.cash_session.session.exception.SessionAlreadyActiveException;
import com.flagship.cash_session.session.exception.SessionAlreadyClosedException;
import com.flagship.cash_session.session.exception.SessionNotActiveException;
import com.flagship.cash_session.session.exception.SessionNotFoundException;
import com.flagship.cash_session.session.store.PosSessionStore;
import com.flagship.cash_session.ticket.TicketRenderer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Lifecycle of the register's cash session: open, print X tickets, close.
 *
 * Each mutating operation is one transaction, including its outbox event, so
 * a rejected operation leaves no trace. Incomes are never accumulated: every
 * X ticket and the close recompute them from the payment source.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PosSessionService {

    static final String AGGREGATE_TYPE = "PosSession";
    static final int MAX_HISTORY = 100;
    static final int MAX_FRACTION_DIGITS = 4;

    private final PosSessionStore store;
    private final IncomeAggregator incomeAggregator;
    private final TicketRenderer ticketRenderer;
    private final OutboxService outboxService;
    private final PosSessionMetrics metrics;
    private final PosSessionProperties properties;
    private final Clock clock;

    /**
     * Opens a new session with the counted opening float.
     *
     * A float that differs from the previous session's closing count is
     * logged and counted, never refused.
     *
     * @return id of the new session
     * @throws PosSessionsDisabledException  if sessions are switched off
     * @throws InvalidSessionInputException  if the amount is missing or negative
     * @throws SessionAlreadyActiveException if a session is already open
     */
    @Transactional
    public UUID openSession(BigDecimal openingAmount, CurrencyCode openingCurrency, SessionOperator operator) {
        return observe("open", null, () -> {
            if (!properties.isEnabled()) {
                throw new PosSessionsDisabledException();
            }
            requireAmount(openingAmount, "Opening amount");
            requireCurrency(openingCurrency, "Opening currency");
            requireOperator(operator);

            store.findActive().ifPresent(active -> {
                throw new SessionAlreadyActiveException(active.getId());
            });

            Money cashOpening = Money.of(openingAmount, openingCurrency);
            warnOnOpeningMismatch(cashOpening);

            SessionOpening opening = new SessionOpening(Instant.now(clock), operator, cashOpening);
            ActivePosSession session = ActivePosSession.open(UUID.randomUUID(), opening);
            CorrelationContext.putSessionId(session.getId());

            store.insert(session);
            outboxService.saveEvent(AGGREGATE_TYPE, session.getId(),
                    PosSessionOpenedEvent.EVENT_TYPE, PosSessionOpenedEvent.from(session));

            metrics.recordOpened();
            log.info("POS session opened with {} by {}", cashOpening, operator.displayName());
            return session.getId();
        });
    }

    /**
     * Counts the drawer and closes the session.
     *
     * Incomes are recomputed from the opening time. If the declared cash
     * differs from the theoretical cash by more than the tolerance, a
     * justification is required unless that requirement is switched off.
     *
     * @throws InvalidSessionInputException    on missing or negative amounts, or a currency other than the opening one
     * @throws SessionNotFoundException        if the session does not exist
     * @throws SessionAlreadyClosedException   if it was already closed, including by a concurrent close
     * @throws JustificationRequiredException  if the delta needs a reason and none was given
     */
    @Transactional
    public CloseResult closeSession(CloseSessionCommand command) {
        UUID sessionId = command.getSessionId();

        return observe("close", sessionId, () -> {
            requireSessionId(sessionId);
            requireAmount(command.getCashClosingAmount(), "Cash closing amount");
            requireCurrency(command.getCashClosingCurrency(), "Cash closing currency");
            List<SessionOutcome> outcomes = command.getOutcomes() == null ? List.of() : command.getOutcomes();
            outcomes.forEach(PosSessionService::requireOutcome);
            requireOperator(command.getOperator());

            PosSession session = store.findById(sessionId)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
            if (!(session instanceof ActivePosSession active)) {
                throw new SessionAlreadyClosedException(sessionId);
            }

            CurrencyCode currency = active.getOpening().getCashOpening().getCurrency();
            requireOpeningCurrency(command.getCashClosingCurrency(), currency, "Cash closing");
            outcomes.forEach(outcome ->
                requireOpeningCurrency(outcome.getAmount().getCurrency(), currency, "Outcome " + outcome.getCategory()));

            IncomeSnapshot incomes = incomeAggregator.aggregate(active.getOpening().getOpenedAt());
            Money declared = Money.of(command.getCashClosingAmount(), command.getCashClosingCurrency());
            CashBalance balance = CashBalance.compute(active.getOpening().getCashOpening(), incomes, outcomes, declared);

            boolean balanceError = balance.hasBalanceError(properties.getCashTolerance());
            String justification = blankToNull(command.getJustification());
            if (balanceError && justification == null) {
                if (properties.isCashDeltaJustificationMandatory()) {
                    throw new JustificationRequiredException(balance.getDelta());
                }
                log.warn("Closing with unjustified cash delta {}", balance.getDelta());
            }

            SessionClosing closing = new SessionClosing(
                Instant.now(clock),
                command.getOperator(),
                declared,
                balance.getTheoretical(),
                balance.getDelta(),
                justification
            );
            ClosedPosSession closed = active.close(closing, incomes.toIncomes(), outcomes);
            store.replace(closed);

            String zTicket = ticketRenderer.renderZTicket(closed);
            outboxService.saveEvent(AGGREGATE_TYPE, sessionId,
                    PosSessionClosedEvent.EVENT_TYPE, PosSessionClosedEvent.from(closed, zTicket));

            metrics.recordClosed(balanceError, balance.getDelta());
            log.info("POS session closed by {}: declared {}, theoretical {}, delta {}",
                    command.getOperator().displayName(), declared, balance.getTheoretical(), balance.getDelta());
            return new CloseResult(closed, zTicket);
        });
    }

    /**
     * Prints an interim ticket and logs who printed it. The session stays open.
     *
     * @throws SessionNotFoundException  if the session does not exist
     * @throws SessionNotActiveException if it is closed, including by a concurrent close
     */
    @Transactional
    public String generateXTicket(UUID sessionId, SessionOperator operator) {
        return observe("x_ticket", sessionId, () -> {
            requireSessionId(sessionId);
            requireOperator(operator);

            PosSession session = store.findById(sessionId)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
            if (!(session instanceof ActivePosSession active)) {
                throw new SessionNotActiveException(sessionId);
            }

            IncomeSnapshot incomes = incomeAggregator.aggregate(active.getOpening().getOpenedAt());
            XTicketEntry entry = new XTicketEntry(Instant.now(clock), operator);
            store.appendXTicket(sessionId, entry);

            String ticket = ticketRenderer.renderXTicket(active, incomes, entry);
            outboxService.saveEvent(AGGREGATE_TYPE, sessionId,
                    XTicketGeneratedEvent.EVENT_TYPE, XTicketGeneratedEvent.from(sessionId, entry, ticket));

            metrics.recordXTicket();
            log.info("X ticket printed by {} ({} methods so far)", operator.displayName(), incomes.asMap().size());
            return ticket;
        });
    }

    @Transactional(readOnly = true)
    public Optional<ActivePosSession> getActiveSession() {
        return store.findActive();
    }

    /**
     * @throws SessionNotFoundException if the session does not exist
     */
    @Transactional(readOnly = true)
    public PosSession getSession(UUID sessionId) {
        return store.findById(sessionId)
            .orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    /**
     * Income of an open session up to now, as shown on the closing screen.
     */
    @Transactional(readOnly = true)
    public IncomeSnapshot currentIncome(ActivePosSession session) {
        return incomeAggregator.aggregate(session.getOpening().getOpenedAt());
    }

    /**
     * Renders the Z ticket of a closed session again.
     *
     * @throws SessionNotFoundException  if the session does not exist
     * @throws SessionNotActiveException if the session is still open
     */
    @Transactional(readOnly = true)
    public String getZTicket(UUID sessionId) {
        PosSession session = getSession(sessionId);
        if (!(session instanceof ClosedPosSession closed)) {
            throw SessionNotActiveException.notClosed(sessionId);
        }
        return ticketRenderer.renderZTicket(closed);
    }

    /**
     * Most recently closed sessions, newest first.
     *
     * @throws InvalidSessionInputException unless 1 &lt;= limit &lt;= 100
     */
    @Transactional(readOnly = true)
    public List<ClosedPosSession> getHistory(int limit) {
        if (limit < 1 || limit > MAX_HISTORY) {
            throw new InvalidSessionInputException("History limit must be between 1 and " + MAX_HISTORY);
        }
        return store.findRecentlyClosed(limit);
    }

    public boolean isJustificationMandatory() {
        return properties.isCashDeltaJustificationMandatory();
    }

    private void warnOnOpeningMismatch(Money cashOpening) {
        store.findLastClosed()
            .map(last -> last.getClosing().getCashClosing())
            .filter(previous -> !previous.isSameValueAs(cashOpening))
            .ifPresent(previous -> {
                metrics.recordOpeningMismatch();
                log.warn("Opening amount mismatch! Expected: {}, Got: {}", previous, cashOpening);
            });
    }

    /**
     * Runs a lifecycle operation with its metrics. The session id is put in
     * the MDC for the duration and the caller's value is restored afterwards.
     */
    private <T> T observe(String operation, UUID sessionId, Supplier<T> action) {
        long startTime = System.currentTimeMillis();
        String callerSessionId = MDC.get(CorrelationContext.SESSION_ID_MDC_KEY);
        CorrelationContext.putSessionId(sessionId);
        try {
            return action.get();
        } catch (PosSessionException e) {
            metrics.recordRejected(operation, e.getKind());
            log.warn("POS session {} rejected: {} ({})", operation, e.getMessage(), e.getKind());
            throw e;
        } finally {
            metrics.recordLatency(operation, System.currentTimeMillis() - startTime);
            if (callerSessionId == null) {
                MDC.remove(CorrelationContext.SESSION_ID_MDC_KEY);
            } else {
                MDC.put(CorrelationContext.SESSION_ID_MDC_KEY, callerSessionId);
            }
        }
    }

    private static void requireSessionId(UUID sessionId) {
        if (sessionId == null) {
            throw new InvalidSessionInputException("Session id is required");
        }
    }

    private static void requireAmount(BigDecimal amount, String label) {
        if (amount == null) {
            throw new InvalidSessionInputException(label + " is required");
        }
        if (amount.signum() < 0) {
            throw new InvalidSessionInputException(label + " must not be negative");
        }
        requireStorablePrecision(amount, label);
    }

    /**
     * Amounts are stored as {@code NUMERIC(19,4)}. Anything finer would be
     * rounded on write and the stored session would no longer match the
     * ticket returned to the caller.
     */
    private static void requireStorablePrecision(BigDecimal amount, String label) {
        if (amount.stripTrailingZeros().scale() > MAX_FRACTION_DIGITS) {
            throw new InvalidSessionInputException(
                label + " allows at most " + MAX_FRACTION_DIGITS + " decimals: " + amount.toPlainString());
        }
    }

    private static void requireCurrency(CurrencyCode currency, String label) {
        if (currency == null) {
            throw new InvalidSessionInputException(label + " is required");
        }
    }

    private static void requireOutcome(SessionOutcome outcome) {
        if (outcome == null || outcome.getAmount() == null) {
            throw new InvalidSessionInputException("Outcome amount is required");
        }
        if (outcome.getCategory() == null || outcome.getCategory().isBlank()) {
            throw new InvalidSessionInputException("Outcome category is required");
        }
        if (outcome.getAmount().isNegative()) {
            throw new InvalidSessionInputException("Outcome " + outcome.getCategory() + " must not be negative");
        }
        requireStorablePrecision(outcome.getAmount().getAmount(), "Outcome " + outcome.getCategory());
    }

    private static void requireOperator(SessionOperator operator) {
        if (operator == null || operator.getUserId() == null || operator.getUserId().isBlank()) {
            throw new InvalidSessionInputException("Operator is required");
        }
    }

    private static void requireOpeningCurrency(CurrencyCode actual, CurrencyCode opening, String label) {
        if (actual != opening) {
            throw new InvalidSessionInputException(
                label + " must be in the opening currency " + opening + ", got " + actual);
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
