package com.flagship.cash_session.session.store;

import com.flagship.cash_session.money.CurrencyCode;
import com.flagship.cash_session.money.Money;
import com.flagship.cash_session.order.PaymentMethod;
import com.flagship.cash_session.session.ActivePosSession;
import com.flagship.cash_session.session.ClosedPosSession;
import com.flagship.cash_session.session.PosSession;
import com.flagship.cash_session.session.PosSessionStatus;
import com.flagship.cash_session.session.SessionClosing;
import com.flagship.cash_session.session.SessionIncome;
import com.flagship.cash_session.session.SessionOpening;
import com.flagship.cash_session.session.SessionOperator;
import com.flagship.cash_session.session.SessionOutcome;
import com.flagship.cash_session.session.XTicketEntry;
import com.flagship.cash_session.session.exception.SessionAlreadyActiveException;
import com.flagship.cash_session.session.exception.SessionAlreadyClosedException;
import com.flagship.cash_session.session.exception.SessionNotActiveException;
import com.flagship.cash_session.session.exception.SessionNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Store behaviour against PostgreSQL: the single active session index, the
 * close-once rule and the append-only X ticket log.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class JpaPosSessionStoreTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("cash_session_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        // No broker in these tests
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("spring.kafka.admin.auto-create", () -> "false");
        registry.add("consumer.enabled", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
    }

    private static final SessionOperator ALICE = SessionOperator.of("u-1", "alice", "Alice");
    private static final SessionOperator BOB = SessionOperator.of("u-2", "bob", null);
    private static final Instant OPENED_AT = Instant.parse("2024-03-01T08:00:00Z");

    @Autowired
    private JpaPosSessionStore store;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void setUp() {
        jdbcTemplate.execute("DELETE FROM pos_session_x_tickets");
        jdbcTemplate.execute("DELETE FROM pos_session_incomes");
        jdbcTemplate.execute("DELETE FROM pos_session_outcomes");
        jdbcTemplate.execute("DELETE FROM pos_sessions");
    }

    private static Money eur(String amount) {
        return Money.of(amount, CurrencyCode.EUR);
    }

    private static ActivePosSession newSession(Instant openedAt) {
        return ActivePosSession.open(UUID.randomUUID(), new SessionOpening(openedAt, ALICE, eur("200")));
    }

    private static ClosedPosSession closeOf(ActivePosSession session, Instant closedAt) {
        SessionClosing closing = new SessionClosing(
            closedAt, BOB, eur("250"), eur("280"), eur("-30"), "counted error");
        return session.close(
            closing,
            List.of(
                new SessionIncome(PaymentMethod.POINT_OF_SALE, eur("80")),
                new SessionIncome(PaymentMethod.CARD, eur("15.5"))
            ),
            List.of(
                SessionOutcome.bankDeposit(eur("0")),
                new SessionOutcome("supplies", eur("12.25"))
            ));
    }

    @Test
    @DisplayName("An inserted session is found as the active one")
    void testInsertAndFindActive() {
        ActivePosSession session = newSession(OPENED_AT);

        store.insert(session);

        ActivePosSession active = store.findActive().orElseThrow();
        assertEquals(session.getId(), active.getId());
        assertEquals(OPENED_AT, active.getOpening().getOpenedAt());
        assertEquals(ALICE, active.getOpening().getOpenedBy());
        assertTrue(active.getOpening().getCashOpening().isSameValueAs(eur("200")));
        assertTrue(active.getXTickets().isEmpty());
        assertEquals(PosSessionStatus.ACTIVE, store.findById(session.getId()).orElseThrow().getStatus());
    }

    @Test
    @DisplayName("The database refuses a second active session")
    void testSecondActiveSessionRefused() {
        store.insert(newSession(OPENED_AT));

        ActivePosSession second = newSession(OPENED_AT.plusSeconds(60));
        assertThrows(SessionAlreadyActiveException.class, () -> store.insert(second));

        assertTrue(store.findById(second.getId()).isEmpty());
    }

    @Test
    @DisplayName("Replacing with the closed form stores every closing fact")
    void testReplace() {
        ActivePosSession session = newSession(OPENED_AT);
        store.insert(session);
        Instant closedAt = OPENED_AT.plusSeconds(36_000);

        store.replace(closeOf(session, closedAt));

        PosSession stored = store.findById(session.getId()).orElseThrow();
        ClosedPosSession closed = assertInstanceOf(ClosedPosSession.class, stored);
        SessionClosing closing = closed.getClosing();
        assertEquals(closedAt, closing.getClosedAt());
        assertEquals(BOB, closing.getClosedBy());
        assertTrue(closing.getCashClosing().isSameValueAs(eur("250")));
        assertTrue(closing.getCashClosingTheoretical().isSameValueAs(eur("280")));
        assertTrue(closing.getCashDelta().isSameValueAs(eur("-30")));
        assertEquals("counted error", closing.getJustification());
        assertEquals(closedAt, closed.getUpdatedAt());

        assertEquals(List.of(PaymentMethod.POINT_OF_SALE, PaymentMethod.CARD),
            closed.getDailyIncomes().stream().map(SessionIncome::getPaymentMethod).toList());
        assertEquals(List.of(SessionOutcome.BANK_DEPOSIT, "supplies"),
            closed.getDailyOutcomes().stream().map(SessionOutcome::getCategory).toList());
        assertTrue(closed.getDailyOutcomes().get(1).getAmount().isSameValueAs(eur("12.25")));

        assertTrue(store.findActive().isEmpty());
    }

    @Test
    @DisplayName("A closed session cannot be replaced again")
    void testReplaceTwice() {
        ActivePosSession session = newSession(OPENED_AT);
        store.insert(session);
        store.replace(closeOf(session, OPENED_AT.plusSeconds(60)));

        assertThrows(SessionAlreadyClosedException.class,
            () -> store.replace(closeOf(session, OPENED_AT.plusSeconds(120))));

        ClosedPosSession stored = (ClosedPosSession) store.findById(session.getId()).orElseThrow();
        assertEquals(OPENED_AT.plusSeconds(60), stored.getClosing().getClosedAt());
    }

    @Test
    @DisplayName("X ticket entries are kept in append order and carried into the closed session")
    void testAppendXTicket() {
        ActivePosSession session = newSession(OPENED_AT);
        store.insert(session);
        XTicketEntry first = new XTicketEntry(OPENED_AT.plusSeconds(60), ALICE);
        XTicketEntry second = new XTicketEntry(OPENED_AT.plusSeconds(120), BOB);

        store.appendXTicket(session.getId(), first);
        store.appendXTicket(session.getId(), second);

        PosSession stored = store.findById(session.getId()).orElseThrow();
        assertEquals(List.of(first, second), stored.getXTickets());
        assertEquals(second.getGeneratedAt(), stored.getUpdatedAt());

        store.replace(closeOf((ActivePosSession) stored, OPENED_AT.plusSeconds(600)));
        assertEquals(List.of(first, second), store.findById(session.getId()).orElseThrow().getXTickets());
    }

    @Test
    @DisplayName("Appending to a closed or unknown session is refused")
    void testAppendXTicketRejected() {
        ActivePosSession session = newSession(OPENED_AT);
        store.insert(session);
        store.replace(closeOf(session, OPENED_AT.plusSeconds(60)));
        XTicketEntry entry = new XTicketEntry(OPENED_AT.plusSeconds(120), ALICE);

        assertThrows(SessionNotActiveException.class, () -> store.appendXTicket(session.getId(), entry));
        assertThrows(SessionNotFoundException.class, () -> store.appendXTicket(UUID.randomUUID(), entry));
        assertTrue(store.findById(session.getId()).orElseThrow().getXTickets().isEmpty());
    }

    @Test
    @DisplayName("Closed sessions are listed newest first")
    void testFindRecentlyClosed() {
        ActivePosSession first = newSession(OPENED_AT);
        store.insert(first);
        store.replace(closeOf(first, OPENED_AT.plusSeconds(60)));

        ActivePosSession second = newSession(OPENED_AT.plusSeconds(3_600));
        store.insert(second);
        store.replace(closeOf(second, OPENED_AT.plusSeconds(7_200)));

        store.insert(newSession(OPENED_AT.plusSeconds(10_000)));

        assertEquals(List.of(second.getId(), first.getId()),
            store.findRecentlyClosed(10).stream().map(ClosedPosSession::getId).toList());
        assertEquals(second.getId(), store.findLastClosed().orElseThrow().getId());
        assertEquals(1, store.findRecentlyClosed(1).size());
    }
}
