package com.flagship.cash_session.session;

import com.flagship.cash_session.income.IncomeSnapshot;
import com.flagship.cash_session.money.CurrencyCode;
import com.flagship.cash_session.money.Money;
import com.flagship.cash_session.order.PaymentMethod;
import com.flagship.cash_session.session.exception.JustificationRequiredException;
import com.flagship.cash_session.session.exception.PosSessionsDisabledException;
import com.flagship.cash_session.session.exception.SessionAlreadyActiveException;
import com.flagship.cash_session.session.exception.SessionNotActiveException;
import com.flagship.cash_session.session.exception.SessionNotFoundException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(PosSessionController.class)
class PosSessionControllerTest {

    private static final Instant OPENED_AT = Instant.parse("2024-03-01T08:00:00Z");
    private static final Instant CLOSED_AT = Instant.parse("2024-03-01T18:00:00Z");
    private static final SessionOperator ALICE = SessionOperator.of("u-1", "alice", "Alice");

    private static final String OPERATOR_JSON = """
        {"user_id": "u-1", "login": "alice", "alias": "Alice"}""";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private PosSessionService sessionService;

    private static Money eur(String amount) {
        return Money.of(amount, CurrencyCode.EUR);
    }

    private static ActivePosSession activeSession(UUID id) {
        return ActivePosSession.open(id, new SessionOpening(OPENED_AT, ALICE, eur("200")));
    }

    private static ClosedPosSession closedSession(UUID id) {
        SessionClosing closing = new SessionClosing(
            CLOSED_AT, ALICE, eur("250"), eur("280"), eur("-30"), "counted error");
        return activeSession(id).close(
            closing,
            List.of(new SessionIncome(PaymentMethod.POINT_OF_SALE, eur("80"))),
            List.of(SessionOutcome.bankDeposit(eur("0"))));
    }

    @Test
    @DisplayName("Opening a session returns 201 with its id")
    void testOpenSession() throws Exception {
        UUID id = UUID.randomUUID();
        when(sessionService.openSession(any(), any(), any())).thenReturn(id);

        mockMvc.perform(post("/api/pos/sessions")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"amount": 200.00, "currency": "EUR", "operator": %s}""".formatted(OPERATOR_JSON)))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.id").value(id.toString()))
            .andExpect(header().exists("X-Correlation-ID"));

        verify(sessionService).openSession(new BigDecimal("200.00"), CurrencyCode.EUR, ALICE);
    }

    @Test
    @DisplayName("A negative opening amount is rejected before reaching the service")
    void testOpenSessionNegativeAmount() throws Exception {
        mockMvc.perform(post("/api/pos/sessions")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"amount": -1, "currency": "EUR", "operator": %s}""".formatted(OPERATOR_JSON)))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("INVALID_INPUT"))
            .andExpect(jsonPath("$.details.amount").exists());

        verify(sessionService, never()).openSession(any(), any(), any());
    }

    @Test
    @DisplayName("Amounts with more than four decimals are rejected before reaching the service")
    void testAmountPrecision() throws Exception {
        mockMvc.perform(post("/api/pos/sessions")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"amount": 200.00001, "currency": "EUR", "operator": %s}""".formatted(OPERATOR_JSON)))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("INVALID_INPUT"))
            .andExpect(jsonPath("$.details.amount").exists());

        mockMvc.perform(post("/api/pos/sessions/{id}/close", UUID.randomUUID())
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {
                      "cash_closing_amount": 250,
                      "currency": "EUR",
                      "outcomes": [{"category": "supplies", "amount": 12.50001}],
                      "operator": %s
                    }""".formatted(OPERATOR_JSON)))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("INVALID_INPUT"));

        verify(sessionService, never()).openSession(any(), any(), any());
        verify(sessionService, never()).closeSession(any());
    }

    @Test
    @DisplayName("A non-numeric amount is rejected as invalid input")
    void testOpenSessionNonNumericAmount() throws Exception {
        mockMvc.perform(post("/api/pos/sessions")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"amount": "lots", "currency": "EUR", "operator": %s}""".formatted(OPERATOR_JSON)))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("INVALID_INPUT"));
    }

    @Test
    @DisplayName("An unknown currency code is rejected as invalid input")
    void testOpenSessionUnknownCurrency() throws Exception {
        mockMvc.perform(post("/api/pos/sessions")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"amount": 10, "currency": "XXX", "operator": %s}""".formatted(OPERATOR_JSON)))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("INVALID_INPUT"));

        verify(sessionService, never()).openSession(any(), any(), any());
    }

    @Test
    @DisplayName("Opening while a session is active returns 409")
    void testOpenSessionAlreadyActive() throws Exception {
        UUID active = UUID.randomUUID();
        when(sessionService.openSession(any(), any(), any())).thenThrow(new SessionAlreadyActiveException(active));

        mockMvc.perform(post("/api/pos/sessions")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"amount": 10, "currency": "EUR", "operator": %s}""".formatted(OPERATOR_JSON)))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.code").value("ALREADY_ACTIVE"));
    }

    @Test
    @DisplayName("Opening while sessions are switched off returns 403")
    void testOpenSessionDisabled() throws Exception {
        when(sessionService.openSession(any(), any(), any())).thenThrow(new PosSessionsDisabledException());

        mockMvc.perform(post("/api/pos/sessions")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"amount": 10, "currency": "EUR", "operator": %s}""".formatted(OPERATOR_JSON)))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.code").value("SESSIONS_DISABLED"));
    }

    @Test
    @DisplayName("Active session comes with its income so far and the justification flag")
    void testGetActiveSession() throws Exception {
        UUID id = UUID.randomUUID();
        ActivePosSession session = activeSession(id);
        when(sessionService.getActiveSession()).thenReturn(Optional.of(session));
        when(sessionService.currentIncome(session)).thenReturn(IncomeSnapshot.fromIncomes(List.of(
            new SessionIncome(PaymentMethod.POINT_OF_SALE, eur("80")))));
        when(sessionService.isJustificationMandatory()).thenReturn(true);

        mockMvc.perform(get("/api/pos/sessions/active"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.session.id").value(id.toString()))
            .andExpect(jsonPath("$.session.status").value("ACTIVE"))
            .andExpect(jsonPath("$.session.cash_opening.currency").value("EUR"))
            .andExpect(jsonPath("$.session.closed_at").doesNotExist())
            .andExpect(jsonPath("$.incomes[0].payment_method").value("point-of-sale"))
            .andExpect(jsonPath("$.cash_delta_justification_mandatory").value(true));
    }

    @Test
    @DisplayName("No active session returns 404")
    void testGetActiveSessionNone() throws Exception {
        when(sessionService.getActiveSession()).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/pos/sessions/active"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.code").value("NOT_FOUND"));
    }

    @Test
    @DisplayName("A malformed session id returns 400")
    void testGetSessionBadId() throws Exception {
        mockMvc.perform(get("/api/pos/sessions/not-a-uuid"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("INVALID_INPUT"));
    }

    @Test
    @DisplayName("An unknown session id returns 404")
    void testGetSessionUnknown() throws Exception {
        UUID id = UUID.randomUUID();
        when(sessionService.getSession(id)).thenThrow(new SessionNotFoundException(id));

        mockMvc.perform(get("/api/pos/sessions/{id}", id))
            .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("X ticket is returned as plain text")
    void testGenerateXTicket() throws Exception {
        UUID id = UUID.randomUUID();
        String ticket = "POS X ticket\nDaily incomes total so far :\n  - 80.00 EUR";
        when(sessionService.generateXTicket(id, ALICE)).thenReturn(ticket);

        mockMvc.perform(post("/api/pos/sessions/{id}/x-tickets", id)
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"operator": %s}""".formatted(OPERATOR_JSON)))
            .andExpect(status().isOk())
            .andExpect(content().contentTypeCompatibleWith(MediaType.TEXT_PLAIN))
            .andExpect(content().string(ticket));
    }

    @Test
    @DisplayName("X ticket on a closed session returns 409 as JSON")
    void testGenerateXTicketClosed() throws Exception {
        UUID id = UUID.randomUUID();
        when(sessionService.generateXTicket(eq(id), any())).thenThrow(new SessionNotActiveException(id));

        mockMvc.perform(post("/api/pos/sessions/{id}/x-tickets", id)
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"operator": %s}""".formatted(OPERATOR_JSON)))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.code").value("NOT_ACTIVE"));
    }

    @Test
    @DisplayName("The bank deposit field becomes the first outcome of the close command")
    void testCloseSession() throws Exception {
        UUID id = UUID.randomUUID();
        when(sessionService.closeSession(any())).thenReturn(new CloseResult(closedSession(id), "POS Z ticket"));

        mockMvc.perform(post("/api/pos/sessions/{id}/close", id)
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {
                      "cash_closing_amount": 250,
                      "currency": "EUR",
                      "bank_deposit_amount": 0,
                      "outcomes": [{"category": "supplies", "amount": 12.5}],
                      "justification": "counted error",
                      "operator": %s
                    }""".formatted(OPERATOR_JSON)))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.z_ticket").value("POS Z ticket"))
            .andExpect(jsonPath("$.session.status").value("CLOSED"))
            .andExpect(jsonPath("$.session.cash_delta.amount").value(-30))
            .andExpect(jsonPath("$.session.cash_delta_justification").value("counted error"))
            .andExpect(jsonPath("$.session.daily_outcomes[0].category").value("bank-deposit"));

        ArgumentCaptor<CloseSessionCommand> captor = ArgumentCaptor.forClass(CloseSessionCommand.class);
        verify(sessionService).closeSession(captor.capture());
        CloseSessionCommand command = captor.getValue();

        assertEquals(id, command.getSessionId());
        assertEquals(0, command.getCashClosingAmount().compareTo(new BigDecimal("250")));
        assertEquals(CurrencyCode.EUR, command.getCashClosingCurrency());
        assertEquals(2, command.getOutcomes().size());
        assertEquals(SessionOutcome.BANK_DEPOSIT, command.getOutcomes().get(0).getCategory());
        assertEquals("supplies", command.getOutcomes().get(1).getCategory());
        assertTrue(command.getOutcomes().get(1).getAmount().isSameValueAs(eur("12.5")));
        assertEquals("counted error", command.getJustification());
        assertEquals(ALICE, command.getOperator());
    }

    @Test
    @DisplayName("A close needing a justification returns 422 with the delta")
    void testCloseSessionJustificationRequired() throws Exception {
        UUID id = UUID.randomUUID();
        when(sessionService.closeSession(any())).thenThrow(new JustificationRequiredException(eur("-30")));

        mockMvc.perform(post("/api/pos/sessions/{id}/close", id)
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"cash_closing_amount": 250, "currency": "EUR", "operator": %s}""".formatted(OPERATOR_JSON)))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.code").value("JUSTIFICATION_REQUIRED"))
            .andExpect(jsonPath("$.details.cash_delta").value("-30.00 EUR"));
    }

    @Test
    @DisplayName("Closing without an operator is rejected")
    void testCloseSessionMissingOperator() throws Exception {
        mockMvc.perform(post("/api/pos/sessions/{id}/close", UUID.randomUUID())
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"cash_closing_amount": 250, "currency": "EUR"}"""))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.details.operator").exists());

        verify(sessionService, never()).closeSession(any());
    }

    @Test
    @DisplayName("Z ticket is reprinted as plain text")
    void testGetZTicket() throws Exception {
        UUID id = UUID.randomUUID();
        when(sessionService.getZTicket(id)).thenReturn("POS Z ticket");

        mockMvc.perform(get("/api/pos/sessions/{id}/z-ticket", id))
            .andExpect(status().isOk())
            .andExpect(content().contentTypeCompatibleWith(MediaType.TEXT_PLAIN))
            .andExpect(content().string("POS Z ticket"));
    }

    @Test
    @DisplayName("Z ticket of an open session returns 409")
    void testGetZTicketActive() throws Exception {
        UUID id = UUID.randomUUID();
        when(sessionService.getZTicket(id)).thenThrow(new SessionNotActiveException(id));

        mockMvc.perform(get("/api/pos/sessions/{id}/z-ticket", id))
            .andExpect(status().isConflict());
    }

    @Test
    @DisplayName("History returns closed sessions with the requested limit")
    void testGetHistory() throws Exception {
        UUID id = UUID.randomUUID();
        when(sessionService.getHistory(5)).thenReturn(List.of(closedSession(id)));

        mockMvc.perform(get("/api/pos/sessions/history").param("limit", "5"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].id").value(id.toString()))
            .andExpect(jsonPath("$[0].daily_incomes[0].amount").value(80));
    }
}
