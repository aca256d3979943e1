package com.flagship.cash_session.session;

import com.flagship.cash_session.income.IncomeSnapshot;
import com.flagship.cash_session.money.CurrencyCode;
import com.flagship.cash_session.money.Money;
import com.flagship.cash_session.session.dto.ActiveSessionResponse;
import com.flagship.cash_session.session.dto.CloseSessionRequest;
import com.flagship.cash_session.session.dto.CloseSessionResponse;
import com.flagship.cash_session.session.dto.OpenSessionRequest;
import com.flagship.cash_session.session.dto.OpenSessionResponse;
import com.flagship.cash_session.session.dto.OutcomeDto;
import com.flagship.cash_session.session.dto.SessionResponse;
import com.flagship.cash_session.session.dto.XTicketRequest;
import com.flagship.cash_session.session.exception.InvalidSessionInputException;
import com.flagship.cash_session.session.exception.SessionNotFoundException;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * REST endpoints of the register's cash session.
 *
 * Tickets are returned as {@code text/plain}, ready to print.
 */
@RestController
@RequestMapping("/api/pos/sessions")
@RequiredArgsConstructor
@Slf4j
public class PosSessionController {

    private final PosSessionService sessionService;

    @PostMapping
    public ResponseEntity<OpenSessionResponse> openSession(@Valid @RequestBody OpenSessionRequest request) {
        log.info("Received session opening: amount={}, currency={}", request.getAmount(), request.getCurrency());

        UUID id = sessionService.openSession(
            request.getAmount(),
            parseCurrency(request.getCurrency()),
            request.getOperator().toDomain()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(new OpenSessionResponse(id));
    }

    @GetMapping("/active")
    public ResponseEntity<ActiveSessionResponse> getActiveSession() {
        ActivePosSession session = sessionService.getActiveSession()
            .orElseThrow(SessionNotFoundException::noActiveSession);
        IncomeSnapshot incomes = sessionService.currentIncome(session);

        return ResponseEntity.ok(
            ActiveSessionResponse.from(session, incomes, sessionService.isJustificationMandatory()));
    }

    @GetMapping("/history")
    public ResponseEntity<List<SessionResponse>> getHistory(
            @RequestParam(name = "limit", defaultValue = "20") int limit) {
        return ResponseEntity.ok(sessionService.getHistory(limit).stream()
            .map(SessionResponse::from)
            .toList());
    }

    @GetMapping("/{id}")
    public ResponseEntity<SessionResponse> getSession(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(SessionResponse.from(sessionService.getSession(id)));
    }

    @PostMapping("/{id}/x-tickets")
    public ResponseEntity<String> generateXTicket(@PathVariable("id") UUID id,
                                                  @Valid @RequestBody XTicketRequest request) {
        String ticket = sessionService.generateXTicket(id, request.getOperator().toDomain());
        return ResponseEntity.ok()
            .contentType(MediaType.TEXT_PLAIN)
            .body(ticket);
    }

    @PostMapping("/{id}/close")
    public ResponseEntity<CloseSessionResponse> closeSession(@PathVariable("id") UUID id,
                                                             @Valid @RequestBody CloseSessionRequest request) {
        log.info("Received session closing: sessionId={}, amount={}, currency={}",
                id, request.getCashClosingAmount(), request.getCurrency());

        CurrencyCode currency = parseCurrency(request.getCurrency());
        CloseSessionCommand command = CloseSessionCommand.builder()
            .sessionId(id)
            .cashClosingAmount(request.getCashClosingAmount())
            .cashClosingCurrency(currency)
            .outcomes(toOutcomes(request, currency))
            .justification(request.getJustification())
            .operator(request.getOperator().toDomain())
            .build();

        return ResponseEntity.ok(CloseSessionResponse.from(sessionService.closeSession(command)));
    }

    @GetMapping("/{id}/z-ticket")
    public ResponseEntity<String> getZTicket(@PathVariable("id") UUID id) {
        return ResponseEntity.ok()
            .contentType(MediaType.TEXT_PLAIN)
            .body(sessionService.getZTicket(id));
    }

    private static List<SessionOutcome> toOutcomes(CloseSessionRequest request, CurrencyCode currency) {
        List<SessionOutcome> outcomes = new ArrayList<>();
        if (request.getBankDepositAmount() != null) {
            outcomes.add(SessionOutcome.bankDeposit(Money.of(request.getBankDepositAmount(), currency)));
        }
        if (request.getOutcomes() != null) {
            for (OutcomeDto outcome : request.getOutcomes()) {
                CurrencyCode outcomeCurrency = outcome.getCurrency() == null
                    ? currency
                    : parseCurrency(outcome.getCurrency());
                outcomes.add(new SessionOutcome(outcome.getCategory(), Money.of(outcome.getAmount(), outcomeCurrency)));
            }
        }
        return outcomes;
    }

    private static CurrencyCode parseCurrency(String currency) {
        try {
            return CurrencyCode.valueOf(currency);
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new InvalidSessionInputException("Invalid currency code: " + currency);
        }
    }
}
