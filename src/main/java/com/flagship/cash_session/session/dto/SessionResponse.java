package com.flagship.cash_session.session.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.cash_session.session.ClosedPosSession;
import com.flagship.cash_session.session.PosSession;
import com.flagship.cash_session.session.PosSessionStatus;
import com.flagship.cash_session.session.SessionClosing;
import com.flagship.cash_session.session.SessionIncome;
import com.flagship.cash_session.session.SessionOutcome;
import com.flagship.cash_session.session.XTicketEntry;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A session as returned by the API. Closing fields are omitted while active.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SessionResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("status")
    PosSessionStatus status;

    @JsonProperty("opened_at")
    Instant openedAt;

    @JsonProperty("opened_by")
    OperatorDto openedBy;

    @JsonProperty("cash_opening")
    MoneyDto cashOpening;

    @JsonProperty("closed_at")
    Instant closedAt;

    @JsonProperty("closed_by")
    OperatorDto closedBy;

    @JsonProperty("cash_closing")
    MoneyDto cashClosing;

    @JsonProperty("cash_closing_theoretical")
    MoneyDto cashClosingTheoretical;

    @JsonProperty("cash_delta")
    MoneyDto cashDelta;

    @JsonProperty("cash_delta_justification")
    String cashDeltaJustification;

    @JsonProperty("daily_incomes")
    List<IncomeLine> dailyIncomes;

    @JsonProperty("daily_outcomes")
    List<OutcomeLine> dailyOutcomes;

    @JsonProperty("x_tickets")
    List<XTicketLine> xTickets;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static SessionResponse from(PosSession session) {
        SessionResponseBuilder builder = SessionResponse.builder()
            .id(session.getId())
            .status(session.getStatus())
            .openedAt(session.getOpening().getOpenedAt())
            .openedBy(OperatorDto.from(session.getOpening().getOpenedBy()))
            .cashOpening(MoneyDto.from(session.getOpening().getCashOpening()))
            .dailyIncomes(session.getDailyIncomes().stream().map(IncomeLine::from).toList())
            .dailyOutcomes(session.getDailyOutcomes().stream().map(OutcomeLine::from).toList())
            .xTickets(session.getXTickets().stream().map(XTicketLine::from).toList())
            .createdAt(session.getCreatedAt())
            .updatedAt(session.getUpdatedAt());

        if (session instanceof ClosedPosSession closed) {
            SessionClosing closing = closed.getClosing();
            builder.closedAt(closing.getClosedAt())
                .closedBy(OperatorDto.from(closing.getClosedBy()))
                .cashClosing(MoneyDto.from(closing.getCashClosing()))
                .cashClosingTheoretical(MoneyDto.from(closing.getCashClosingTheoretical()))
                .cashDelta(MoneyDto.from(closing.getCashDelta()))
                .cashDeltaJustification(closing.getJustification());
        }
        return builder.build();
    }

    @Value
    public static class IncomeLine {
        @JsonProperty("payment_method")
        String paymentMethod;

        @JsonProperty("amount")
        BigDecimal amount;

        @JsonProperty("currency")
        String currency;

        public static IncomeLine from(SessionIncome income) {
            return new IncomeLine(
                income.getPaymentMethod().getTag(),
                income.getAmount().getAmount(),
                income.getAmount().getCurrency().name()
            );
        }
    }

    @Value
    public static class OutcomeLine {
        @JsonProperty("category")
        String category;

        @JsonProperty("amount")
        BigDecimal amount;

        @JsonProperty("currency")
        String currency;

        static OutcomeLine from(SessionOutcome outcome) {
            return new OutcomeLine(
                outcome.getCategory(),
                outcome.getAmount().getAmount(),
                outcome.getAmount().getCurrency().name()
            );
        }
    }

    @Value
    public static class XTicketLine {
        @JsonProperty("generated_at")
        Instant generatedAt;

        @JsonProperty("generated_by")
        OperatorDto generatedBy;

        static XTicketLine from(XTicketEntry entry) {
            return new XTicketLine(entry.getGeneratedAt(), OperatorDto.from(entry.getGeneratedBy()));
        }
    }
}
