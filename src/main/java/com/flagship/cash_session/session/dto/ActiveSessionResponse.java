package com.flagship.cash_session.session.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.cash_session.income.IncomeSnapshot;
import com.flagship.cash_session.session.ActivePosSession;
import lombok.Value;

import java.util.List;

/**
 * What the closing screen needs: the open session, its income so far, and
 * whether a cash delta must be justified.
 */
@Value
public class ActiveSessionResponse {

    @JsonProperty("session")
    SessionResponse session;

    @JsonProperty("incomes")
    List<SessionResponse.IncomeLine> incomes;

    @JsonProperty("cash_delta_justification_mandatory")
    boolean cashDeltaJustificationMandatory;

    public static ActiveSessionResponse from(ActivePosSession session, IncomeSnapshot incomes,
                                             boolean justificationMandatory) {
        return new ActiveSessionResponse(
            SessionResponse.from(session),
            incomes.toIncomes().stream().map(SessionResponse.IncomeLine::from).toList(),
            justificationMandatory
        );
    }
}
