package com.flagship.cash_session.session.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.cash_session.session.CloseResult;
import lombok.Value;

@Value
public class CloseSessionResponse {

    @JsonProperty("session")
    SessionResponse session;

    @JsonProperty("z_ticket")
    String zTicket;

    public static CloseSessionResponse from(CloseResult result) {
        return new CloseSessionResponse(SessionResponse.from(result.getSession()), result.getZTicket());
    }
}
