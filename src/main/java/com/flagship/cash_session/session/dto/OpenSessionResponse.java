package com.flagship.cash_session.session.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.UUID;

@Value
public class OpenSessionResponse {

    @JsonProperty("id")
    UUID id;
}
