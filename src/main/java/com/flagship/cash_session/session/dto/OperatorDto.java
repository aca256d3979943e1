package com.flagship.cash_session.session.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.cash_session.session.SessionOperator;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Staff member performing the operation.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OperatorDto {

    @NotBlank(message = "Operator user id is required")
    @JsonProperty("user_id")
    private String userId;

    @JsonProperty("login")
    private String login;

    @JsonProperty("alias")
    private String alias;

    public SessionOperator toDomain() {
        return SessionOperator.of(userId, login, alias);
    }

    public static OperatorDto from(SessionOperator operator) {
        return operator == null
            ? null
            : new OperatorDto(operator.getUserId(), operator.getLogin(), operator.getAlias());
    }
}
