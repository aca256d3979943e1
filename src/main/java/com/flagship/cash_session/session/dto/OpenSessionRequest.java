package com.flagship.cash_session.session.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Opening float counted at the start of the day.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class OpenSessionRequest {

    @NotNull(message = "Opening amount is required")
    @DecimalMin(value = "0", message = "Opening amount must not be negative")
    @Digits(integer = 15, fraction = 4, message = "Opening amount allows at most 4 decimals")
    @JsonProperty("amount")
    private BigDecimal amount;

    @NotBlank(message = "Currency is required")
    @Pattern(regexp = "^[A-Z]{3}$", message = "Currency must be a 3-letter code")
    @JsonProperty("currency")
    private String currency;

    @Valid
    @NotNull(message = "Operator is required")
    @JsonProperty("operator")
    private OperatorDto operator;
}
