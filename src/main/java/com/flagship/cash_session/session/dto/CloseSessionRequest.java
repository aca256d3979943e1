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
import java.util.ArrayList;
import java.util.List;

/**
 * End-of-day count.
 *
 * {@code bank_deposit_amount} is the closing screen's single outcome field and
 * becomes a {@code bank-deposit} outcome; {@code outcomes} lists any others.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CloseSessionRequest {

    @NotNull(message = "Cash closing amount is required")
    @DecimalMin(value = "0", message = "Cash closing amount must not be negative")
    @Digits(integer = 15, fraction = 4, message = "Cash closing amount allows at most 4 decimals")
    @JsonProperty("cash_closing_amount")
    private BigDecimal cashClosingAmount;

    @NotBlank(message = "Currency is required")
    @Pattern(regexp = "^[A-Z]{3}$", message = "Currency must be a 3-letter code")
    @JsonProperty("currency")
    private String currency;

    @DecimalMin(value = "0", message = "Bank deposit amount must not be negative")
    @Digits(integer = 15, fraction = 4, message = "Bank deposit amount allows at most 4 decimals")
    @JsonProperty("bank_deposit_amount")
    private BigDecimal bankDepositAmount;

    @Valid
    @JsonProperty("outcomes")
    private List<OutcomeDto> outcomes = new ArrayList<>();

    @JsonProperty("justification")
    private String justification;

    @Valid
    @NotNull(message = "Operator is required")
    @JsonProperty("operator")
    private OperatorDto operator;
}
