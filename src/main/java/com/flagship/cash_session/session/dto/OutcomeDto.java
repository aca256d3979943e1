package com.flagship.cash_session.session.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Cash taken out of the drawer. Currency defaults to the closing currency.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class OutcomeDto {

    @NotBlank(message = "Outcome category is required")
    @JsonProperty("category")
    private String category;

    @NotNull(message = "Outcome amount is required")
    @DecimalMin(value = "0", message = "Outcome amount must not be negative")
    @Digits(integer = 15, fraction = 4, message = "Outcome amount allows at most 4 decimals")
    @JsonProperty("amount")
    private BigDecimal amount;

    @JsonProperty("currency")
    private String currency;
}
