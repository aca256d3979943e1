package com.flagship.cash_session.session.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.cash_session.money.Money;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class MoneyDto {

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("currency")
    String currency;

    public static MoneyDto from(Money money) {
        return money == null ? null : new MoneyDto(money.getAmount(), money.getCurrency().name());
    }
}
