package com.flagship.cash_session.order.event;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.flagship.cash_session.money.CurrencyCode;
import com.flagship.cash_session.money.Money;
import com.flagship.cash_session.order.OrderPayment;
import com.flagship.cash_session.order.PaymentMethod;
import com.flagship.cash_session.order.PaymentStatus;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Published by order management each time a payment of an order is recorded
 * or changes status. Carries the order's current status as well.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class OrderPaymentRecordedEvent {
    UUID eventId;
    UUID orderId;
    Instant orderCreatedAt;
    String orderStatus;
    UUID paymentId;
    String method;
    BigDecimal amount;
    String currency;
    String paymentStatus;
    Instant occurredAt;

    public static final String EVENT_TYPE = "OrderPaymentRecorded";

    public String getEventType() {
        return EVENT_TYPE;
    }

    /**
     * @throws IllegalArgumentException if the method, currency or a status is unknown
     */
    public OrderPayment toDomain() {
        return new OrderPayment(
            paymentId,
            orderId,
            orderCreatedAt,
            PaymentStatus.valueOf(orderStatus),
            PaymentMethod.fromTag(method),
            Money.of(amount, CurrencyCode.valueOf(currency)),
            PaymentStatus.valueOf(paymentStatus)
        );
    }
}
