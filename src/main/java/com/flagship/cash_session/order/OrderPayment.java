package com.flagship.cash_session.order;

import com.flagship.cash_session.money.Money;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * One payment of a customer order, as projected from order management.
 *
 * The order's own creation time and status travel with each payment because
 * session income is windowed and filtered on the order, not on the payment.
 */
@Value
public class OrderPayment {
    UUID paymentId;
    UUID orderId;
    Instant orderCreatedAt;
    PaymentStatus orderStatus;
    PaymentMethod method;
    Money amount;
    PaymentStatus status;

    /**
     * Both the payment and its parent order are paid.
     */
    public boolean isPaid() {
        return orderStatus == PaymentStatus.PAID && status == PaymentStatus.PAID;
    }

    /**
     * The parent order was created at or after the given instant.
     */
    public boolean isOrderedSince(Instant since) {
        return !orderCreatedAt.isBefore(since);
    }
}
