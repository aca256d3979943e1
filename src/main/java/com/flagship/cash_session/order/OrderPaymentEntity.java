package com.flagship.cash_session.order;

import com.flagship.cash_session.money.CurrencyCode;
import com.flagship.cash_session.money.Money;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for the local projection of order payments.
 *
 * Rows are written only by the order-payment consumer. No setters: the
 * payment's own status is changed through {@link #apply} and the order
 * status, shared by all payments of an order, through a bulk update in
 * {@link OrderPaymentRepository}.
 *
 * Each status remembers when order management produced it. Events reach us
 * out of order, and a status older than the one stored is dropped.
 */
@Entity
@Table(
    name = "order_payments",
    indexes = {
        @Index(name = "idx_order_payments_order_id", columnList = "order_id"),
        @Index(name = "idx_order_payments_order_created_at", columnList = "order_created_at")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class OrderPaymentEntity {

    @Id
    @Column(name = "payment_id", nullable = false, updatable = false)
    private UUID paymentId;

    @Column(name = "order_id", nullable = false, updatable = false)
    private UUID orderId;

    @Column(name = "order_created_at", nullable = false, updatable = false)
    private Instant orderCreatedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "order_status", nullable = false, length = 20)
    private PaymentStatus orderStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "method", nullable = false, length = 20, updatable = false)
    private PaymentMethod method;

    @Column(nullable = false, precision = 19, scale = 4, updatable = false)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 3, updatable = false)
    private CurrencyCode currency;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PaymentStatus status;

    @Column(name = "status_occurred_at", nullable = false)
    private Instant statusOccurredAt;

    @Column(name = "order_status_occurred_at", nullable = false)
    private Instant orderStatusOccurredAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    static OrderPaymentEntity fromDomain(OrderPayment payment, Instant occurredAt, Instant now) {
        return new OrderPaymentEntity(
            payment.getPaymentId(),
            payment.getOrderId(),
            payment.getOrderCreatedAt(),
            payment.getOrderStatus(),
            payment.getMethod(),
            payment.getAmount().getAmount(),
            payment.getAmount().getCurrency(),
            payment.getStatus(),
            occurredAt,
            occurredAt,
            now
        );
    }

    public OrderPayment toDomain() {
        return new OrderPayment(
            paymentId,
            orderId,
            orderCreatedAt,
            orderStatus,
            method,
            Money.of(amount, currency),
            status
        );
    }

    /**
     * Only the statuses move once a payment is known; method, amount and the
     * order's creation time are fixed by order management.
     *
     * @return false if both statuses carried by the event were already superseded
     */
    boolean apply(OrderPayment payment, Instant occurredAt, Instant now) {
        boolean changed = false;
        if (!occurredAt.isBefore(statusOccurredAt)) {
            this.status = payment.getStatus();
            this.statusOccurredAt = occurredAt;
            changed = true;
        }
        if (!occurredAt.isBefore(orderStatusOccurredAt)) {
            this.orderStatus = payment.getOrderStatus();
            this.orderStatusOccurredAt = occurredAt;
            changed = true;
        }
        if (changed) {
            this.updatedAt = now;
        }
        return changed;
    }

    /**
     * Takes a newer order status already known from a sibling payment.
     */
    void adoptOrderStatus(PaymentStatus status, Instant occurredAt) {
        if (occurredAt.isAfter(orderStatusOccurredAt)) {
            this.orderStatus = status;
            this.orderStatusOccurredAt = occurredAt;
        }
    }
}
