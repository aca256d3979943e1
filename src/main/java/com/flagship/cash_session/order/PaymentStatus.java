package com.flagship.cash_session.order;

/**
 * Status of an order, or of a single payment of an order, as reported by
 * order management.
 *
 * Only {@link #PAID} counts towards session income. Everything else is
 * either still in flight or will never settle.
 */
public enum PaymentStatus {
    PENDING,
    PAID,
    EXPIRED,
    CANCELED,
    FAILED
}
