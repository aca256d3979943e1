package com.flagship.cash_session.order;

import java.time.Instant;
import java.util.List;

/**
 * Read side of order management used to compute session income.
 */
public interface PaymentSource {

    /**
     * Returns every paid payment whose order was created at or after
     * {@code since}. Payments of unpaid orders, and payments that are not
     * themselves paid, are not returned.
     *
     * The result is a point-in-time snapshot; callers aggregate it once.
     */
    List<OrderPayment> findPaidSince(Instant since);
}
