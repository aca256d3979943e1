package com.flagship.cash_session.order;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Repository for the order payment projection.
 */
@Repository
public interface OrderPaymentRepository extends JpaRepository<OrderPaymentEntity, UUID> {

    /**
     * Paid payments of paid orders created at or after {@code since}, oldest
     * order first so that callers see methods in the order they were used.
     */
    @Query("""
        SELECT p FROM OrderPaymentEntity p
        WHERE p.orderCreatedAt >= :since
        AND p.orderStatus = com.flagship.cash_session.order.PaymentStatus.PAID
        AND p.status = com.flagship.cash_session.order.PaymentStatus.PAID
        ORDER BY p.orderCreatedAt ASC, p.paymentId ASC
        """)
    List<OrderPaymentEntity> findPaidSince(@Param("since") Instant since);

    List<OrderPaymentEntity> findByOrderId(UUID orderId);

    /**
     * Applies an order status to every payment of the order that does not
     * already hold a newer one.
     */
    @Modifying
    @Query("""
        UPDATE OrderPaymentEntity p
        SET p.orderStatus = :status, p.orderStatusOccurredAt = :occurredAt, p.updatedAt = :now
        WHERE p.orderId = :orderId
        AND p.orderStatusOccurredAt <= :occurredAt
        """)
    int updateOrderStatus(@Param("orderId") UUID orderId,
                          @Param("status") PaymentStatus status,
                          @Param("occurredAt") Instant occurredAt,
                          @Param("now") Instant now);
}
