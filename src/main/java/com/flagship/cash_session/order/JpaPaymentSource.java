package com.flagship.cash_session.order;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * {@link PaymentSource} backed by the {@code order_payments} projection.
 *
 * Also owns the write side of the projection, used by the order-payment
 * consumer.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JpaPaymentSource implements PaymentSource {

    private final OrderPaymentRepository repository;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public List<OrderPayment> findPaidSince(Instant since) {
        List<OrderPayment> payments = repository.findPaidSince(since)
            .stream()
            .map(OrderPaymentEntity::toDomain)
            .toList();
        log.debug("Found {} paid payments since {}", payments.size(), since);
        return payments;
    }

    @Transactional(readOnly = true)
    public Optional<OrderPayment> findById(UUID paymentId) {
        return repository.findById(paymentId)
            .map(OrderPaymentEntity::toDomain);
    }

    /**
     * Inserts the payment, or updates its statuses if it is already known,
     * then propagates the order status to the order's other payments.
     * Statuses older than the stored ones are left alone.
     *
     * @param occurredAt when order management produced the statuses; the
     *                   current time when the event does not say
     */
    @Transactional
    public OrderPayment record(OrderPayment payment, Instant occurredAt) {
        Instant now = clock.instant();
        Instant eventTime = occurredAt != null ? occurredAt : now;

        Optional<OrderPaymentEntity> existing = repository.findById(payment.getPaymentId());
        OrderPaymentEntity entity;
        if (existing.isPresent()) {
            entity = existing.get();
            if (!entity.apply(payment, eventTime, now)) {
                log.info("Ignoring stale statuses of payment {} from {}", payment.getPaymentId(), eventTime);
                return entity.toDomain();
            }
        } else {
            OrderPaymentEntity created = OrderPaymentEntity.fromDomain(payment, eventTime, now);
            repository.findByOrderId(payment.getOrderId()).stream()
                .max(Comparator.comparing(OrderPaymentEntity::getOrderStatusOccurredAt))
                .ifPresent(sibling -> created.adoptOrderStatus(
                    sibling.getOrderStatus(), sibling.getOrderStatusOccurredAt()));
            entity = created;
        }

        OrderPaymentEntity saved = repository.saveAndFlush(entity);
        int touched = repository.updateOrderStatus(
            payment.getOrderId(), payment.getOrderStatus(), eventTime, now);

        log.debug("Recorded payment {} of order {} ({} rows now {})",
                saved.getPaymentId(), payment.getOrderId(), touched, payment.getOrderStatus());
        return saved.toDomain();
    }
}
