package com.flagship.cash_session.consumer;

import com.flagship.cash_session.order.JpaPaymentSource;
import com.flagship.cash_session.order.OrderPayment;
import com.flagship.cash_session.order.event.OrderPaymentRecordedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Applies order-payment events to the local projection read by the income
 * aggregator. Deduplication is done by {@link IdempotentEventProcessor}
 * before this is called.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OrderPaymentEventHandler {

    private final JpaPaymentSource paymentSource;

    public void onOrderPaymentRecorded(OrderPaymentRecordedEvent event) {
        OrderPayment payment = event.toDomain();

        log.info("Recording payment {} of order {}: {} {} {}, order {}",
                payment.getPaymentId(),
                payment.getOrderId(),
                payment.getMethod().getTag(),
                payment.getAmount(),
                payment.getStatus(),
                payment.getOrderStatus());

        paymentSource.record(payment, event.getOccurredAt());
    }
}
