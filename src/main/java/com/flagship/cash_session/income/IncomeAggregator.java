package com.flagship.cash_session.income;

import com.flagship.cash_session.money.Money;
import com.flagship.cash_session.order.OrderPayment;
import com.flagship.cash_session.order.PaymentMethod;
import com.flagship.cash_session.order.PaymentSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Sums paid payments per payment method since a session opened.
 *
 * Always recomputed from the payment source; nothing is accumulated between
 * calls. Within a method the first payment's currency tags the whole group,
 * later payments are added by amount only.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class IncomeAggregator {

    private final PaymentSource paymentSource;

    public IncomeSnapshot aggregate(Instant openedAt) {
        List<OrderPayment> payments = paymentSource.findPaidSince(openedAt);

        Map<PaymentMethod, Money> byMethod = new LinkedHashMap<>();
        for (OrderPayment payment : payments) {
            // the source already filters, but a stale or loose adapter must not leak amounts
            if (!payment.isPaid() || !payment.isOrderedSince(openedAt)) {
                continue;
            }
            byMethod.merge(payment.getMethod(), payment.getAmount(), IncomeAggregator::addAmount);
        }

        log.debug("Aggregated {} payments into {} methods since {}", payments.size(), byMethod.size(), openedAt);
        return IncomeSnapshot.of(byMethod);
    }

    private static Money addAmount(Money group, Money payment) {
        return Money.of(group.getAmount().add(payment.getAmount()), group.getCurrency());
    }
}
