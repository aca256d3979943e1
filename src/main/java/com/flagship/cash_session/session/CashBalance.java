package com.flagship.cash_session.session;

import com.flagship.cash_session.income.IncomeSnapshot;
import com.flagship.cash_session.money.CurrencyCode;
import com.flagship.cash_session.money.Money;
import com.flagship.cash_session.order.PaymentMethod;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Drawer reconciliation at closing time.
 *
 * <pre>
 * theoretical = opening + cash income - outcomes
 * delta       = declared - theoretical
 * </pre>
 *
 * Everything is expressed in the opening currency. Cash income is the
 * {@code point-of-sale} income taken by amount.
 */
@Value
public class CashBalance {
    Money cashOpening;
    Money cashIncome;
    Money totalOutcomes;
    Money theoretical;
    Money declared;
    Money delta;

    public static CashBalance compute(Money cashOpening,
                                      IncomeSnapshot incomes,
                                      List<SessionOutcome> outcomes,
                                      Money declared) {
        CurrencyCode currency = cashOpening.getCurrency();

        Money cashIncome = Money.of(
            incomes.amountFor(PaymentMethod.POINT_OF_SALE, currency).getAmount(), currency);
        Money totalOutcomes = Money.of(sumOutcomes(outcomes), currency);
        Money theoretical = cashOpening.plus(cashIncome).minus(totalOutcomes);
        Money delta = Money.of(declared.getAmount(), currency).minus(theoretical);

        return new CashBalance(cashOpening, cashIncome, totalOutcomes, theoretical, declared, delta);
    }

    static BigDecimal sumOutcomes(List<SessionOutcome> outcomes) {
        return outcomes.stream()
            .map(outcome -> outcome.getAmount().getAmount())
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    /**
     * True when the delta is strictly larger than the tolerance either way.
     */
    public boolean hasBalanceError(BigDecimal tolerance) {
        return delta.exceeds(tolerance);
    }
}
