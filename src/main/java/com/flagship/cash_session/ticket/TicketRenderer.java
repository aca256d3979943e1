package com.flagship.cash_session.ticket;

import com.flagship.cash_session.config.PosSessionProperties;
import com.flagship.cash_session.income.IncomeSnapshot;
import com.flagship.cash_session.money.CurrencyCode;
import com.flagship.cash_session.money.Money;
import com.flagship.cash_session.order.PaymentMethod;
import com.flagship.cash_session.session.ActivePosSession;
import com.flagship.cash_session.session.ClosedPosSession;
import com.flagship.cash_session.session.SessionClosing;
import com.flagship.cash_session.session.SessionIncome;
import com.flagship.cash_session.session.SessionOpening;
import com.flagship.cash_session.session.SessionOperator;
import com.flagship.cash_session.session.SessionOutcome;
import com.flagship.cash_session.session.XTicketEntry;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders the X ticket (interim, session open) and the Z ticket (final,
 * session closed) as plain text.
 *
 * Output depends only on the arguments and configuration: rendering the same
 * session twice gives the same text. Lines are joined with {@code \n} and the
 * text has no trailing newline.
 */
@Component
public class TicketRenderer {

    private static final String ITEM = "  - ";

    private final PosSessionProperties properties;
    private final DateTimeFormatter timeFormat;

    public TicketRenderer(PosSessionProperties properties) {
        this.properties = properties;
        this.timeFormat = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss")
            .withZone(properties.getTicket().getZoneId());
    }

    public String renderZTicket(ClosedPosSession session) {
        SessionOpening opening = session.getOpening();
        SessionClosing closing = session.getClosing();
        List<SessionIncome> incomes = session.getDailyIncomes();
        List<SessionOutcome> outcomes = session.getDailyOutcomes();

        // totals are tagged with the first income's currency, not converted
        CurrencyCode currency = incomes.isEmpty()
            ? opening.getCashOpening().getCurrency()
            : incomes.get(0).getAmount().getCurrency();
        BigDecimal totalIncome = sum(incomes.stream().map(SessionIncome::getAmount).toList());
        BigDecimal totalOutcome = sum(outcomes.stream().map(SessionOutcome::getAmount).toList());
        BigDecimal cashIncome = incomes.stream()
            .filter(income -> income.getPaymentMethod() == PaymentMethod.POINT_OF_SALE)
            .map(income -> income.getAmount().getAmount())
            .findFirst()
            .orElse(BigDecimal.ZERO);

        List<String> lines = new ArrayList<>();
        lines.add(properties.getBrandName() + " Z ticket");
        lines.add("Opening time : " + time(opening.getOpenedAt()) + " by " + operator(opening.getOpenedBy()));
        lines.add("Closing time : " + time(closing.getClosedAt()) + " by " + operator(closing.getClosedBy()));
        if (closing.hasBalanceError(properties.getCashTolerance())) {
            lines.add("Daily Z includes cash balance error");
        }
        lines.add("");

        lines.add("Daily incomes :");
        addItems(lines, incomes.stream()
            .map(income -> item(income.getPaymentMethod().getTag(), income.getAmount()))
            .toList());
        lines.add("Daily incomes total :");
        lines.add(ITEM + amount(totalIncome) + " " + currency);
        lines.add("");

        lines.add("Daily outcomes :");
        addItems(lines, outcomes.stream()
            .map(outcome -> item(outcome.getCategory(), outcome.getAmount()))
            .toList());
        lines.add("Daily outcomes total :");
        lines.add(ITEM + amount(totalOutcome) + " " + currency);
        lines.add("");

        lines.add("Daily delta : " + signed(totalIncome.subtract(totalOutcome)) + " " + currency);
        lines.add("");

        lines.add("Cash balance :");
        lines.add(ITEM + "Initial cash at opening : " + opening.getCashOpening());
        lines.add(ITEM + "Daily cash incomes : " + amount(cashIncome) + " " + currency);
        lines.add(ITEM + "Daily cash outcomes : " + amount(totalOutcome) + " " + currency);
        lines.add(ITEM + "Remaining cash at daily closing : " + closing.getCashClosing());
        lines.add(ITEM + "Theorical remaining cash at daily closing : " + closing.getCashClosingTheoretical());
        lines.add("Cash delta : " + signed(closing.getCashDelta().getAmount()) + " " + closing.getCashDelta().getCurrency());
        if (closing.hasJustification()) {
            lines.add(ITEM + "Motive : " + closing.getJustification());
        }

        return String.join("\n", lines);
    }

    /**
     * @param incomes income of the session so far
     * @param entry   the log entry written for this print, giving its time and operator
     */
    public String renderXTicket(ActivePosSession session, IncomeSnapshot incomes, XTicketEntry entry) {
        SessionOpening opening = session.getOpening();

        List<String> lines = new ArrayList<>();
        lines.add(properties.getBrandName() + " X ticket");
        lines.add("Opening time : " + time(opening.getOpenedAt()) + " by " + operator(opening.getOpenedBy()));
        lines.add("X ticket current time : " + time(entry.getGeneratedAt()) + " by " + operator(entry.getGeneratedBy()));
        lines.add("");

        lines.add("Daily incomes so far :");
        addItems(lines, incomes.toIncomes().stream()
            .map(income -> item(income.getPaymentMethod().getTag(), income.getAmount()))
            .toList());
        lines.add("Daily incomes total so far :");
        lines.add(ITEM + amount(incomes.totalAmount()) + " " + opening.getCashOpening().getCurrency());

        return String.join("\n", lines);
    }

    // An empty section still takes one (blank) line.
    private static void addItems(List<String> lines, List<String> items) {
        if (items.isEmpty()) {
            lines.add("");
        } else {
            lines.addAll(items);
        }
    }

    private static String item(String label, Money money) {
        return ITEM + label + " : " + money;
    }

    private String time(Instant instant) {
        return timeFormat.format(instant);
    }

    private static String operator(SessionOperator operator) {
        return operator.displayName();
    }

    private static BigDecimal sum(List<Money> amounts) {
        return amounts.stream()
            .map(Money::getAmount)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private static String amount(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }

    private static String signed(BigDecimal value) {
        BigDecimal rounded = value.setScale(2, RoundingMode.HALF_UP);
        return (rounded.signum() >= 0 ? "+" : "") + rounded.toPlainString();
    }
}
