package com.flagship.cash_session.observability;

import com.flagship.cash_session.money.Money;
import com.flagship.cash_session.session.exception.ErrorKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer meters for the session lifecycle.
 *
 * <ul>
 *   <li>{@code pos.sessions.opened} / {@code pos.sessions.closed{balance}}</li>
 *   <li>{@code pos.sessions.rejected{operation,kind}}: business rejections</li>
 *   <li>{@code pos.sessions.opening_mismatch}: opening float differing from the previous closing count</li>
 *   <li>{@code pos.x_tickets.generated}</li>
 *   <li>{@code pos.cash.delta.abs}: absolute closing delta</li>
 *   <li>{@code pos.session.latency{operation}}</li>
 *   <li>{@code pos.sessions.active} and {@code pos.sessions.active.age.seconds}: gauges refreshed by
 *       {@link MetricsScheduler}</li>
 * </ul>
 */
@Component
public class PosSessionMetrics {

    private final MeterRegistry registry;

    private final Counter sessionsOpened;
    private final Counter xTicketsGenerated;
    private final Counter openingMismatches;
    private final DistributionSummary cashDelta;

    private final AtomicLong activeSessions = new AtomicLong();
    private final AtomicLong activeSessionAgeSeconds = new AtomicLong();

    public PosSessionMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.sessionsOpened = Counter.builder("pos.sessions.opened")
                .description("Number of POS sessions opened")
                .register(registry);

        this.xTicketsGenerated = Counter.builder("pos.x_tickets.generated")
                .description("Number of X tickets printed")
                .register(registry);

        this.openingMismatches = Counter.builder("pos.sessions.opening_mismatch")
                .description("Openings whose float differs from the previous closing count")
                .register(registry);

        this.cashDelta = DistributionSummary.builder("pos.cash.delta.abs")
                .description("Absolute difference between counted and theoretical cash at closing")
                .register(registry);

        registry.gauge("pos.sessions.active", activeSessions);
        registry.gauge("pos.sessions.active.age.seconds", activeSessionAgeSeconds);
    }

    /**
     * @param openedAt opening time of the active session, null when the drawer is closed
     */
    public void refreshActiveSession(Instant openedAt, Instant now) {
        if (openedAt == null) {
            activeSessions.set(0);
            activeSessionAgeSeconds.set(0);
            return;
        }
        activeSessions.set(1);
        activeSessionAgeSeconds.set(Math.max(0, Duration.between(openedAt, now).getSeconds()));
    }

    public void recordOpened() {
        sessionsOpened.increment();
    }

    public void recordClosed(boolean balanceError, Money delta) {
        registry.counter("pos.sessions.closed",
                "balance", balanceError ? "error" : "ok",
                "currency", delta.getCurrency().name()
        ).increment();
        cashDelta.record(delta.getAmount().abs().doubleValue());
    }

    public void recordXTicket() {
        xTicketsGenerated.increment();
    }

    public void recordOpeningMismatch() {
        openingMismatches.increment();
    }

    public void recordRejected(String operation, ErrorKind kind) {
        registry.counter("pos.sessions.rejected",
                "operation", operation,
                "kind", kind.name().toLowerCase()
        ).increment();
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("pos.session.latency", "operation", operation)
                .record(Duration.ofMillis(durationMs));
    }
}
