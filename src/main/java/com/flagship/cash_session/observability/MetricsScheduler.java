package com.flagship.cash_session.observability;

import com.flagship.cash_session.session.store.PosSessionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Refreshes the gauges that are read from the database: outbox backlog and
 * the currently open drawer.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MetricsScheduler {

    private final OutboxMetrics outboxMetrics;
    private final PosSessionMetrics sessionMetrics;
    private final PosSessionStore sessionStore;
    private final Clock clock;

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refresh() {
        outboxMetrics.refreshMetrics();
        try {
            sessionMetrics.refreshActiveSession(
                sessionStore.findActive().map(s -> s.getOpening().getOpenedAt()).orElse(null),
                clock.instant());
        } catch (RuntimeException e) {
            log.warn("Could not refresh active session gauges: {}", e.getMessage());
        }
    }
}
