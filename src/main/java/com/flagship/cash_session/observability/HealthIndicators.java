package com.flagship.cash_session.observability;

import com.flagship.cash_session.outbox.OutboxEventRepository;
import com.flagship.cash_session.session.store.PosSessionStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;
import org.springframework.stereotype.Component;

/**
 * Actuator health contributors.
 */
public class HealthIndicators {

    /**
     * Outbox backlog: WARNING from 1 000 waiting session events, DOWN from
     * 10 000. Dead-lettered events never reach the topic, so any of them
     * also turns the status to WARNING.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        static final long BACKLOG_WARNING_THRESHOLD = 1_000;
        static final long BACKLOG_CRITICAL_THRESHOLD = 10_000;
        private static final Status WARNING = new Status("WARNING");

        private final OutboxEventRepository outboxRepository;
        private final int maxRetries;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository,
                                     @Value("${outbox.publisher.max-retries:5}") int maxRetries) {
            this.outboxRepository = outboxRepository;
            this.maxRetries = maxRetries;
        }

        @Override
        public Health health() {
            try {
                long backlog = outboxRepository.countUnpublished();
                long deadLettered = outboxRepository.countDeadLettered(maxRetries);

                Status status = Status.UP;
                if (backlog >= BACKLOG_CRITICAL_THRESHOLD) {
                    status = Status.DOWN;
                } else if (backlog >= BACKLOG_WARNING_THRESHOLD || deadLettered > 0) {
                    status = WARNING;
                }

                return Health.status(status)
                        .withDetail("backlogSize", backlog)
                        .withDetail("deadLettered", deadLettered)
                        .build();
            } catch (RuntimeException e) {
                return Health.down(e).build();
            }
        }
    }

    /**
     * Reports the register's active session. Always up: having no open
     * session is a normal state outside business hours.
     */
    @Component("posSessionHealth")
    public static class PosSessionHealthIndicator implements HealthIndicator {

        private final PosSessionStore store;

        public PosSessionHealthIndicator(PosSessionStore store) {
            this.store = store;
        }

        @Override
        public Health health() {
            try {
                return store.findActive()
                        .map(session -> Health.up()
                                .withDetail("activeSessionId", session.getId())
                                .withDetail("openedAt", session.getOpening().getOpenedAt())
                                .withDetail("xTickets", session.getXTickets().size())
                                .build())
                        .orElseGet(() -> Health.up()
                                .withDetail("activeSessionId", "none")
                                .build());
            } catch (RuntimeException e) {
                return Health.down()
                        .withDetail("error", e.getMessage())
                        .build();
            }
        }
    }
}
