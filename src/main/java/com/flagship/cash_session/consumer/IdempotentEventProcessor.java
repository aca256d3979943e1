package com.flagship.cash_session.consumer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.UUID;

/**
 * Applies each order event at most once per consumer group.
 *
 * The projection update and the processed-event row commit together. When
 * the handler throws, nothing is recorded and the exception reaches the
 * listener, which leaves the offset uncommitted.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdempotentEventProcessor {

    private final ProcessedEventRepository repository;
    private final Clock clock;

    /**
     * @return true if the handler ran, false for a redelivered event
     */
    @Transactional
    public boolean processEvent(UUID eventId, String eventType, UUID orderId,
                                String consumerGroup, Runnable handler) {
        if (repository.existsByEventIdAndConsumerGroup(eventId, consumerGroup)) {
            log.info("Order event {} ({}) already handled by {}", eventId, eventType, consumerGroup);
            return false;
        }

        handler.run();

        repository.save(ProcessedEventEntity.of(ProcessedEvent.applied(
            eventId, consumerGroup, eventType, orderId, clock.instant())));
        log.debug("Applied order event {} for order {}", eventId, orderId);
        return true;
    }

    /**
     * Records an event this consumer has no use for, so a replay of the
     * topic does not look at it again.
     */
    @Transactional
    public void ignoreEvent(UUID eventId, String eventType, UUID orderId,
                            String consumerGroup, String reason) {
        if (repository.existsByEventIdAndConsumerGroup(eventId, consumerGroup)) {
            return;
        }

        repository.save(ProcessedEventEntity.of(ProcessedEvent.ignored(
            eventId, consumerGroup, eventType, orderId, clock.instant(), reason)));
        log.debug("Ignored order event {} ({}): {}", eventId, eventType, reason);
    }
}
