package com.flagship.cash_session.consumer;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * An order event that a consumer group has already dealt with, either by
 * applying it to the payment projection or by deciding to ignore it.
 */
@Value
public class ProcessedEvent {
    UUID eventId;
    String consumerGroup;
    String eventType;
    UUID orderId;
    Instant processedAt;
    Outcome outcome;
    String note;

    public enum Outcome {
        APPLIED,
        IGNORED
    }

    static ProcessedEvent applied(UUID eventId, String consumerGroup, String eventType,
                                  UUID orderId, Instant processedAt) {
        return new ProcessedEvent(eventId, consumerGroup, eventType, orderId,
            processedAt, Outcome.APPLIED, null);
    }

    static ProcessedEvent ignored(UUID eventId, String consumerGroup, String eventType,
                                  UUID orderId, Instant processedAt, String reason) {
        return new ProcessedEvent(eventId, consumerGroup, eventType, orderId,
            processedAt, Outcome.IGNORED, reason);
    }
}
