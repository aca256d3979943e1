package com.flagship.cash_session.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Session event waiting in the outbox, or already handed to Kafka.
 *
 * {@code publishedAt} is null until the publisher has sent it;
 * {@code sequenceNumber} is assigned by the database on insert.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;
    UUID aggregateId;
    String eventType;
    String payload;
    Instant createdAt;
    Instant publishedAt;
    int retryCount;
    String lastError;
    Long sequenceNumber;

    static OutboxEvent pending(String aggregateType, UUID aggregateId, String eventType,
                               String payload, Instant createdAt) {
        return new OutboxEvent(UUID.randomUUID(), aggregateType, aggregateId, eventType,
            payload, createdAt, null, 0, null, null);
    }

    /**
     * Kafka record key. All events of a session land on one partition.
     */
    public String partitionKey() {
        return aggregateId.toString();
    }

    public boolean isPublished() {
        return publishedAt != null;
    }

    public boolean isDeadLettered(int maxRetries) {
        return retryCount >= maxRetries;
    }
}
