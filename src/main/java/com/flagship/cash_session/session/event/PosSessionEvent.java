package com.flagship.cash_session.session.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Facts published about a POS session on the {@code pos-sessions} topic.
 */
public interface PosSessionEvent {

    /**
     * Unique per event, for consumer-side deduplication.
     */
    UUID getEventId();

    UUID getSessionId();

    Instant getOccurredAt();

    String getEventType();
}
