package com.flagship.cash_session.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.cash_session.observability.CorrelationContext;
import com.flagship.cash_session.order.event.OrderPaymentRecordedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Kafka consumer for order-payment events coming from order management.
 *
 * Offsets are acknowledged manually, only after the event has been applied
 * (or recognised as a duplicate). Records that cannot be parsed are
 * acknowledged and dropped; handler failures propagate so the record is
 * redelivered.
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OrderPaymentEventConsumer {

    static final String CONSUMER_GROUP = "order-payment-projection";

    private final IdempotentEventProcessor eventProcessor;
    private final OrderPaymentEventHandler eventHandler;
    private final ObjectMapper objectMapper;

    @KafkaListener(
        topics = "${kafka.topic.order-payments:order-payments}",
        groupId = "${spring.kafka.consumer.group-id:cash-session-consumers}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        log.debug("Received message: topic={}, partition={}, offset={}, key={}",
                record.topic(), record.partition(), record.offset(), record.key());

        EventEnvelope envelope = parseEnvelope(record.value());
        if (envelope == null) {
            log.warn("Could not parse event at offset {}, acknowledging to skip", record.offset());
            ack.acknowledge();
            return;
        }

        CorrelationContext.putOrderId(envelope.orderId());
        try {
            boolean processed = route(envelope, record.value());
            ack.acknowledge();

            if (processed) {
                log.info("Processed event: type={}, eventId={}", envelope.eventType(), envelope.eventId());
            }
        } catch (RuntimeException e) {
            log.error("Error processing message at offset {}: {}", record.offset(), e.getMessage(), e);
            throw e;
        } finally {
            MDC.remove(CorrelationContext.ORDER_ID_MDC_KEY);
        }
    }

    private boolean route(EventEnvelope envelope, String rawPayload) {
        if (OrderPaymentRecordedEvent.EVENT_TYPE.equals(envelope.eventType())) {
            return eventProcessor.processEvent(
                envelope.eventId(), envelope.eventType(), envelope.orderId(), CONSUMER_GROUP,
                () -> eventHandler.onOrderPaymentRecorded(
                    deserialize(rawPayload, OrderPaymentRecordedEvent.class))
            );
        }

        log.debug("Unknown event type: {}, skipping", envelope.eventType());
        eventProcessor.ignoreEvent(
            envelope.eventId(), envelope.eventType(), envelope.orderId(),
            CONSUMER_GROUP, "Unknown event type");
        return false;
    }

    private EventEnvelope parseEnvelope(String json) {
        try {
            JsonNode node = objectMapper.readTree(json);
            UUID eventId = UUID.fromString(node.get("eventId").asText());
            UUID orderId = UUID.fromString(node.get("orderId").asText());
            String eventType = node.has("eventType")
                ? node.get("eventType").asText()
                : "Unknown";
            return new EventEnvelope(eventId, orderId, eventType);
        } catch (JsonProcessingException | RuntimeException e) {
            log.error("Failed to parse event envelope: {}", e.getMessage());
            return null;
        }
    }

    private <T> T deserialize(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to deserialize event: " + e.getMessage(), e);
        }
    }

    private record EventEnvelope(UUID eventId, UUID orderId, String eventType) {}
}
