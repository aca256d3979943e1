package com.flagship.cash_session.consumer;

import com.flagship.cash_session.config.JacksonConfig;
import com.flagship.cash_session.order.event.OrderPaymentRecordedEvent;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.kafka.support.Acknowledgment;

import java.math.BigDecimal;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class OrderPaymentEventConsumerTest {

    private IdempotentEventProcessor eventProcessor;
    private OrderPaymentEventHandler eventHandler;
    private Acknowledgment ack;
    private OrderPaymentEventConsumer consumer;

    @BeforeEach
    void setUp() {
        eventProcessor = mock(IdempotentEventProcessor.class);
        eventHandler = mock(OrderPaymentEventHandler.class);
        ack = mock(Acknowledgment.class);
        consumer = new OrderPaymentEventConsumer(eventProcessor, eventHandler, new JacksonConfig().objectMapper());
    }

    private static ConsumerRecord<String, String> record(String value) {
        return new ConsumerRecord<>("order-payments", 0, 42L, "key", value);
    }

    private static String paymentRecorded(UUID eventId, UUID orderId) {
        return """
            {
              "eventId": "%s",
              "eventType": "OrderPaymentRecorded",
              "orderId": "%s",
              "orderCreatedAt": "2024-03-01T09:00:00Z",
              "orderStatus": "PAID",
              "paymentId": "%s",
              "method": "point-of-sale",
              "amount": 12.50,
              "currency": "EUR",
              "paymentStatus": "PAID",
              "occurredAt": "2024-03-01T09:00:05Z"
            }""".formatted(eventId, orderId, UUID.randomUUID());
    }

    @Test
    @DisplayName("A payment event is handed to the handler through the idempotent processor, then acknowledged")
    void testProcessesPaymentEvent() {
        UUID eventId = UUID.randomUUID();
        UUID orderId = UUID.randomUUID();
        when(eventProcessor.processEvent(any(), anyString(), any(), anyString(), any()))
            .thenAnswer(invocation -> {
                invocation.<Runnable>getArgument(4).run();
                return true;
            });

        consumer.consume(record(paymentRecorded(eventId, orderId)), ack);

        verify(eventProcessor).processEvent(eq(eventId), eq(OrderPaymentRecordedEvent.EVENT_TYPE),
            eq(orderId), eq(OrderPaymentEventConsumer.CONSUMER_GROUP), any());
        ArgumentCaptor<OrderPaymentRecordedEvent> captor = ArgumentCaptor.forClass(OrderPaymentRecordedEvent.class);
        verify(eventHandler).onOrderPaymentRecorded(captor.capture());
        assertEquals(0, captor.getValue().getAmount().compareTo(new BigDecimal("12.50")));
        assertEquals("point-of-sale", captor.getValue().getMethod());
        verify(ack).acknowledge();
    }

    @Test
    @DisplayName("A duplicate is acknowledged without calling the handler")
    void testDuplicateIsAcknowledged() {
        when(eventProcessor.processEvent(any(), anyString(), any(), anyString(), any()))
            .thenReturn(false);

        consumer.consume(record(paymentRecorded(UUID.randomUUID(), UUID.randomUUID())), ack);

        verifyNoInteractions(eventHandler);
        verify(ack).acknowledge();
    }

    @Test
    @DisplayName("An unparsable record is acknowledged and dropped")
    void testUnparsableRecord() {
        consumer.consume(record("not json"), ack);

        verifyNoInteractions(eventProcessor, eventHandler);
        verify(ack).acknowledge();
    }

    @Test
    @DisplayName("An unknown event type is recorded as ignored")
    void testUnknownEventType() {
        UUID eventId = UUID.randomUUID();
        UUID orderId = UUID.randomUUID();
        String value = """
            {"eventId": "%s", "eventType": "OrderShipped", "orderId": "%s"}""".formatted(eventId, orderId);

        consumer.consume(record(value), ack);

        verify(eventProcessor).ignoreEvent(eq(eventId), eq("OrderShipped"), eq(orderId),
            eq(OrderPaymentEventConsumer.CONSUMER_GROUP), anyString());
        verifyNoInteractions(eventHandler);
        verify(ack).acknowledge();
    }

    @Test
    @DisplayName("A handler failure propagates and the record is not acknowledged")
    void testHandlerFailureIsNotAcknowledged() {
        when(eventProcessor.processEvent(any(), anyString(), any(), anyString(), any()))
            .thenThrow(new IllegalStateException("database down"));

        assertThrows(IllegalStateException.class,
            () -> consumer.consume(record(paymentRecorded(UUID.randomUUID(), UUID.randomUUID())), ack));

        verify(ack, never()).acknowledge();
    }
}
