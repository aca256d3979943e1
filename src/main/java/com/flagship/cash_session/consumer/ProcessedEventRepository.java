package com.flagship.cash_session.consumer;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface ProcessedEventRepository extends JpaRepository<ProcessedEventEntity, ProcessedEventEntity.Key> {

    boolean existsByEventIdAndConsumerGroup(UUID eventId, String consumerGroup);

    /**
     * Every event seen for one order, in the order it was handled.
     */
    List<ProcessedEventEntity> findByOrderIdOrderByProcessedAtAsc(UUID orderId);

    long countByConsumerGroup(String consumerGroup);

    long countByConsumerGroupAndOutcome(String consumerGroup, ProcessedEvent.Outcome outcome);
}
