package com.flagship.cash_session.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Topics owned or read by the service.
 *
 * {@code pos-sessions} is keyed by session id; one partition keeps every
 * session event in publication order, and there is a single register anyway.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.pos-sessions:pos-sessions}")
    private String posSessionsTopic;

    @Value("${kafka.topic.order-payments:order-payments}")
    private String orderPaymentsTopic;

    @Bean
    public NewTopic posSessionsTopic() {
        return TopicBuilder.name(posSessionsTopic)
                .partitions(1)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic orderPaymentsTopic() {
        return TopicBuilder.name(orderPaymentsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
