package com.flagship.token_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topic for transfer notifications. Only active when Kafka notifications are enabled.
 */
@Configuration
@ConditionalOnProperty(name = "ledger.notifications.kafka.enabled", havingValue = "true")
public class KafkaConfig {

    @Value("${kafka.topic.transfers:token-transfers}")
    private String transfersTopic;

    @Value("${kafka.topic.transfers-partitions:3}")
    private int partitions;

    @Bean
    public NewTopic transfersTopic() {
        return TopicBuilder.name(transfersTopic)
                .partitions(partitions)
                .replicas(1)
                .build();
    }
}
