package com.flagship.finance_automation.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka configuration for trigger events.
 *
 * Declares the track-changed topic consumed by the auto-saver. Listener
 * acknowledgement mode is set to manual in application.yml.
 */
@Configuration
@ConditionalOnProperty(name = "finance.auto-saver.kafka.enabled", havingValue = "true", matchIfMissing = true)
public class KafkaConfig {

    @Value("${finance.auto-saver.topic:media.track-changed}")
    private String trackChangedTopic;

    /**
     * Creates the track-changed topic if it doesn't exist.
     * A single partition keeps trigger events in order.
     */
    @Bean
    public NewTopic trackChangedTopic() {
        return TopicBuilder.name(trackChangedTopic)
                .partitions(1)
                .replicas(1)
                .build();
    }
}
