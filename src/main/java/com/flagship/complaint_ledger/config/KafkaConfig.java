package com.flagship.complaint_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka configuration for the change feed.
 *
 * The feed topic is normally owned by the CDC connector. For local runs it
 * can be created here (feed.topic.create=true).
 */
@Configuration
public class KafkaConfig {

    @Value("${feed.topic:complaints.changes}")
    private String feedTopic;

    /**
     * Single partition: events for one complaint must stay in order.
     */
    @Bean
    @ConditionalOnProperty(name = "feed.topic.create", havingValue = "true")
    public NewTopic complaintChangesTopic() {
        return TopicBuilder.name(feedTopic)
                .partitions(1)
                .replicas(1)
                .build();
    }
}
