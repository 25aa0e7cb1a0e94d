package com.flagship.flight_cover.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.config.TopicConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.kafka.DefaultKafkaProducerFactoryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;

/**
 * The policies topic that external indexers consume.
 *
 * Events are keyed by policy id so one policy's history lands on one
 * partition. The topic keeps events indefinitely: an indexer rebuilding its
 * view replays from offset zero. The producer is idempotent so a retried send
 * cannot reorder or duplicate records within a partition.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.policies:policies}")
    private String policiesTopic;

    @Value("${kafka.topic.partitions:3}")
    private int partitions;

    @Value("${kafka.topic.replicas:1}")
    private short replicas;

    @Bean
    public NewTopic policiesTopic() {
        return new NewTopic(policiesTopic, partitions, replicas)
            .configs(Map.of(
                TopicConfig.RETENTION_MS_CONFIG, "-1",
                TopicConfig.CLEANUP_POLICY_CONFIG, TopicConfig.CLEANUP_POLICY_DELETE));
    }

    @Bean
    public DefaultKafkaProducerFactoryCustomizer policyEventProducerCustomizer() {
        return producerFactory -> producerFactory.updateConfigs(Map.of(
            ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true,
            ProducerConfig.MAX_IN_FLIGHT_REQUESTS_PER_CONNECTION, 1));
    }
}
