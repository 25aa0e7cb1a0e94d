package com.flagship.flight_cover.observability;

import com.flagship.flight_cover.ledger.PoolLedgerService;
import com.flagship.flight_cover.outbox.OutboxService;
import com.flagship.flight_cover.policy.PolicyPersistenceService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;

/**
 * Actuator health indicators for the cover ledger.
 */
public class HealthIndicators {

    /**
     * Unhealthy when too many events wait for publication. Any dead-lettered
     * event is at least a WARNING, since it stalls its policy's feed.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private static final long BACKLOG_WARNING_THRESHOLD = 1000;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 10000;
        private static final int STALLED_POLICIES_SHOWN = 20;

        private final OutboxService outboxService;
        private final int maxRetries;

        public OutboxHealthIndicator(OutboxService outboxService,
                                     @Value("${outbox.publisher.max-retries:5}") int maxRetries) {
            this.outboxService = outboxService;
            this.maxRetries = maxRetries;
        }

        @Override
        public Health health() {
            try {
                long backlogSize = outboxService.countUnpublished();
                List<Long> stalledPolicies = outboxService.findStalledPolicyIds(maxRetries, STALLED_POLICIES_SHOWN);

                Health.Builder builder;
                if (backlogSize >= BACKLOG_CRITICAL_THRESHOLD) {
                    builder = Health.down();
                } else if (backlogSize >= BACKLOG_WARNING_THRESHOLD || !stalledPolicies.isEmpty()) {
                    builder = Health.status("WARNING");
                } else {
                    builder = Health.up();
                }

                return builder
                        .withDetail("backlogSize", backlogSize)
                        .withDetail("stalledPolicies", stalledPolicies)
                        .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                        .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                        .build();
            } catch (Exception e) {
                return Health.down().withDetail("error", e.getMessage()).build();
            }
        }
    }

    /**
     * Compares the pooled balance with the worst-case liability of the open
     * policies. An under-funded pool still serves traffic, so this reports
     * WARNING rather than DOWN.
     */
    @Component("poolSolvencyHealth")
    public static class PoolSolvencyHealthIndicator implements HealthIndicator {

        private final PoolLedgerService poolLedger;
        private final PolicyPersistenceService policyPersistence;

        public PoolSolvencyHealthIndicator(PoolLedgerService poolLedger,
                                           PolicyPersistenceService policyPersistence) {
            this.poolLedger = poolLedger;
            this.policyPersistence = policyPersistence;
        }

        @Override
        public Health health() {
            try {
                BigDecimal balance = poolLedger.getBalance();
                BigDecimal exposure = policyPersistence.activeExposure();

                Health.Builder builder = balance.compareTo(exposure) >= 0
                        ? Health.up()
                        : Health.status("WARNING");

                return builder
                        .withDetail("balance", balance)
                        .withDetail("activeExposure", exposure)
                        .build();
            } catch (Exception e) {
                return Health.down().withDetail("error", e.getMessage()).build();
            }
        }
    }

    /**
     * Redis only backs the idempotency fast path, so an outage degrades
     * lookups to the database instead of taking the service down.
     */
    @Component("redisHealth")
    public static class RedisHealthIndicator implements HealthIndicator {

        private final StringRedisTemplate redisTemplate;

        public RedisHealthIndicator(StringRedisTemplate redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            var connectionFactory = redisTemplate.getConnectionFactory();
            if (connectionFactory == null) {
                return degraded("No connection factory configured");
            }
            try (RedisConnection connection = connectionFactory.getConnection()) {
                String response = connection.ping();
                return "PONG".equals(response)
                        ? Health.up().withDetail("response", response).build()
                        : degraded("Unexpected ping response: " + response);
            } catch (Exception e) {
                return degraded(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            }
        }

        private Health degraded(String error) {
            return Health.status("DEGRADED")
                    .withDetail("error", error)
                    .withDetail("note", "Idempotency lookups fall back to the database")
                    .build();
        }
    }

    @Component("kafkaHealth")
    public static class KafkaHealthIndicator implements HealthIndicator {

        private final KafkaTemplate<String, String> kafkaTemplate;

        public KafkaHealthIndicator(KafkaTemplate<String, String> kafkaTemplate) {
            this.kafkaTemplate = kafkaTemplate;
        }

        @Override
        public Health health() {
            try {
                var metrics = kafkaTemplate.metrics();
                return metrics != null && !metrics.isEmpty()
                        ? Health.up().withDetail("metricsCount", metrics.size()).build()
                        : Health.down().withDetail("error", "No Kafka producer connections").build();
            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .build();
            }
        }
    }
}
