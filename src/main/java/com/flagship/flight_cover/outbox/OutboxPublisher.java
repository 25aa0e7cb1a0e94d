package com.flagship.flight_cover.outbox;

import com.flagship.flight_cover.observability.CorrelationContext;
import com.flagship.flight_cover.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Relays policy events from the outbox to the policies topic.
 *
 * Records are keyed by policy id and carry the event id and type as headers,
 * so indexers can route and de-duplicate without parsing the payload. Each send
 * is acknowledged before the next one starts. Once an event of a policy fails
 * or is dead-lettered, the rest of that policy's events in the batch wait for
 * the next poll, keeping per-policy order intact.
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    static final String EVENT_ID_HEADER = "event_id";
    static final String EVENT_TYPE_HEADER = "event_type";

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${kafka.topic.policies:policies}")
    private String policiesTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public void run() {
        boolean ownsContext = CorrelationContext.beginJob("outbox");
        try {
            publishPendingEvents();
        } finally {
            if (ownsContext) {
                CorrelationContext.clear();
            }
        }
    }

    /**
     * @return how many events were published in this run
     */
    public int publishPendingEvents() {
        int published = 0;
        try {
            List<OutboxEvent> events = outboxService.findUnpublishedEvents(batchSize);
            if (events.isEmpty()) {
                return 0;
            }

            Set<String> blockedPolicies = new HashSet<>();
            int heldBack = 0;
            for (OutboxEvent event : events) {
                if (blockedPolicies.contains(event.getAggregateId())) {
                    heldBack++;
                    continue;
                }
                if (publishEvent(event)) {
                    published++;
                } else {
                    blockedPolicies.add(event.getAggregateId());
                }
            }

            if (!blockedPolicies.isEmpty()) {
                outboxMetrics.recordEventsHeldBack(heldBack);
                log.info("Outbox run: fetched={}, published={}, blockedPolicies={}, heldBack={}",
                        events.size(), published, blockedPolicies.size(), heldBack);
            }
        } catch (Exception e) {
            log.error("Outbox polling failed", e);
        }
        return published;
    }

    private boolean publishEvent(OutboxEvent event) {
        if (event.getRetryCount() >= maxRetries) {
            log.warn("Dead-lettered event holds back policy {}: eventId={}, eventType={}, retries={}",
                    event.getAggregateId(), event.getId(), event.getEventType(), event.getRetryCount());
            outboxMetrics.recordEventDeadLettered(event.getEventType());
            return false;
        }

        try {
            SendResult<String, String> result = kafkaTemplate.send(toRecord(event)).get();

            log.debug("Published {} for policy {}: partition={}, offset={}",
                    event.getEventType(),
                    event.getAggregateId(),
                    result.getRecordMetadata().partition(),
                    result.getRecordMetadata().offset());

            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType());
            return true;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while publishing event {}", event.getId());
            outboxService.markFailed(event.getId(), "interrupted");
            return false;
        } catch (Exception e) {
            log.error("Publishing {} for policy {} failed (attempt {}): {}",
                    event.getEventType(), event.getAggregateId(), event.getRetryCount() + 1, e.getMessage());
            outboxService.markFailed(event.getId(), e.getMessage());
            outboxMetrics.recordEventPublishFailed(event.getEventType());
            return false;
        }
    }

    ProducerRecord<String, String> toRecord(OutboxEvent event) {
        ProducerRecord<String, String> record =
                new ProducerRecord<>(policiesTopic, event.getAggregateId(), event.getPayload());
        record.headers()
                .add(EVENT_ID_HEADER, event.getId().toString().getBytes(StandardCharsets.UTF_8))
                .add(EVENT_TYPE_HEADER, event.getEventType().getBytes(StandardCharsets.UTF_8));
        return record;
    }
}
