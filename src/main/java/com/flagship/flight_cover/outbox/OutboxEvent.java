package com.flagship.flight_cover.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * An event waiting in the outbox, or already handed to Kafka.
 *
 * Written in the same transaction as the change it describes and published
 * later by {@link OutboxPublisher}.
 */
@Value
public class OutboxEvent {

    public static final String POLICY_AGGREGATE = "Policy";

    UUID id;
    String aggregateType;      // "Policy"
    String aggregateId;        // policy id, also the Kafka key
    String eventType;          // e.g. "PayoutTriggered"
    String payload;            // JSON
    Instant createdAt;
    Instant publishedAt;       // null until published
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public static OutboxEvent forPolicy(Long policyId, String eventType, String payload, Instant createdAt) {
        return new OutboxEvent(
            UUID.randomUUID(),
            POLICY_AGGREGATE,
            policyId.toString(),
            eventType,
            payload,
            createdAt,
            null,
            0,
            null,
            null   // assigned by the database
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }
}
