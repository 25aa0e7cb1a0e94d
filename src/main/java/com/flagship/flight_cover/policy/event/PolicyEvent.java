package com.flagship.flight_cover.policy.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Common shape of the facts published about a policy.
 *
 * Events are written to the outbox in the same transaction as the change they
 * describe and keyed by policy id on the topic, so consumers see one policy's
 * events in order.
 */
public interface PolicyEvent {

    /**
     * Unique per event instance; consumers deduplicate on it.
     */
    UUID getEventId();

    Long getPolicyId();

    Instant getOccurredAt();

    String getEventType();
}
