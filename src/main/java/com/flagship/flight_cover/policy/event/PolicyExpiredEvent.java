package com.flagship.flight_cover.policy.event;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class PolicyExpiredEvent implements PolicyEvent {
    UUID eventId;
    Long policyId;
    Instant occurredAt;

    public static final String EVENT_TYPE = "PolicyExpired";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static PolicyExpiredEvent of(Long policyId, Instant occurredAt) {
        return new PolicyExpiredEvent(UUID.randomUUID(), policyId, occurredAt);
    }
}
