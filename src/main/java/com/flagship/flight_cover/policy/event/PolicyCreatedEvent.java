package com.flagship.flight_cover.policy.event;

import com.flagship.flight_cover.policy.Policy;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class PolicyCreatedEvent implements PolicyEvent {
    UUID eventId;
    Long policyId;
    String holder;
    String flightNumber;
    Instant occurredAt;

    public static final String EVENT_TYPE = "PolicyCreated";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static PolicyCreatedEvent fromPolicy(Policy policy, Instant occurredAt) {
        return new PolicyCreatedEvent(
            UUID.randomUUID(),
            policy.getId(),
            policy.getHolder(),
            policy.getFlightNumber(),
            occurredAt
        );
    }
}
