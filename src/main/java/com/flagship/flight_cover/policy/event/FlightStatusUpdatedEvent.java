package com.flagship.flight_cover.policy.event;

import com.flagship.flight_cover.policy.Policy;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A flight status report was recorded against a policy.
 *
 * delayMinutes is the stored delay after the report, so it may be larger than
 * what this report alone implies.
 */
@Value
public class FlightStatusUpdatedEvent implements PolicyEvent {
    UUID eventId;
    Long policyId;
    String flightStatus;
    long delayMinutes;
    Instant occurredAt;

    public static final String EVENT_TYPE = "FlightStatusUpdated";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static FlightStatusUpdatedEvent fromPolicy(Policy policy, Instant occurredAt) {
        return new FlightStatusUpdatedEvent(
            UUID.randomUUID(),
            policy.getId(),
            policy.getFlightStatus().name(),
            policy.getDelayMinutes(),
            occurredAt
        );
    }
}
