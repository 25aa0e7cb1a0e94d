package com.flagship.flight_cover.policy.event;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class PolicyCancelledEvent implements PolicyEvent {
    UUID eventId;
    Long policyId;
    BigDecimal refundAmount;
    Instant occurredAt;

    public static final String EVENT_TYPE = "PolicyCancelled";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static PolicyCancelledEvent of(Long policyId, BigDecimal refundAmount, Instant occurredAt) {
        return new PolicyCancelledEvent(UUID.randomUUID(), policyId, refundAmount, occurredAt);
    }
}
