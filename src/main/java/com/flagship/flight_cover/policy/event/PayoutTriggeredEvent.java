package com.flagship.flight_cover.policy.event;

import com.flagship.flight_cover.policy.Policy;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A payout was settled and disbursed. Published at most once per policy.
 */
@Value
public class PayoutTriggeredEvent implements PolicyEvent {
    UUID eventId;
    Long policyId;
    BigDecimal amount;
    String reason;
    Instant occurredAt;

    public static final String EVENT_TYPE = "PayoutTriggered";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static PayoutTriggeredEvent fromPolicy(Policy settled, Instant occurredAt) {
        return new PayoutTriggeredEvent(
            UUID.randomUUID(),
            settled.getId(),
            settled.getPayoutAmount(),
            settled.payoutReason(),
            occurredAt
        );
    }
}
