package com.flagship.flight_cover.policy.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.flight_cover.policy.FlightStatus;
import com.flagship.flight_cover.policy.Policy;
import com.flagship.flight_cover.policy.PolicyStatus;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
@Jacksonized
public class PolicyResponse {

    @JsonProperty("id")
    Long id;

    @JsonProperty("holder")
    String holder;

    @JsonProperty("flight_number")
    String flightNumber;

    @JsonProperty("scheduled_departure")
    Instant scheduledDeparture;

    @JsonProperty("premium")
    BigDecimal premium;

    @JsonProperty("max_payout")
    BigDecimal maxPayout;

    @JsonProperty("status")
    PolicyStatus status;

    @JsonProperty("flight_status")
    FlightStatus flightStatus;

    @JsonProperty("actual_departure")
    Instant actualDeparture;

    @JsonProperty("delay_minutes")
    long delayMinutes;

    @JsonProperty("payout_processed")
    boolean payoutProcessed;

    @JsonProperty("payout_amount")
    BigDecimal payoutAmount;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static PolicyResponse from(Policy policy) {
        return PolicyResponse.builder()
            .id(policy.getId())
            .holder(policy.getHolder())
            .flightNumber(policy.getFlightNumber())
            .scheduledDeparture(policy.getScheduledDeparture())
            .premium(policy.getPremium())
            .maxPayout(policy.getMaxPayout())
            .status(policy.getStatus())
            .flightStatus(policy.getFlightStatus())
            .actualDeparture(policy.getActualDeparture())
            .delayMinutes(policy.getDelayMinutes())
            .payoutProcessed(policy.isPayoutProcessed())
            .payoutAmount(policy.getPayoutAmount())
            .createdAt(policy.getCreatedAt())
            .updatedAt(policy.getUpdatedAt())
            .build();
    }
}
