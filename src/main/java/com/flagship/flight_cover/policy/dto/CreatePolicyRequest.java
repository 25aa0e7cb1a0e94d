package com.flagship.flight_cover.policy.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Policy purchase. The holder is the calling identity, not part of the body.
 * Amount and schedule rules are checked by the lifecycle service so they
 * report their specific error codes.
 */
@Value
@Builder
@Jacksonized
public class CreatePolicyRequest {

    @NotBlank(message = "Flight number is required")
    @JsonProperty("flight_number")
    String flightNumber;

    @JsonProperty("scheduled_departure")
    Instant scheduledDeparture;

    @JsonProperty("premium")
    BigDecimal premium;

    @JsonProperty("max_payout")
    BigDecimal maxPayout;
}
