package com.flagship.flight_cover.policy.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.flight_cover.policy.FlightStatus;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

@Value
@Builder
@Jacksonized
public class FlightStatusUpdateRequest {

    @NotNull(message = "Flight status is required")
    @JsonProperty("flight_status")
    FlightStatus flightStatus;

    @JsonProperty("actual_departure")
    Instant actualDeparture;
}
