package com.flagship.flight_cover.payout.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class AddTierRequest {

    @NotNull(message = "Minimum delay is required")
    @JsonProperty("min_delay")
    Long minDelay;

    @JsonProperty("max_delay")
    Long maxDelay;

    @NotNull(message = "Multiplier is required")
    @JsonProperty("multiplier")
    Integer multiplier;
}
