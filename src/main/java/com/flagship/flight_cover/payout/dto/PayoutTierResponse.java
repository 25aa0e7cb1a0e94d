package com.flagship.flight_cover.payout.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.flight_cover.payout.PayoutTier;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PayoutTierResponse {

    @JsonProperty("id")
    Long id;

    @JsonProperty("min_delay")
    long minDelay;

    @JsonProperty("max_delay")
    Long maxDelay;

    @JsonProperty("multiplier")
    int multiplier;

    public static PayoutTierResponse from(PayoutTier tier) {
        return PayoutTierResponse.builder()
            .id(tier.getId())
            .minDelay(tier.getMinDelay())
            .maxDelay(tier.getMaxDelay())
            .multiplier(tier.getMultiplier())
            .build();
    }
}
