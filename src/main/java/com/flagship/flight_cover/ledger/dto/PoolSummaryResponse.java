package com.flagship.flight_cover.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.flight_cover.ledger.LedgerTotals;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class PoolSummaryResponse {

    @JsonProperty("balance")
    BigDecimal balance;

    @JsonProperty("premiums_collected")
    BigDecimal premiumsCollected;

    @JsonProperty("payouts_processed")
    BigDecimal payoutsProcessed;

    public static PoolSummaryResponse of(BigDecimal balance, LedgerTotals totals) {
        return PoolSummaryResponse.builder()
            .balance(balance)
            .premiumsCollected(totals.getPremiumsCollected())
            .payoutsProcessed(totals.getPayoutsProcessed())
            .build();
    }
}
