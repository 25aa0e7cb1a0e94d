package com.flagship.flight_cover.ledger;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Aggregate counters over committed pool movements. Both only ever grow.
 */
@Value
public class LedgerTotals {
    BigDecimal premiumsCollected;
    BigDecimal payoutsProcessed;
}
