package com.flagship.flight_cover.ledger;

import java.util.Arrays;
import java.util.List;

/**
 * Kinds of movement recorded in the pool journal.
 * Inflows raise the pooled balance, outflows lower it.
 */
public enum PoolEntryType {
    PREMIUM(true),
    DEPOSIT(true),
    PAYOUT(false),
    REFUND(false),
    WITHDRAWAL(false);

    private final boolean inflow;

    PoolEntryType(boolean inflow) {
        this.inflow = inflow;
    }

    public boolean isInflow() {
        return inflow;
    }

    public static List<PoolEntryType> inflows() {
        return Arrays.stream(values()).filter(PoolEntryType::isInflow).toList();
    }
}
