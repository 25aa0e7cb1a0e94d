package com.flagship.flight_cover.payout;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Computes payout amounts from premium, delay and the tier table.
 *
 * Stateless: the same inputs always produce the same amount.
 *
 * Lookup rule:
 * 1. Delays below {@link #PAYOUT_THRESHOLD_MINUTES} pay nothing.
 * 2. Tiers are scanned in stored order; the first tier whose range covers the delay wins.
 * 3. If no tier covers the delay, the last tier applies. This keeps catastrophic
 *    delays and cancellations (reported with a maximal delay) on the top multiplier
 *    even when every stored tier is bounded.
 *
 * Overlapping or out-of-order tiers are not an error here; scan order decides.
 */
@Component
public class PayoutEngine {

    public static final long PAYOUT_THRESHOLD_MINUTES = 120;

    static final int AMOUNT_SCALE = 4;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    /**
     * @return the uncapped payout, rounded down to {@value #AMOUNT_SCALE} decimal places
     * @throws IllegalStateException if the delay qualifies but no tiers are configured
     */
    public BigDecimal computePayout(BigDecimal premium, long delayMinutes, List<PayoutTier> tiers) {
        if (delayMinutes < PAYOUT_THRESHOLD_MINUTES) {
            return BigDecimal.ZERO;
        }
        if (tiers == null || tiers.isEmpty()) {
            throw new IllegalStateException("No payout tiers configured");
        }

        PayoutTier tier = selectTier(delayMinutes, tiers);
        return premium.multiply(BigDecimal.valueOf(tier.getMultiplier()))
                .divide(HUNDRED, AMOUNT_SCALE, RoundingMode.DOWN);
    }

    /**
     * First covering tier in stored order, else the last tier.
     */
    public PayoutTier selectTier(long delayMinutes, List<PayoutTier> tiers) {
        for (PayoutTier tier : tiers) {
            if (tier.covers(delayMinutes)) {
                return tier;
            }
        }
        return tiers.get(tiers.size() - 1);
    }

    public BigDecimal capPayout(BigDecimal payout, BigDecimal maxPayout) {
        return payout.min(maxPayout);
    }
}
