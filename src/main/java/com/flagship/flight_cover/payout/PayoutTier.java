package com.flagship.flight_cover.payout;

import lombok.Value;

/**
 * A delay range [minDelay, maxDelay) in minutes mapped to a payout multiplier.
 *
 * The multiplier is expressed in hundredths: 100 pays 1.0x the premium, 250 pays 2.5x.
 * A {@code null} maxDelay makes the tier open-ended.
 */
@Value
public class PayoutTier {
    Long id;
    long minDelay;
    Long maxDelay;
    int multiplier;

    public static PayoutTier of(long minDelay, Long maxDelay, int multiplier) {
        return new PayoutTier(null, minDelay, maxDelay, multiplier);
    }

    /**
     * Whether {@code delayMinutes} falls inside this tier's half-open range.
     */
    public boolean covers(long delayMinutes) {
        return delayMinutes >= minDelay && (maxDelay == null || delayMinutes < maxDelay);
    }

    public boolean isOpenEnded() {
        return maxDelay == null;
    }
}
