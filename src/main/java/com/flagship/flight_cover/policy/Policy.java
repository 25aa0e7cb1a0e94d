package com.flagship.flight_cover.policy;

import com.flagship.flight_cover.exception.ErrorCode;
import com.flagship.flight_cover.exception.PolicyStateException;
import com.flagship.flight_cover.payout.PayoutEngine;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;

/**
 * Flight delay cover policy.
 *
 * Immutable: every transition returns a new instance. The terms (holder, flight,
 * scheduled departure, premium, max payout) never change after creation.
 *
 * State machine:
 * - ACTIVE -> CLAIMED (settlement), CANCELLED (holder or authority before departure),
 *   EXPIRED (departure long past, no payout owed)
 * - CLAIMED, CANCELLED and EXPIRED are terminal
 *
 * payoutProcessed flips to true exactly once, together with the move to CLAIMED.
 */
@Value
public class Policy {

    /**
     * Delay recorded for a cancelled flight with no later departure. Always lands
     * in the highest tier.
     */
    public static final long CANCELLED_DELAY_MINUTES = Long.MAX_VALUE;

    public static final String REASON_CANCELLED = "Flight Cancelled";
    public static final String REASON_DELAYED = "Flight Delayed";

    private static final BigDecimal REFUND_PERCENT = BigDecimal.valueOf(90);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final int AMOUNT_SCALE = 4;

    Long id;
    String holder;
    String flightNumber;
    Instant scheduledDeparture;
    BigDecimal premium;
    BigDecimal maxPayout;
    PolicyStatus status;
    FlightStatus flightStatus;
    Instant actualDeparture;
    long delayMinutes;
    boolean payoutProcessed;
    BigDecimal payoutAmount;
    Instant createdAt;
    Instant updatedAt;

    /**
     * New ACTIVE policy, not yet persisted (no id).
     */
    public static Policy create(String holder, String flightNumber, Instant scheduledDeparture,
                                BigDecimal premium, BigDecimal maxPayout, Instant now) {
        return new Policy(
            null,
            holder,
            flightNumber,
            scheduledDeparture,
            premium,
            maxPayout,
            PolicyStatus.ACTIVE,
            FlightStatus.ON_TIME,
            null,
            0L,
            false,
            null,
            now,
            now
        );
    }

    /**
     * Records a flight status report.
     *
     * The reported departure replaces the stored one, absent or not. DELAYED and
     * CANCELLED reports recompute the delay from the reported departure alone; the
     * stored delay is the larger of the previous and the recomputed one. Other
     * statuses keep it.
     *
     * @throws PolicyStateException with POLICY_NOT_ACTIVE unless ACTIVE
     */
    public Policy withFlightStatus(FlightStatus newFlightStatus, Instant reportedDeparture, Instant now) {
        requireActive("update flight status");

        long delay = this.delayMinutes;
        if (newFlightStatus.carriesDelay()) {
            delay = Math.max(delay, computeDelayMinutes(newFlightStatus, scheduledDeparture, reportedDeparture));
        }

        return copy(status, newFlightStatus, reportedDeparture, delay, payoutProcessed, payoutAmount, now);
    }

    /**
     * Delay in whole minutes, rounded down.
     *
     * A cancelled flight without a departure after the scheduled time reports
     * {@link #CANCELLED_DELAY_MINUTES}.
     */
    public static long computeDelayMinutes(FlightStatus flightStatus, Instant scheduledDeparture,
                                           Instant actualDeparture) {
        if (actualDeparture != null && actualDeparture.isAfter(scheduledDeparture)) {
            return Duration.between(scheduledDeparture, actualDeparture).getSeconds() / 60;
        }
        if (flightStatus == FlightStatus.CANCELLED) {
            return CANCELLED_DELAY_MINUTES;
        }
        return 0L;
    }

    /**
     * Marks the payout as processed and moves to CLAIMED.
     *
     * @throws PolicyStateException with ALREADY_PAID or POLICY_NOT_ACTIVE
     */
    public Policy settle(BigDecimal payout, Instant now) {
        if (payoutProcessed) {
            throw new PolicyStateException(ErrorCode.ALREADY_PAID, id,
                String.format("Policy %d has already been paid out", id));
        }
        requireActive("settle");
        return copy(PolicyStatus.CLAIMED, flightStatus, actualDeparture, delayMinutes, true, payout, now);
    }

    /**
     * Cancels the policy ahead of departure.
     *
     * @throws PolicyStateException with POLICY_NOT_ACTIVE or DEPARTURE_ALREADY_PASSED
     */
    public Policy cancel(Instant now) {
        requireActive("cancel");
        if (!now.isBefore(scheduledDeparture)) {
            throw new PolicyStateException(ErrorCode.DEPARTURE_ALREADY_PASSED, id,
                String.format("Policy %d cannot be cancelled: departure %s has passed", id, scheduledDeparture));
        }
        return copy(PolicyStatus.CANCELLED, flightStatus, actualDeparture, delayMinutes,
            payoutProcessed, payoutAmount, now);
    }

    /**
     * Closes an ACTIVE policy that is owed nothing.
     *
     * @throws PolicyStateException with POLICY_NOT_ACTIVE or PAYOUT_ELIGIBLE
     */
    public Policy expire(Instant now) {
        requireActive("expire");
        if (isPayoutEligible()) {
            throw new PolicyStateException(ErrorCode.PAYOUT_ELIGIBLE, id,
                String.format("Policy %d is owed a payout (delay %d minutes) and cannot expire", id, delayMinutes));
        }
        return copy(PolicyStatus.EXPIRED, flightStatus, actualDeparture, delayMinutes,
            payoutProcessed, payoutAmount, now);
    }

    /**
     * ACTIVE, unpaid and delayed at least the payout threshold.
     */
    public boolean isPayoutEligible() {
        return status == PolicyStatus.ACTIVE
            && !payoutProcessed
            && delayMinutes >= PayoutEngine.PAYOUT_THRESHOLD_MINUTES;
    }

    public boolean isTerminal() {
        return status != PolicyStatus.ACTIVE;
    }

    /**
     * 90% of the premium, rounded down. The rest stays in the pool.
     */
    public BigDecimal refundAmount() {
        return premium.multiply(REFUND_PERCENT).divide(HUNDRED, AMOUNT_SCALE, RoundingMode.DOWN);
    }

    public String payoutReason() {
        return flightStatus == FlightStatus.CANCELLED ? REASON_CANCELLED : REASON_DELAYED;
    }

    private void requireActive(String operation) {
        if (status != PolicyStatus.ACTIVE) {
            throw new PolicyStateException(ErrorCode.POLICY_NOT_ACTIVE, id,
                String.format("Cannot %s policy %d in %s status", operation, id, status));
        }
    }

    private Policy copy(PolicyStatus newStatus, FlightStatus newFlightStatus, Instant newActualDeparture,
                        long newDelayMinutes, boolean newPayoutProcessed, BigDecimal newPayoutAmount,
                        Instant now) {
        return new Policy(
            id,
            holder,
            flightNumber,
            scheduledDeparture,
            premium,
            maxPayout,
            newStatus,
            newFlightStatus,
            newActualDeparture,
            newDelayMinutes,
            newPayoutProcessed,
            newPayoutAmount,
            createdAt,
            now
        );
    }
}
