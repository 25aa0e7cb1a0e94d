package com.flagship.flight_cover.payout;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Payout computation against the default tier table:
 * [120, 240) -> 2x, [240, 480) -> 3x, [480, open) -> 5x.
 */
class PayoutEngineTest {

    private static final List<PayoutTier> DEFAULT_TIERS = List.of(
        new PayoutTier(1L, 120, 240L, 200),
        new PayoutTier(2L, 240, 480L, 300),
        new PayoutTier(3L, 480, null, 500)
    );

    private static final BigDecimal PREMIUM = new BigDecimal("10.00");

    private final PayoutEngine engine = new PayoutEngine();

    @Test
    @DisplayName("Delays below the threshold pay nothing")
    void testBelowThreshold_PaysZero() {
        assertEquals(0, BigDecimal.ZERO.compareTo(engine.computePayout(PREMIUM, 0, DEFAULT_TIERS)));
        assertEquals(0, BigDecimal.ZERO.compareTo(engine.computePayout(PREMIUM, 119, DEFAULT_TIERS)));
    }

    @Test
    @DisplayName("Below the threshold no tiers are needed")
    void testBelowThreshold_IgnoresEmptyTiers() {
        assertEquals(0, BigDecimal.ZERO.compareTo(engine.computePayout(PREMIUM, 60, List.of())));
    }

    @Test
    @DisplayName("Tier boundaries are inclusive below and exclusive above")
    void testTierBoundaries() {
        assertEquals(0, new BigDecimal("20.00").compareTo(engine.computePayout(PREMIUM, 120, DEFAULT_TIERS)));
        assertEquals(0, new BigDecimal("20.00").compareTo(engine.computePayout(PREMIUM, 239, DEFAULT_TIERS)));
        assertEquals(0, new BigDecimal("30.00").compareTo(engine.computePayout(PREMIUM, 240, DEFAULT_TIERS)));
        assertEquals(0, new BigDecimal("50.00").compareTo(engine.computePayout(PREMIUM, 480, DEFAULT_TIERS)));
    }

    @Test
    @DisplayName("150, 300 and 1000 minutes pay 2x, 3x and 5x")
    void testDefaultTierMultipliers() {
        assertEquals(0, new BigDecimal("20.00").compareTo(engine.computePayout(PREMIUM, 150, DEFAULT_TIERS)));
        assertEquals(0, new BigDecimal("30.00").compareTo(engine.computePayout(PREMIUM, 300, DEFAULT_TIERS)));
        assertEquals(0, new BigDecimal("50.00").compareTo(engine.computePayout(PREMIUM, 1000, DEFAULT_TIERS)));
    }

    @Test
    @DisplayName("A delay no tier covers falls back to the last tier")
    void testUncoveredDelay_UsesLastTier() {
        List<PayoutTier> bounded = List.of(
            new PayoutTier(1L, 120, 240L, 200),
            new PayoutTier(2L, 240, 480L, 300)
        );

        assertEquals(0, new BigDecimal("30.00").compareTo(engine.computePayout(PREMIUM, 5000, bounded)));
        assertEquals(0, new BigDecimal("30.00").compareTo(engine.computePayout(PREMIUM, Long.MAX_VALUE, bounded)));
    }

    @Test
    @DisplayName("Overlapping tiers resolve by stored order")
    void testOverlappingTiers_FirstMatchWins() {
        List<PayoutTier> overlapping = List.of(
            new PayoutTier(1L, 120, 600L, 150),
            new PayoutTier(2L, 240, null, 400)
        );

        assertEquals(0, new BigDecimal("15.00").compareTo(engine.computePayout(PREMIUM, 300, overlapping)));
        assertEquals(1L, engine.selectTier(300, overlapping).getId());
        assertEquals(2L, engine.selectTier(700, overlapping).getId());
    }

    @Test
    @DisplayName("Payout is rounded down to four decimal places")
    void testRoundsDown() {
        List<PayoutTier> tiers = List.of(new PayoutTier(1L, 120, null, 333));

        BigDecimal payout = engine.computePayout(new BigDecimal("0.0001"), 200, tiers);

        assertEquals(new BigDecimal("0.0003"), payout);
        assertEquals(PayoutEngine.AMOUNT_SCALE, payout.scale());
    }

    @Test
    @DisplayName("A qualifying delay with no tiers configured is an error")
    void testNoTiers_Throws() {
        assertThrows(IllegalStateException.class, () -> engine.computePayout(PREMIUM, 200, List.of()));
    }

    @Test
    @DisplayName("Payout is capped at max payout")
    void testCapPayout() {
        BigDecimal computed = engine.computePayout(PREMIUM, 1000, DEFAULT_TIERS);

        assertEquals(0, new BigDecimal("25.00").compareTo(engine.capPayout(computed, new BigDecimal("25.00"))));
        assertEquals(0, new BigDecimal("50.00").compareTo(engine.capPayout(computed, new BigDecimal("80.00"))));
    }
}
