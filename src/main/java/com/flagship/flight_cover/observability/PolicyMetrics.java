package com.flagship.flight_cover.observability;

import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Centralized metrics for the policy lifecycle and the pool.
 *
 * Metrics exposed:
 * - policies.created: policy creations by outcome
 * - policies.flight_status: flight status reports by reported status
 * - policies.payouts: settlements by reason and outcome
 * - policies.payout.amount: distribution of settled amounts
 * - policies.cancelled / policies.expired: terminal transitions
 * - policies.rejected: rejected operations by error code
 * - policies.transfer.failures: disbursements the transfer rail refused
 * - policies.latency: operation latency
 * - pool.balance, pool.premiums.collected, pool.payouts.processed: gauges
 *   refreshed by {@link MetricsScheduler}
 */
@Component
public class PolicyMetrics {

    private final MeterRegistry registry;
    private final DistributionSummary payoutAmounts;

    private final AtomicReference<BigDecimal> poolBalance = new AtomicReference<>(BigDecimal.ZERO);
    private final AtomicReference<BigDecimal> premiumsCollected = new AtomicReference<>(BigDecimal.ZERO);
    private final AtomicReference<BigDecimal> payoutsProcessed = new AtomicReference<>(BigDecimal.ZERO);

    public PolicyMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.payoutAmounts = DistributionSummary.builder("policies.payout.amount")
                .description("Settled payout amounts")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);

        Gauge.builder("pool.balance", poolBalance, ref -> ref.get().doubleValue())
                .description("Pooled balance available for payouts")
                .register(registry);

        Gauge.builder("pool.premiums.collected", premiumsCollected, ref -> ref.get().doubleValue())
                .description("Total premiums collected")
                .register(registry);

        Gauge.builder("pool.payouts.processed", payoutsProcessed, ref -> ref.get().doubleValue())
                .description("Total payouts processed")
                .register(registry);
    }

    public void recordPolicyCreated(String status) {
        registry.counter("policies.created", "status", sanitizeTag(status)).increment();
    }

    public void recordFlightStatusUpdated(String flightStatus) {
        registry.counter("policies.flight_status", "flight_status", sanitizeTag(flightStatus)).increment();
    }

    public void recordPayout(String reason, String status) {
        registry.counter("policies.payouts",
                "reason", sanitizeTag(reason),
                "status", sanitizeTag(status)
        ).increment();
    }

    public void recordPayoutAmount(BigDecimal amount) {
        payoutAmounts.record(amount.doubleValue());
    }

    public void recordCancelled() {
        registry.counter("policies.cancelled").increment();
    }

    public void recordExpired() {
        registry.counter("policies.expired").increment();
    }

    public void recordRejected(String operation, String code) {
        registry.counter("policies.rejected",
                "operation", sanitizeTag(operation),
                "code", sanitizeTag(code)
        ).increment();
    }

    public void recordTransferFailure(String operation) {
        registry.counter("policies.transfer.failures", "operation", sanitizeTag(operation)).increment();
    }

    public void recordPoolMovement(String type) {
        registry.counter("pool.movements", "type", sanitizeTag(type)).increment();
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("policies.latency", "operation", sanitizeTag(operation))
                .record(Duration.ofMillis(durationMs));
    }

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    /**
     * Publishes the latest pool figures to the gauges.
     */
    public void updatePoolGauges(BigDecimal balance, BigDecimal premiums, BigDecimal payouts) {
        poolBalance.set(balance);
        premiumsCollected.set(premiums);
        payoutsProcessed.set(payouts);
    }

    /**
     * Keeps tag values bounded and free of special characters.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
