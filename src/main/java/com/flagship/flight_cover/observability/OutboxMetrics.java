package com.flagship.flight_cover.observability;

import com.flagship.flight_cover.outbox.OutboxService;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics for the policy event feed: how far indexers lag behind the ledger
 * and how many policies are stuck behind a dead-lettered event.
 *
 * Gauges hold values cached by {@link MetricsScheduler}; a scrape never
 * queries the outbox table.
 */
@Component
@Slf4j
public class OutboxMetrics {

    private static final int STALLED_POLICY_SCAN_LIMIT = 10_000;

    private final OutboxService outboxService;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final int maxRetries;

    private final AtomicLong pendingEvents = new AtomicLong();
    private final AtomicLong feedLagSeconds = new AtomicLong();
    private final AtomicLong deadLetteredEvents = new AtomicLong();
    private final AtomicLong stalledPolicies = new AtomicLong();

    public OutboxMetrics(OutboxService outboxService,
                         MeterRegistry meterRegistry,
                         Clock clock,
                         @Value("${outbox.publisher.max-retries:5}") int maxRetries) {
        this.outboxService = outboxService;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.maxRetries = maxRetries;
    }

    @PostConstruct
    public void init() {
        Gauge.builder("cover.events.pending", pendingEvents, AtomicLong::get)
                .description("Policy events written but not yet on the topic")
                .register(meterRegistry);

        Gauge.builder("cover.events.lag.seconds", feedLagSeconds, AtomicLong::get)
                .description("Age of the oldest policy event still waiting for the topic")
                .register(meterRegistry);

        Gauge.builder("cover.events.dead_lettered", deadLetteredEvents, AtomicLong::get)
                .description("Policy events the publisher has given up on")
                .register(meterRegistry);

        Gauge.builder("cover.events.stalled_policies", stalledPolicies, AtomicLong::get)
                .description("Policies whose feed is blocked by a dead-lettered event")
                .register(meterRegistry);
    }

    public void refreshMetrics() {
        try {
            long pending = outboxService.countUnpublished();
            pendingEvents.set(pending);

            long lagSeconds = outboxService.findOldestUnpublishedCreatedAt()
                    .map(oldest -> Math.max(0, Duration.between(oldest, clock.instant()).getSeconds()))
                    .orElse(0L);
            feedLagSeconds.set(lagSeconds);

            deadLetteredEvents.set(outboxService.countDeadLettered(maxRetries));
            stalledPolicies.set(outboxService.findStalledPolicyIds(maxRetries, STALLED_POLICY_SCAN_LIMIT).size());

            log.debug("Event feed metrics refreshed: pending={}, lag={}s, deadLettered={}, stalledPolicies={}",
                    pending, lagSeconds, deadLetteredEvents.get(), stalledPolicies.get());
        } catch (Exception e) {
            log.warn("Failed to refresh event feed metrics: {}", e.getMessage());
        }
    }

    public void recordEventPublished(String eventType) {
        meterRegistry.counter("cover.events.published", "event_type", eventType, "outcome", "acked").increment();
    }

    public void recordEventPublishFailed(String eventType) {
        meterRegistry.counter("cover.events.published", "event_type", eventType, "outcome", "failed").increment();
    }

    public void recordEventDeadLettered(String eventType) {
        meterRegistry.counter("cover.events.skipped", "event_type", eventType, "reason", "dead_lettered").increment();
    }

    /**
     * Events not attempted this run because an earlier event of the same policy failed.
     */
    public void recordEventsHeldBack(int count) {
        meterRegistry.counter("cover.events.held_back").increment(count);
    }
}
