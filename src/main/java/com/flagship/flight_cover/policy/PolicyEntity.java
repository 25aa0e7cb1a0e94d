package com.flagship.flight_cover.policy;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * JPA entity for policies.
 *
 * - No setters: the terms are {@code updatable = false} and only the fields a
 *   transition may touch are copied back by {@link #updateFromDomain(Policy)}
 * - Timestamps come from the domain object, which takes them from the injected clock
 * - The idempotency key is a persistence concern and is passed to {@link #fromDomain}
 *   separately
 */
@Entity
@Table(name = "policies")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PolicyEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(nullable = false, updatable = false)
    private Long id;

    @Column(nullable = false, updatable = false)
    private String holder;

    @Column(name = "flight_number", nullable = false, updatable = false, length = 32)
    private String flightNumber;

    @Column(name = "scheduled_departure", nullable = false, updatable = false)
    private Instant scheduledDeparture;

    @Column(nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal premium;

    @Column(name = "max_payout", nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal maxPayout;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private PolicyStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "flight_status", nullable = false, length = 16)
    private FlightStatus flightStatus;

    @Column(name = "actual_departure")
    private Instant actualDeparture;

    @Column(name = "delay_minutes", nullable = false)
    private long delayMinutes;

    @Column(name = "payout_processed", nullable = false)
    private boolean payoutProcessed;

    @Column(name = "payout_amount", precision = 19, scale = 4)
    private BigDecimal payoutAmount;

    @Column(name = "idempotency_key", unique = true, updatable = false)
    private String idempotencyKey;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    /**
     * The only way to create a PolicyEntity.
     *
     * @param idempotencyKey creation key, or {@code null} when the caller supplied none
     */
    static PolicyEntity fromDomain(Policy policy, String idempotencyKey) {
        return new PolicyEntity(
            null, // assigned by the identity column
            policy.getHolder(),
            policy.getFlightNumber(),
            policy.getScheduledDeparture(),
            policy.getPremium(),
            policy.getMaxPayout(),
            policy.getStatus(),
            policy.getFlightStatus(),
            policy.getActualDeparture(),
            policy.getDelayMinutes(),
            policy.isPayoutProcessed(),
            policy.getPayoutAmount(),
            idempotencyKey,
            policy.getCreatedAt(),
            policy.getUpdatedAt()
        );
    }

    public Policy toDomain() {
        return new Policy(
            id,
            holder,
            flightNumber,
            scheduledDeparture,
            premium,
            maxPayout,
            status,
            flightStatus,
            actualDeparture,
            delayMinutes,
            payoutProcessed,
            payoutAmount,
            createdAt,
            updatedAt
        );
    }

    /**
     * Copies the mutable fields from a transitioned domain object.
     * Terms, idempotency key and createdAt are never touched.
     */
    void updateFromDomain(Policy policy) {
        if (!id.equals(policy.getId())) {
            throw new IllegalArgumentException("Policy " + policy.getId() + " does not match entity " + id);
        }
        if (this.payoutProcessed && !policy.isPayoutProcessed()) {
            throw new IllegalStateException("Payout flag of policy " + id + " cannot be reset");
        }
        this.status = policy.getStatus();
        this.flightStatus = policy.getFlightStatus();
        this.actualDeparture = policy.getActualDeparture();
        this.delayMinutes = policy.getDelayMinutes();
        this.payoutProcessed = policy.isPayoutProcessed();
        this.payoutAmount = policy.getPayoutAmount();
        this.updatedAt = policy.getUpdatedAt();
    }
}
