package com.flagship.flight_cover.payout;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * JPA entity for payout tiers. Rows are only ever inserted; the identity
 * column gives the scan order.
 */
@Entity
@Table(name = "payout_tiers")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class PayoutTierEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(nullable = false, updatable = false)
    private Long id;

    @Column(name = "min_delay", nullable = false, updatable = false)
    private long minDelay;

    @Column(name = "max_delay", updatable = false)
    private Long maxDelay;

    @Column(nullable = false, updatable = false)
    private int multiplier;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    static PayoutTierEntity fromDomain(PayoutTier tier, Instant createdAt) {
        PayoutTierEntity entity = new PayoutTierEntity();
        entity.minDelay = tier.getMinDelay();
        entity.maxDelay = tier.getMaxDelay();
        entity.multiplier = tier.getMultiplier();
        entity.createdAt = createdAt;
        return entity;
    }

    public PayoutTier toDomain() {
        return new PayoutTier(id, minDelay, maxDelay, multiplier);
    }
}
