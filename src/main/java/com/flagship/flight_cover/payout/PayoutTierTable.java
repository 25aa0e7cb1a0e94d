package com.flagship.flight_cover.payout;

import com.flagship.flight_cover.auth.AuthorityPolicy;
import com.flagship.flight_cover.exception.ErrorCode;
import com.flagship.flight_cover.exception.PolicyValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;

/**
 * Ordered, append-only table of payout tiers.
 *
 * Only the shape of each tier is checked. Overlaps and gaps between tiers are
 * accepted as-is: a later tier can only take over part of an earlier tier's
 * range through scan order, never by replacing it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PayoutTierTable {

    private final PayoutTierRepository repository;
    private final AuthorityPolicy authorityPolicy;
    private final Clock clock;

    /**
     * Appends a tier. Authority only.
     *
     * @param maxDelay exclusive upper bound in minutes, or {@code null} for an open-ended tier
     * @param multiplier payout multiplier in hundredths of the premium
     */
    @Transactional
    public PayoutTier addTier(long minDelay, Long maxDelay, int multiplier, String caller) {
        authorityPolicy.requireAuthority(caller, "add payout tier");

        if (minDelay < 0) {
            throw new PolicyValidationException(ErrorCode.INVALID_TIER, "Tier minimum delay must not be negative");
        }
        if (maxDelay != null && maxDelay <= minDelay) {
            throw new PolicyValidationException(ErrorCode.INVALID_TIER,
                    String.format("Tier maximum delay %d must exceed minimum delay %d", maxDelay, minDelay));
        }
        if (multiplier <= 0) {
            throw new PolicyValidationException(ErrorCode.INVALID_TIER, "Tier multiplier must be positive");
        }

        PayoutTierEntity saved = repository.save(
                PayoutTierEntity.fromDomain(PayoutTier.of(minDelay, maxDelay, multiplier), clock.instant()));

        log.info("Payout tier appended: id={}, range=[{}, {}), multiplier={}",
                saved.getId(), minDelay, maxDelay == null ? "open" : maxDelay, multiplier);
        return saved.toDomain();
    }

    /**
     * All tiers in scan order.
     */
    @Transactional(readOnly = true)
    public List<PayoutTier> listTiers() {
        return repository.findAllByOrderByIdAsc()
                .stream()
                .map(PayoutTierEntity::toDomain)
                .toList();
    }
}
