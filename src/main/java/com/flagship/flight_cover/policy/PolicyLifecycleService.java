package com.flagship.flight_cover.policy;

import com.flagship.flight_cover.auth.AuthorityPolicy;
import com.flagship.flight_cover.exception.ErrorCode;
import com.flagship.flight_cover.exception.InsufficientPoolException;
import com.flagship.flight_cover.exception.PolicyException;
import com.flagship.flight_cover.exception.PolicyNotFoundException;
import com.flagship.flight_cover.exception.PolicyStateException;
import com.flagship.flight_cover.exception.PolicyValidationException;
import com.flagship.flight_cover.exception.TransferFailedException;
import com.flagship.flight_cover.ledger.PoolEntryType;
import com.flagship.flight_cover.ledger.PoolLedgerService;
import com.flagship.flight_cover.observability.CorrelationContext;
import com.flagship.flight_cover.observability.PolicyMetrics;
import com.flagship.flight_cover.outbox.OutboxService;
import com.flagship.flight_cover.payout.PayoutEngine;
import com.flagship.flight_cover.policy.event.FlightStatusUpdatedEvent;
import com.flagship.flight_cover.policy.event.PolicyCancelledEvent;
import com.flagship.flight_cover.policy.event.PolicyCreatedEvent;
import com.flagship.flight_cover.policy.event.PolicyEvent;
import com.flagship.flight_cover.policy.event.PolicyExpiredEvent;
import com.flagship.flight_cover.transfer.FundsTransferException;
import com.flagship.flight_cover.transfer.FundsTransferGateway;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Orchestrates the policy lifecycle: creation, flight status reports, payout
 * claims, cancellation and expiry.
 *
 * Every state-changing operation is one database transaction. It first takes
 * the policy row lock, then (only if money moves) the pool lock, so concurrent
 * operations on one policy serialize and the loser sees the committed state.
 *
 * Validation, authorization and state checks all run before any write. The
 * policy change, its pool journal line and its outbox event commit together.
 */
@Service
@Slf4j
public class PolicyLifecycleService {

    private final PolicyPersistenceService persistenceService;
    private final PayoutSettlementService settlementService;
    private final PoolLedgerService poolLedger;
    private final IdempotencyService idempotencyService;
    private final AuthorityPolicy authorityPolicy;
    private final FundsTransferGateway transferGateway;
    private final OutboxService outboxService;
    private final PolicyMetrics policyMetrics;
    private final Clock clock;
    private final Duration expiryGracePeriod;

    public PolicyLifecycleService(PolicyPersistenceService persistenceService,
                                  PayoutSettlementService settlementService,
                                  PoolLedgerService poolLedger,
                                  IdempotencyService idempotencyService,
                                  AuthorityPolicy authorityPolicy,
                                  FundsTransferGateway transferGateway,
                                  OutboxService outboxService,
                                  PolicyMetrics policyMetrics,
                                  Clock clock,
                                  @Value("${cover.expiry.grace-period:PT48H}") Duration expiryGracePeriod) {
        this.persistenceService = persistenceService;
        this.settlementService = settlementService;
        this.poolLedger = poolLedger;
        this.idempotencyService = idempotencyService;
        this.authorityPolicy = authorityPolicy;
        this.transferGateway = transferGateway;
        this.outboxService = outboxService;
        this.policyMetrics = policyMetrics;
        this.clock = clock;
        this.expiryGracePeriod = expiryGracePeriod;
    }

    /**
     * Creates an ACTIVE policy and escrows the premium into the pool.
     *
     * @throws PolicyValidationException INVALID_REQUEST, INVALID_PREMIUM, INVALID_SCHEDULE
     *         or INSUFFICIENT_COVERAGE_RATIO
     */
    @Transactional
    public Policy createPolicy(String holder, String flightNumber, Instant scheduledDeparture,
                               BigDecimal maxPayout, BigDecimal premiumPaid) {
        return doCreate(holder, flightNumber, scheduledDeparture, maxPayout, premiumPaid, null);
    }

    /**
     * Creates a policy at most once per idempotency key. A replayed key returns
     * the policy created by the first call and collects no second premium.
     */
    @Transactional
    public Policy createPolicy(String idempotencyKey, String holder, String flightNumber,
                               Instant scheduledDeparture, BigDecimal maxPayout, BigDecimal premiumPaid) {
        Optional<Long> existingId = idempotencyService.checkIdempotencyKey(idempotencyKey);
        if (existingId.isPresent()) {
            log.info("Idempotent replay of policy creation: key={}, policyId={}", idempotencyKey, existingId.get());
            policyMetrics.recordPolicyCreated("idempotent_replay");
            return persistenceService.findById(existingId.get())
                .orElseThrow(() -> new PolicyNotFoundException(existingId.get()));
        }

        Policy created = doCreate(holder, flightNumber, scheduledDeparture, maxPayout, premiumPaid, idempotencyKey);

        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                idempotencyService.storeIdempotencyKey(idempotencyKey, created.getId());
            }
        });
        return created;
    }

    private Policy doCreate(String holder, String flightNumber, Instant scheduledDeparture,
                            BigDecimal maxPayout, BigDecimal premiumPaid, String idempotencyKey) {
        long startTime = System.currentTimeMillis();
        try {
            Instant now = clock.instant();
            validateNewPolicy(holder, flightNumber, scheduledDeparture, maxPayout, premiumPaid, now);

            Policy policy = persistenceService.insert(
                Policy.create(holder, flightNumber, scheduledDeparture, premiumPaid, maxPayout, now),
                idempotencyKey);
            CorrelationContext.putPolicyId(policy.getId());

            poolLedger.credit(PoolEntryType.PREMIUM, policy.getId(), premiumPaid,
                "Premium for policy " + policy.getId());
            saveEvent(PolicyCreatedEvent.fromPolicy(policy, now));

            policyMetrics.recordPolicyCreated("success");
            log.info("Policy created: holder={}, flight={}, departure={}, premium={}, maxPayout={}",
                holder, flightNumber, scheduledDeparture, premiumPaid, maxPayout);
            return policy;

        } catch (PolicyException e) {
            policyMetrics.recordRejected("create", e.getCode().name());
            throw e;
        } finally {
            policyMetrics.recordLatency("create", System.currentTimeMillis() - startTime);
            CorrelationContext.clearPolicyId();
        }
    }

    private void validateNewPolicy(String holder, String flightNumber, Instant scheduledDeparture,
                                   BigDecimal maxPayout, BigDecimal premiumPaid, Instant now) {
        if (holder == null || holder.isBlank() || flightNumber == null || flightNumber.isBlank()) {
            throw new PolicyValidationException(ErrorCode.INVALID_REQUEST, "Holder and flight number are required");
        }
        if (premiumPaid == null || premiumPaid.signum() <= 0) {
            throw new PolicyValidationException(ErrorCode.INVALID_PREMIUM, "Premium must be greater than zero");
        }
        if (scheduledDeparture == null || !scheduledDeparture.isAfter(now)) {
            throw new PolicyValidationException(ErrorCode.INVALID_SCHEDULE,
                "Scheduled departure must be in the future");
        }
        if (maxPayout == null || maxPayout.compareTo(premiumPaid.multiply(BigDecimal.valueOf(2))) < 0) {
            throw new PolicyValidationException(ErrorCode.INSUFFICIENT_COVERAGE_RATIO,
                String.format("Max payout %s must be at least twice the premium %s", maxPayout, premiumPaid));
        }
    }

    /**
     * Records a flight status report. Authority only.
     *
     * If the stored delay reaches the payout threshold the payout settles in the
     * same transaction. When the pool cannot cover it, the status report still
     * commits and the policy stays ACTIVE and unpaid, to be claimed later with
     * {@link #processPayout}. A transfer failure rolls back the whole report.
     *
     * @throws TransferFailedException if the automatic payout could not be delivered
     */
    @Transactional
    public Policy updateFlightStatus(Long policyId, FlightStatus newFlightStatus, Instant actualDeparture,
                                     String caller) {
        long startTime = System.currentTimeMillis();
        CorrelationContext.putPolicyId(policyId);
        try {
            authorityPolicy.requireAuthority(caller, "update flight status");
            if (newFlightStatus == null) {
                throw new PolicyValidationException(ErrorCode.INVALID_REQUEST, "Flight status is required");
            }

            Instant now = clock.instant();
            Policy locked = persistenceService.lockById(policyId);
            Policy updated = persistenceService.update(locked.withFlightStatus(newFlightStatus, actualDeparture, now));
            saveEvent(FlightStatusUpdatedEvent.fromPolicy(updated, now));

            policyMetrics.recordFlightStatusUpdated(newFlightStatus.name());
            log.info("Flight status recorded: flightStatus={}, delayMinutes={}",
                updated.getFlightStatus(), updated.getDelayMinutes());

            if (updated.isPayoutEligible()) {
                try {
                    updated = settlementService.settle(updated);
                } catch (InsufficientPoolException e) {
                    log.warn("Automatic payout deferred, pool cannot cover it yet: requested={}, available={}",
                        e.getRequested(), e.getAvailable());
                }
            }
            return updated;

        } catch (PolicyException e) {
            policyMetrics.recordRejected("flight_status", e.getCode().name());
            throw e;
        } finally {
            policyMetrics.recordLatency("flight_status", System.currentTimeMillis() - startTime);
            CorrelationContext.clearPolicyId();
        }
    }

    /**
     * Claims a payout manually. Holder or authority.
     *
     * Checks run in this order: POLICY_NOT_FOUND, UNAUTHORIZED, ALREADY_PAID,
     * POLICY_NOT_ACTIVE, DELAY_BELOW_THRESHOLD.
     */
    @Transactional
    public Policy processPayout(Long policyId, String caller) {
        long startTime = System.currentTimeMillis();
        CorrelationContext.putPolicyId(policyId);
        try {
            Policy policy = persistenceService.lockById(policyId);
            authorityPolicy.requireHolderOrAuthority(caller, policy.getHolder(), "claim payout");

            if (policy.isPayoutProcessed()) {
                throw new PolicyStateException(ErrorCode.ALREADY_PAID, policyId,
                    String.format("Policy %d has already been paid out", policyId));
            }
            if (policy.getStatus() != PolicyStatus.ACTIVE) {
                throw new PolicyStateException(ErrorCode.POLICY_NOT_ACTIVE, policyId,
                    String.format("Policy %d is %s", policyId, policy.getStatus()));
            }
            if (policy.getDelayMinutes() < PayoutEngine.PAYOUT_THRESHOLD_MINUTES) {
                throw new PolicyStateException(ErrorCode.DELAY_BELOW_THRESHOLD, policyId,
                    String.format("Delay of %d minutes is below the %d minute threshold",
                        policy.getDelayMinutes(), PayoutEngine.PAYOUT_THRESHOLD_MINUTES));
            }

            return settlementService.settle(policy);

        } catch (PolicyException e) {
            policyMetrics.recordRejected("payout", e.getCode().name());
            throw e;
        } finally {
            policyMetrics.recordLatency("payout", System.currentTimeMillis() - startTime);
            CorrelationContext.clearPolicyId();
        }
    }

    /**
     * Cancels before departure and refunds 90% of the premium to the holder.
     * Holder or authority. The retained 10% stays in the pool.
     */
    @Transactional
    public Policy cancelPolicy(Long policyId, String caller) {
        long startTime = System.currentTimeMillis();
        CorrelationContext.putPolicyId(policyId);
        try {
            Policy policy = persistenceService.lockById(policyId);
            authorityPolicy.requireHolderOrAuthority(caller, policy.getHolder(), "cancel policy");

            Instant now = clock.instant();
            Policy cancelled = policy.cancel(now);
            BigDecimal refund = policy.refundAmount();
            poolLedger.requireAvailable(refund);

            cancelled = persistenceService.update(cancelled);
            poolLedger.debit(PoolEntryType.REFUND, policyId, refund, "Cancellation refund for policy " + policyId);

            saveEvent(PolicyCancelledEvent.of(policyId, refund, now));

            String reference = "refund-" + policyId;
            try {
                transferGateway.transfer(cancelled.getHolder(), refund, reference);
            } catch (FundsTransferException e) {
                policyMetrics.recordTransferFailure("refund");
                log.error("Refund transfer failed, rolling back cancellation: reference={}, amount={}",
                    reference, refund, e);
                throw new TransferFailedException(reference, e);
            }

            policyMetrics.recordCancelled();
            log.info("Policy cancelled: refund={}, retained={}", refund, policy.getPremium().subtract(refund));
            return cancelled;

        } catch (PolicyException e) {
            policyMetrics.recordRejected("cancel", e.getCode().name());
            throw e;
        } finally {
            policyMetrics.recordLatency("cancel", System.currentTimeMillis() - startTime);
            CorrelationContext.clearPolicyId();
        }
    }

    /**
     * Expires an ACTIVE policy whose departure is more than the grace period in
     * the past and which is owed nothing. Authority only. The premium stays in
     * the pool.
     */
    @Transactional
    public Policy expirePolicy(Long policyId, String caller) {
        CorrelationContext.putPolicyId(policyId);
        try {
            authorityPolicy.requireAuthority(caller, "expire policy");

            Instant now = clock.instant();
            Policy policy = persistenceService.lockById(policyId);
            if (policy.getStatus() != PolicyStatus.ACTIVE) {
                throw new PolicyStateException(ErrorCode.POLICY_NOT_ACTIVE, policyId,
                    String.format("Policy %d is %s", policyId, policy.getStatus()));
            }
            Instant expiresAt = policy.getScheduledDeparture().plus(expiryGracePeriod);
            if (now.isBefore(expiresAt)) {
                throw new PolicyStateException(ErrorCode.DEPARTURE_NOT_PASSED, policyId,
                    String.format("Policy %d cannot expire before %s", policyId, expiresAt));
            }

            Policy expired = persistenceService.update(policy.expire(now));
            saveEvent(PolicyExpiredEvent.of(policyId, now));

            policyMetrics.recordExpired();
            log.info("Policy expired: departure={}, delayMinutes={}",
                policy.getScheduledDeparture(), policy.getDelayMinutes());
            return expired;

        } catch (PolicyException e) {
            policyMetrics.recordRejected("expire", e.getCode().name());
            throw e;
        } finally {
            CorrelationContext.clearPolicyId();
        }
    }

    /**
     * Ids of ACTIVE policies that {@link #expirePolicy} would accept right now.
     */
    @Transactional(readOnly = true)
    public List<Long> findExpirablePolicyIds() {
        return persistenceService.findExpiryCandidates(
            clock.instant().minus(expiryGracePeriod), PayoutEngine.PAYOUT_THRESHOLD_MINUTES);
    }

    @Transactional(readOnly = true)
    public Policy getPolicy(Long policyId) {
        return persistenceService.findById(policyId)
            .orElseThrow(() -> new PolicyNotFoundException(policyId));
    }

    /**
     * Policy ids held by {@code holder}, oldest first.
     */
    @Transactional(readOnly = true)
    public List<Long> getPoliciesByHolder(String holder) {
        return persistenceService.findIdsByHolder(holder);
    }

    /**
     * Policy ids covering {@code flightNumber}, oldest first.
     */
    @Transactional(readOnly = true)
    public List<Long> getPoliciesByFlight(String flightNumber) {
        return persistenceService.findIdsByFlightNumber(flightNumber);
    }

    private void saveEvent(PolicyEvent event) {
        outboxService.savePolicyEvent(event.getPolicyId(), event.getEventType(), event);
    }
}
