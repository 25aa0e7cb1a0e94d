package com.flagship.flight_cover.policy;

import com.flagship.flight_cover.exception.ErrorCode;
import com.flagship.flight_cover.exception.InsufficientPoolException;
import com.flagship.flight_cover.exception.PolicyStateException;
import com.flagship.flight_cover.exception.TransferFailedException;
import com.flagship.flight_cover.ledger.PoolEntryType;
import com.flagship.flight_cover.ledger.PoolLedgerService;
import com.flagship.flight_cover.observability.PolicyMetrics;
import com.flagship.flight_cover.outbox.OutboxService;
import com.flagship.flight_cover.payout.PayoutEngine;
import com.flagship.flight_cover.payout.PayoutTierTable;
import com.flagship.flight_cover.policy.event.PayoutTriggeredEvent;
import com.flagship.flight_cover.transfer.FundsTransferException;
import com.flagship.flight_cover.transfer.FundsTransferGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;

/**
 * The one settlement path, shared by the flight status auto-trigger and by
 * manual payout claims.
 *
 * Runs inside the caller's transaction, which must already hold the policy row
 * lock. Steps:
 * 1. Compute the payout from premium, delay and tiers, capped at maxPayout
 * 2. Lock the pool and check it can cover the payout (INSUFFICIENT_POOL changes nothing)
 * 3. Mark the policy CLAIMED and flush, before any funds move
 * 4. Append the PAYOUT journal line
 * 5. Transfer to the holder under the reference {@code payout-{policyId}}
 * 6. Write PayoutTriggered to the outbox
 *
 * A transfer failure throws {@link TransferFailedException}, which rolls the
 * whole transaction back: the policy is never left claimed but unpaid.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PayoutSettlementService {

    private final PolicyPersistenceService persistenceService;
    private final PayoutEngine payoutEngine;
    private final PayoutTierTable tierTable;
    private final PoolLedgerService poolLedger;
    private final FundsTransferGateway transferGateway;
    private final OutboxService outboxService;
    private final PolicyMetrics policyMetrics;
    private final Clock clock;

    /**
     * @param policy the locked, ACTIVE, unpaid policy with a qualifying delay
     * @return the settled policy
     * @throws InsufficientPoolException if the pool cannot cover the payout; the
     *         caller's transaction is not marked rollback-only
     * @throws TransferFailedException if the holder could not be paid
     */
    @Transactional(propagation = Propagation.MANDATORY, noRollbackFor = InsufficientPoolException.class)
    public Policy settle(Policy policy) {
        if (!policy.isPayoutEligible()) {
            throw new PolicyStateException(ErrorCode.DELAY_BELOW_THRESHOLD, policy.getId(),
                String.format("Policy %d is not eligible for a payout (delay %d minutes)",
                    policy.getId(), policy.getDelayMinutes()));
        }

        BigDecimal payout = payoutEngine.capPayout(
            payoutEngine.computePayout(policy.getPremium(), policy.getDelayMinutes(), tierTable.listTiers()),
            policy.getMaxPayout());

        try {
            poolLedger.requireAvailable(payout);
        } catch (InsufficientPoolException e) {
            policyMetrics.recordPayout(policy.payoutReason(), "insufficient_pool");
            throw e;
        }

        Instant now = clock.instant();
        Policy settled = persistenceService.update(policy.settle(payout, now));

        poolLedger.debit(PoolEntryType.PAYOUT, settled.getId(), payout,
            String.format("Payout for policy %d: %s", settled.getId(), settled.payoutReason()));

        outboxService.savePolicyEvent(settled.getId(), PayoutTriggeredEvent.EVENT_TYPE,
            PayoutTriggeredEvent.fromPolicy(settled, now));

        // The transfer is the last step: nothing that can still fail runs after the funds leave.
        String reference = "payout-" + settled.getId();
        try {
            transferGateway.transfer(settled.getHolder(), payout, reference);
        } catch (FundsTransferException e) {
            policyMetrics.recordTransferFailure("payout");
            policyMetrics.recordPayout(settled.payoutReason(), "transfer_failed");
            log.error("Payout transfer failed, rolling back settlement: reference={}, holder={}, amount={}",
                reference, settled.getHolder(), payout, e);
            throw new TransferFailedException(reference, e);
        }

        policyMetrics.recordPayout(settled.payoutReason(), "success");
        policyMetrics.recordPayoutAmount(payout);

        log.info("Payout settled: amount={}, reason={}, delayMinutes={}",
            payout, settled.payoutReason(), settled.getDelayMinutes());
        return settled;
    }
}
