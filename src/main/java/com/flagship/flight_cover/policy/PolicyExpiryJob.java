package com.flagship.flight_cover.policy;

import com.flagship.flight_cover.auth.AuthorityPolicy;
import com.flagship.flight_cover.exception.PolicyException;
import com.flagship.flight_cover.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Periodically expires ACTIVE policies whose flight is long gone and which are
 * owed nothing. Each policy expires in its own transaction, acting as the
 * authority, so one failure does not hold back the rest.
 */
@Component
@ConditionalOnProperty(name = "cover.expiry.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class PolicyExpiryJob {

    private final PolicyLifecycleService lifecycleService;
    private final AuthorityPolicy authorityPolicy;

    @Scheduled(fixedDelayString = "${cover.expiry.poll-interval-ms:300000}")
    public void run() {
        boolean ownsContext = CorrelationContext.beginJob("expiry");
        try {
            expireStalePolicies();
        } catch (Exception e) {
            log.error("Policy expiry run failed", e);
        } finally {
            if (ownsContext) {
                CorrelationContext.clear();
            }
        }
    }

    /**
     * @return how many policies were expired
     */
    public int expireStalePolicies() {
        List<Long> candidates = lifecycleService.findExpirablePolicyIds();
        if (candidates.isEmpty()) {
            return 0;
        }

        int expired = 0;
        for (Long policyId : candidates) {
            try {
                lifecycleService.expirePolicy(policyId, authorityPolicy.getIdentity());
                expired++;
            } catch (PolicyException e) {
                // Raced with a concurrent status report, claim or cancellation.
                log.warn("Skipped expiry of policy {}: code={}, message={}", policyId, e.getCode(), e.getMessage());
            }
        }

        log.info("Expiry run finished: candidates={}, expired={}", candidates.size(), expired);
        return expired;
    }
}
