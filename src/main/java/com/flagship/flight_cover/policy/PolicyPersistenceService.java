package com.flagship.flight_cover.policy;

import com.flagship.flight_cover.exception.PolicyNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Bridges the {@link Policy} domain object and {@link PolicyEntity}.
 *
 * Rows are never deleted. Writes and locks join the caller's transaction so a
 * policy transition commits together with its pool movement and event.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PolicyPersistenceService {

    private final PolicyRepository policyRepository;

    /**
     * Inserts a new policy and returns it with its allocated id.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Policy insert(Policy policy, String idempotencyKey) {
        PolicyEntity saved = policyRepository.saveAndFlush(PolicyEntity.fromDomain(policy, idempotencyKey));
        log.debug("Inserted policy {} (idempotency key {})", saved.getId(), idempotencyKey);
        return saved.toDomain();
    }

    /**
     * Loads a policy under a row lock held until the caller's transaction ends.
     *
     * @throws PolicyNotFoundException if no policy has this id
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Policy lockById(Long policyId) {
        return policyRepository.findByIdForUpdate(policyId)
            .map(PolicyEntity::toDomain)
            .orElseThrow(() -> new PolicyNotFoundException(policyId));
    }

    /**
     * Writes the mutable fields of a transitioned policy and flushes, so the
     * database guards run before anything irreversible happens.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Policy update(Policy policy) {
        PolicyEntity existing = policyRepository.findById(policy.getId())
            .orElseThrow(() -> new PolicyNotFoundException(policy.getId()));
        existing.updateFromDomain(policy);
        PolicyEntity updated = policyRepository.saveAndFlush(existing);
        log.debug("Updated policy {}: status={}, flightStatus={}", updated.getId(),
            updated.getStatus(), updated.getFlightStatus());
        return updated.toDomain();
    }

    @Transactional(readOnly = true)
    public Optional<Policy> findById(Long policyId) {
        return policyRepository.findById(policyId).map(PolicyEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public List<Long> findIdsByHolder(String holder) {
        return policyRepository.findIdsByHolder(holder);
    }

    @Transactional(readOnly = true)
    public List<Long> findIdsByFlightNumber(String flightNumber) {
        return policyRepository.findIdsByFlightNumber(flightNumber);
    }

    @Transactional(readOnly = true)
    public List<Long> findExpiryCandidates(Instant departedBefore, long delayThreshold) {
        return policyRepository.findExpiryCandidates(departedBefore, delayThreshold);
    }

    @Transactional(readOnly = true)
    public BigDecimal activeExposure() {
        return policyRepository.sumActiveExposure();
    }
}
