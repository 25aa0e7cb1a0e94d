package com.flagship.flight_cover.policy;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface PolicyRepository extends JpaRepository<PolicyEntity, Long> {

    /**
     * Loads a policy and holds its row lock until the transaction ends.
     * Concurrent transitions of one policy serialize here.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM PolicyEntity p WHERE p.id = :id")
    Optional<PolicyEntity> findByIdForUpdate(@Param("id") Long id);

    Optional<PolicyEntity> findByIdempotencyKey(String idempotencyKey);

    @Query("SELECT p.id FROM PolicyEntity p WHERE p.holder = :holder ORDER BY p.id")
    List<Long> findIdsByHolder(@Param("holder") String holder);

    @Query("SELECT p.id FROM PolicyEntity p WHERE p.flightNumber = :flightNumber ORDER BY p.id")
    List<Long> findIdsByFlightNumber(@Param("flightNumber") String flightNumber);

    /**
     * ACTIVE policies that departed before the cutoff and are not owed a payout.
     */
    @Query("SELECT p.id FROM PolicyEntity p " +
           "WHERE p.status = com.flagship.flight_cover.policy.PolicyStatus.ACTIVE " +
           "AND p.payoutProcessed = false " +
           "AND p.scheduledDeparture < :cutoff " +
           "AND p.delayMinutes < :threshold " +
           "ORDER BY p.id")
    List<Long> findExpiryCandidates(@Param("cutoff") Instant cutoff, @Param("threshold") long threshold);

    /**
     * Worst-case liability: the sum of max payouts of every ACTIVE, unpaid policy.
     */
    @Query("SELECT COALESCE(SUM(p.maxPayout), 0) FROM PolicyEntity p " +
           "WHERE p.status = com.flagship.flight_cover.policy.PolicyStatus.ACTIVE " +
           "AND p.payoutProcessed = false")
    BigDecimal sumActiveExposure();
}
