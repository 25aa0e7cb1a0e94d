package com.flagship.flight_cover.outbox;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface OutboxEventRepository extends JpaRepository<OutboxEventEntity, UUID> {

    /**
     * Next batch in write order. SKIP LOCKED keeps two publisher instances
     * from claiming the same rows.
     */
    @Query(value = """
        SELECT * FROM outbox_events
        WHERE published_at IS NULL
        ORDER BY sequence_number ASC
        LIMIT :limit
        FOR UPDATE SKIP LOCKED
        """, nativeQuery = true)
    List<OutboxEventEntity> findUnpublishedEventsForUpdate(@Param("limit") int limit);

    @Query("""
        SELECT e FROM OutboxEventEntity e
        WHERE e.aggregateType = 'Policy' AND e.aggregateId = :policyId
        ORDER BY e.sequenceNumber ASC
        """)
    List<OutboxEventEntity> findPolicyEvents(@Param("policyId") String policyId);

    @Query("""
        SELECT e FROM OutboxEventEntity e
        WHERE e.aggregateType = 'Policy' AND e.aggregateId = :policyId AND e.eventType = :eventType
        ORDER BY e.sequenceNumber ASC
        """)
    List<OutboxEventEntity> findPolicyEventsOfType(@Param("policyId") String policyId,
                                                   @Param("eventType") String eventType);

    @Query("SELECT COUNT(e) FROM OutboxEventEntity e WHERE e.publishedAt IS NULL")
    long countUnpublished();

    long countByPublishedAtIsNullAndRetryCountGreaterThanEqual(int retryCount);

    /**
     * Policies whose feed is stalled behind a dead-lettered event, oldest first.
     */
    @Query(value = """
        SELECT aggregate_id FROM outbox_events
        WHERE published_at IS NULL AND retry_count >= :maxRetries
        GROUP BY aggregate_id
        ORDER BY MIN(sequence_number) ASC
        LIMIT :limit
        """, nativeQuery = true)
    List<String> findStalledPolicyIds(@Param("maxRetries") int maxRetries, @Param("limit") int limit);

    @Query("""
        SELECT MIN(e.createdAt) FROM OutboxEventEntity e
        WHERE e.publishedAt IS NULL
        """)
    Optional<Instant> findOldestUnpublishedCreatedAt();
}
