package com.flagship.flight_cover.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Writes policy events to the outbox inside the transaction that changes the
 * policy, so an event exists exactly when its change committed. Publishing
 * happens later in {@link OutboxPublisher}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxService {

    private final OutboxEventRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Saves a policy event in the caller's transaction (MANDATORY propagation).
     * The insert is flushed at once so a failing write surfaces before any
     * funds transfer that follows it.
     *
     * @param payload serialized to JSON with the application ObjectMapper
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent savePolicyEvent(Long policyId, String eventType, Object payload) {
        String jsonPayload = serializePayload(payload);

        OutboxEvent event = OutboxEvent.forPolicy(policyId, eventType, jsonPayload, clock.instant());
        OutboxEventEntity saved = repository.saveAndFlush(OutboxEventEntity.fromDomain(event));

        log.debug("Saved outbox event: type={}, policyId={}", eventType, policyId);
        return saved.toDomain();
    }

    /**
     * Locks and returns the next batch of unpublished events.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<OutboxEvent> findUnpublishedEvents(int limit) {
        return repository.findUnpublishedEventsForUpdate(limit)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markPublished(UUID eventId) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markPublished(clock.instant());
            repository.save(entity);
            log.debug("Marked event {} as published", eventId);
        });
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markFailed(UUID eventId, String errorMessage) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markFailed(errorMessage);
            repository.save(entity);
            log.warn("Marked event {} as failed (retry #{}): {}",
                    eventId, entity.getRetryCount(), errorMessage);
        });
    }

    /**
     * A policy's events in write order, which is also their order on the topic.
     */
    @Transactional(readOnly = true)
    public List<OutboxEvent> getPolicyEvents(Long policyId) {
        return repository.findPolicyEvents(policyId.toString())
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<OutboxEvent> getPolicyEvents(Long policyId, String eventType) {
        return repository.findPolicyEventsOfType(policyId.toString(), eventType)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public long countUnpublished() {
        return repository.countUnpublished();
    }

    @Transactional(readOnly = true)
    public Optional<Instant> findOldestUnpublishedCreatedAt() {
        return repository.findOldestUnpublishedCreatedAt();
    }

    @Transactional(readOnly = true)
    public long countDeadLettered(int maxRetries) {
        return repository.countByPublishedAtIsNullAndRetryCountGreaterThanEqual(maxRetries);
    }

    /**
     * Policies whose later events cannot be published until someone deals with
     * a dead-lettered one.
     */
    @Transactional(readOnly = true)
    public List<Long> findStalledPolicyIds(int maxRetries, int limit) {
        return repository.findStalledPolicyIds(maxRetries, limit)
                .stream()
                .map(Long::valueOf)
                .toList();
    }

    private String serializePayload(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize event payload", e);
        }
    }
}
