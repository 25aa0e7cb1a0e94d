package com.flagship.flight_cover.policy;

import com.flagship.flight_cover.observability.PolicyMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Maps policy creation idempotency keys to policy ids.
 *
 * Redis is the fast path and may be unavailable; the unique idempotency_key
 * column of the policies table is the source of truth.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "cover:idempotency:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final PolicyRepository policyRepository;
    private final Optional<RedisTemplate<String, String>> redisTemplate;
    private final PolicyMetrics policyMetrics;

    public IdempotencyService(PolicyRepository policyRepository,
                              Optional<RedisTemplate<String, String>> redisTemplate,
                              PolicyMetrics policyMetrics) {
        this.policyRepository = policyRepository;
        this.redisTemplate = redisTemplate;
        this.policyMetrics = policyMetrics;
    }

    /**
     * @return the id of the policy already created under this key, if any
     */
    public Optional<Long> checkIdempotencyKey(String idempotencyKey) {
        requireKey(idempotencyKey);

        Optional<Long> cached = readCache(idempotencyKey);
        if (cached.isPresent()) {
            policyMetrics.recordIdempotencyHit();
            return cached;
        }

        Optional<Long> stored = policyRepository.findByIdempotencyKey(idempotencyKey).map(PolicyEntity::getId);
        if (stored.isPresent()) {
            log.debug("Idempotency key found in database: {}", idempotencyKey);
            policyMetrics.recordIdempotencyHit();
            writeCache(idempotencyKey, stored.get());
        } else {
            policyMetrics.recordIdempotencyMiss();
        }
        return stored;
    }

    /**
     * Caches the key after the policy row holding it has been written.
     */
    public void storeIdempotencyKey(String idempotencyKey, Long policyId) {
        requireKey(idempotencyKey);
        if (policyId == null) {
            throw new IllegalArgumentException("Policy id cannot be null");
        }
        writeCache(idempotencyKey, policyId);
    }

    private Optional<Long> readCache(String idempotencyKey) {
        if (redisTemplate.isEmpty()) {
            return Optional.empty();
        }
        try {
            String value = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + idempotencyKey);
            if (value != null) {
                log.debug("Idempotency key found in Redis: {}", idempotencyKey);
                return Optional.of(Long.valueOf(value));
            }
        } catch (Exception e) {
            log.warn("Redis lookup failed for idempotency key {}, falling back to database: {}",
                    idempotencyKey, e.getMessage());
        }
        return Optional.empty();
    }

    private void writeCache(String idempotencyKey, Long policyId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + idempotencyKey, policyId.toString(), REDIS_TTL);
        } catch (Exception e) {
            log.debug("Failed to cache idempotency key {} in Redis: {}", idempotencyKey, e.getMessage());
        }
    }

    private void requireKey(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }
    }
}
