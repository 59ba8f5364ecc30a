package com.flagship.finance_automation.transfer;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Redis fast path for "is this key committed?".
 *
 * Only COMMITTED keys are cached. COMMITTED is terminal, so a cached entry can
 * never become wrong. A miss or any Redis error means "ask the database".
 */
@Component
@Slf4j
public class CommittedKeyCache {

    private static final String REDIS_KEY_PREFIX = "transfer:committed:";
    private static final Duration REDIS_TTL = Duration.ofDays(30);

    private final Optional<StringRedisTemplate> redisTemplate;

    public CommittedKeyCache(Optional<StringRedisTemplate> redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    /**
     * @return true only when Redis positively knows the key is committed
     */
    public boolean isKnownCommitted(String idempotencyKey) {
        if (redisTemplate.isEmpty()) {
            return false;
        }
        try {
            return Boolean.TRUE.equals(redisTemplate.get().hasKey(REDIS_KEY_PREFIX + idempotencyKey));
        } catch (Exception e) {
            log.warn("Redis lookup failed for committed key {}, falling back to database: {}",
                    idempotencyKey, e.getMessage());
            return false;
        }
    }

    /**
     * Best effort; the database remains the source of truth.
     */
    public void markCommitted(String idempotencyKey) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + idempotencyKey, "1", REDIS_TTL);
        } catch (Exception e) {
            log.warn("Failed to cache committed key {} in Redis: {}", idempotencyKey, e.getMessage());
        }
    }
}
