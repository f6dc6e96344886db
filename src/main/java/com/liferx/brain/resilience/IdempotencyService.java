package com.liferx.brain.resilience;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Redis-based idempotency for synchronous tool calls.
 *
 * A caller retrying POST /api/tools/execute after a network timeout must not
 * run a write tool twice. The caller sends an Idempotency-Key; the first
 * successful response is cached under that key and replayed for repeats.
 *
 * Key pattern: brain:tool-idempotency:{idempotencyKey}
 * TTL: 24 hours
 *
 * Requests without a key are always executed.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String KEY_PREFIX = "brain:tool-idempotency:";
    private static final Duration TTL = Duration.ofHours(24);
    // Stored while the first request is still running
    static final String IN_FLIGHT_SENTINEL = "__IN_FLIGHT__";

    private final StringRedisTemplate redisTemplate;

    public IdempotencyService(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    /**
     * @return the cached response JSON, or empty if the key is new or still in flight
     */
    public Optional<String> getCachedResponse(String idempotencyKey) {
        String existing = redisTemplate.opsForValue().get(buildKey(idempotencyKey));

        if (existing == null) {
            return Optional.empty();
        }
        if (IN_FLIGHT_SENTINEL.equals(existing)) {
            log.warn("Idempotency key {} is in-flight, proceeding anyway", idempotencyKey);
            return Optional.empty();
        }

        log.info("Idempotency hit for key={}", idempotencyKey);
        return Optional.of(existing);
    }

    /**
     * Mark key as in-flight atomically (SET NX).
     * Returns true if claim succeeded, false if another request holds it.
     */
    public boolean claimKey(String idempotencyKey) {
        Boolean claimed = redisTemplate.opsForValue()
                .setIfAbsent(buildKey(idempotencyKey), IN_FLIGHT_SENTINEL, TTL);
        return Boolean.TRUE.equals(claimed);
    }

    public void storeResponse(String idempotencyKey, String responseJson) {
        redisTemplate.opsForValue().set(buildKey(idempotencyKey), responseJson, TTL);
        log.debug("Stored idempotency response for key={}", idempotencyKey);
    }

    /**
     * Forget the key so a failed call can be retried.
     */
    public void releaseKey(String idempotencyKey) {
        redisTemplate.delete(buildKey(idempotencyKey));
        log.debug("Released idempotency key={}", idempotencyKey);
    }

    private String buildKey(String idempotencyKey) {
        return KEY_PREFIX + idempotencyKey;
    }
}
