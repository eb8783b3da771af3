package com.movi.agent.resilience;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Redis-based idempotency for chat turns.
 *
 * A client that retries after a network timeout must not run the same turn twice: the first
 * attempt may already have removed a vehicle. The client sends an Idempotency-Key; the reply
 * is cached under it for 24 hours and replayed on duplicates.
 *
 * Key pattern: movi:idempotency:{idempotencyKey}
 *
 * Opt-in: requests without a key always run.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String KEY_PREFIX = "movi:idempotency:";
    private static final Duration TTL = Duration.ofHours(24);
    static final String IN_FLIGHT_SENTINEL = "__IN_FLIGHT__";

    private final StringRedisTemplate redisTemplate;

    public IdempotencyService(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    /**
     * Optional.empty() when the key is unknown or still in flight, the cached reply JSON otherwise.
     */
    public Optional<String> getCachedResponse(String idempotencyKey) {
        String existing = redisTemplate.opsForValue().get(buildKey(idempotencyKey));

        if (existing == null || IN_FLIGHT_SENTINEL.equals(existing)) {
            return Optional.empty();
        }

        log.info("Idempotency hit for key={}", idempotencyKey);
        return Optional.of(existing);
    }

    /**
     * Marks the key in flight with SET NX. False when another request already holds it.
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

    /** Frees the key after a failed turn so the client can retry. */
    public void releaseKey(String idempotencyKey) {
        redisTemplate.delete(buildKey(idempotencyKey));
        log.debug("Released idempotency key={}", idempotencyKey);
    }

    private String buildKey(String idempotencyKey) {
        return KEY_PREFIX + idempotencyKey;
    }
}
