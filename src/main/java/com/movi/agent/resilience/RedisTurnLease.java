package com.movi.agent.resilience;

import com.movi.agent.config.OrchestratorProperties;
import com.movi.agent.exception.CheckpointException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Cross-instance turn exclusion for threads whose checkpoints live in Redis.
 *
 * Key pattern: movi:turn-lock:{threadId}, value is a random owner token.
 * Claimed with SET NX plus a TTL, so a crashed instance frees the thread after lease-ttl-seconds.
 * Released with a compare-and-delete script: an instance never deletes a lease it no longer owns.
 */
@Component
@ConditionalOnProperty(name = "movi.checkpoint.store", havingValue = "redis", matchIfMissing = true)
@Slf4j
public class RedisTurnLease {

    private static final String KEY_PREFIX = "movi:turn-lock:";
    static final Duration POLL_INTERVAL = Duration.ofMillis(50);

    static final RedisScript<Long> RELEASE_SCRIPT = new DefaultRedisScript<>(
            "if redis.call('get', KEYS[1]) == ARGV[1] then return redis.call('del', KEYS[1]) else return 0 end",
            Long.class);

    private final StringRedisTemplate redisTemplate;
    private final OrchestratorProperties properties;

    public RedisTurnLease(StringRedisTemplate redisTemplate, OrchestratorProperties properties) {
        this.redisTemplate = redisTemplate;
        this.properties = properties;
    }

    /**
     * Polls for the thread's lease until {@code wait} runs out.
     *
     * @return the owner token to release with, or empty when another instance kept the lease
     * @throws CheckpointException when Redis is unreachable
     */
    public Optional<String> acquire(String threadId, Duration wait) throws InterruptedException {
        String key = buildKey(threadId);
        String token = UUID.randomUUID().toString();
        long deadline = System.nanoTime() + wait.toNanos();

        while (true) {
            if (tryClaim(threadId, key, token)) {
                log.debug("Turn lease acquired [thread={}]", threadId);
                return Optional.of(token);
            }
            if (System.nanoTime() >= deadline) {
                return Optional.empty();
            }
            Thread.sleep(POLL_INTERVAL.toMillis());
        }
    }

    /**
     * Deletes the lease if {@code token} still owns it. A failed release is left to the TTL.
     */
    public void release(String threadId, String token) {
        try {
            Long deleted = redisTemplate.execute(RELEASE_SCRIPT, List.of(buildKey(threadId)), token);
            if (deleted == null || deleted == 0L) {
                log.warn("Turn lease had already expired or changed owner [thread={}]", threadId);
            }
        } catch (DataAccessException e) {
            log.warn("Failed to release turn lease [thread={}], it expires in {}s: {}",
                    threadId, properties.getLeaseTtlSeconds(), e.getMessage());
        }
    }

    private boolean tryClaim(String threadId, String key, String token) {
        try {
            Boolean claimed = redisTemplate.opsForValue()
                    .setIfAbsent(key, token, Duration.ofSeconds(properties.getLeaseTtlSeconds()));
            return Boolean.TRUE.equals(claimed);
        } catch (DataAccessException e) {
            throw new CheckpointException("Failed to claim turn lease for thread " + threadId, e);
        }
    }

    private String buildKey(String threadId) {
        return KEY_PREFIX + threadId;
    }
}
