package com.movi.agent.checkpoint;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.movi.agent.exception.CheckpointException;
import com.movi.agent.model.SessionState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Redis-backed checkpoint store.
 *
 * - Key pattern: movi:checkpoint:{threadId}
 * - Whole SessionState stored as one JSON document, so each SET replaces a complete turn
 * - No windowing: the message log is kept in full so every tool result still finds its call
 * - Optional TTL (0 = keep forever), reset on every write
 *
 * Unreadable JSON is a CheckpointException, not an empty thread: silently starting over
 * would drop a pending confirmation.
 */
@Component
@ConditionalOnProperty(name = "movi.checkpoint.store", havingValue = "redis", matchIfMissing = true)
@Slf4j
public class RedisCheckpointStore implements CheckpointStore {

    private static final String KEY_PREFIX = "movi:checkpoint:";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final long ttlMinutes;

    public RedisCheckpointStore(StringRedisTemplate redisTemplate,
                                ObjectMapper objectMapper,
                                @Value("${movi.checkpoint.ttl-minutes:0}") long ttlMinutes) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.ttlMinutes = ttlMinutes;
    }

    @Override
    public Optional<SessionState> load(String threadId) {
        String json;
        try {
            json = redisTemplate.opsForValue().get(buildKey(threadId));
        } catch (DataAccessException e) {
            throw new CheckpointException("Could not load checkpoint for thread " + threadId, e);
        }

        if (json == null) {
            log.debug("No checkpoint found for thread: {}", threadId);
            return Optional.empty();
        }

        try {
            SessionState state = objectMapper.readValue(json, SessionState.class);
            log.debug("Loaded checkpoint for thread: {} ({} messages, awaitingConfirmation={})",
                    threadId, state.getMessages().size(), state.isAwaitingConfirmation());
            return Optional.of(state);
        } catch (JsonProcessingException e) {
            throw new CheckpointException("Unreadable checkpoint for thread " + threadId, e);
        }
    }

    @Override
    public void save(SessionState state) {
        String key = buildKey(state.getThreadId());
        String json;
        try {
            json = objectMapper.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new CheckpointException("Could not serialize checkpoint for thread " + state.getThreadId(), e);
        }

        try {
            if (ttlMinutes > 0) {
                redisTemplate.opsForValue().set(key, json, Duration.ofMinutes(ttlMinutes));
            } else {
                redisTemplate.opsForValue().set(key, json);
            }
        } catch (DataAccessException e) {
            throw new CheckpointException("Could not save checkpoint for thread " + state.getThreadId(), e);
        }
        log.debug("Saved checkpoint for thread: {} ({} messages)", state.getThreadId(), state.getMessages().size());
    }

    private String buildKey(String threadId) {
        return KEY_PREFIX + threadId;
    }
}
