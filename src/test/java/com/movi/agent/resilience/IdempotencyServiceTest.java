package com.movi.agent.resilience;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class IdempotencyServiceTest {

    private StringRedisTemplate redisTemplate;
    private ValueOperations<String, String> valueOps;
    private IdempotencyService service;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        redisTemplate = mock(StringRedisTemplate.class);
        valueOps = mock(ValueOperations.class);
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        service = new IdempotencyService(redisTemplate);
    }

    @Test
    void unknownKey_hasNoCachedResponse() {
        assertThat(service.getCachedResponse("k1")).isEmpty();
    }

    @Test
    void inFlightKey_hasNoCachedResponse() {
        when(valueOps.get("movi:idempotency:k1")).thenReturn(IdempotencyService.IN_FLIGHT_SENTINEL);

        assertThat(service.getCachedResponse("k1")).isEmpty();
    }

    @Test
    void storedKey_returnsCachedJson() {
        when(valueOps.get("movi:idempotency:k1")).thenReturn("{\"response\":\"done\"}");

        assertThat(service.getCachedResponse("k1")).contains("{\"response\":\"done\"}");
    }

    @Test
    void claimKey_usesSetIfAbsent() {
        when(valueOps.setIfAbsent("movi:idempotency:k1", IdempotencyService.IN_FLIGHT_SENTINEL, Duration.ofHours(24)))
                .thenReturn(true, false);

        assertThat(service.claimKey("k1")).isTrue();
        assertThat(service.claimKey("k1")).isFalse();
    }

    @Test
    void releaseKey_deletesIt() {
        service.releaseKey("k1");

        verify(redisTemplate).delete("movi:idempotency:k1");
    }
}
