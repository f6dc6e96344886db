package com.liferx.brain.resilience;

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

    private static final String KEY = "brain:tool-idempotency:abc";

    private StringRedisTemplate redisTemplate;
    private ValueOperations<String, String> values;
    private IdempotencyService service;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        redisTemplate = mock(StringRedisTemplate.class);
        values = mock(ValueOperations.class);
        when(redisTemplate.opsForValue()).thenReturn(values);
        service = new IdempotencyService(redisTemplate);
    }

    @Test
    void getCachedResponse_unknownKey_empty() {
        assertThat(service.getCachedResponse("abc")).isEmpty();
    }

    @Test
    void getCachedResponse_inFlight_treatedAsMiss() {
        when(values.get(KEY)).thenReturn(IdempotencyService.IN_FLIGHT_SENTINEL);
        assertThat(service.getCachedResponse("abc")).isEmpty();
    }

    @Test
    void getCachedResponse_stored_returned() {
        when(values.get(KEY)).thenReturn("{\"ok\":true}");
        assertThat(service.getCachedResponse("abc")).contains("{\"ok\":true}");
    }

    @Test
    void claimKey_setsSentinelWithTtl() {
        when(values.setIfAbsent(KEY, IdempotencyService.IN_FLIGHT_SENTINEL, Duration.ofHours(24))).thenReturn(true);
        assertThat(service.claimKey("abc")).isTrue();
    }

    @Test
    void claimKey_alreadyHeld_false() {
        when(values.setIfAbsent(KEY, IdempotencyService.IN_FLIGHT_SENTINEL, Duration.ofHours(24))).thenReturn(false);
        assertThat(service.claimKey("abc")).isFalse();
    }

    @Test
    void storeAndRelease_touchPrefixedKey() {
        service.storeResponse("abc", "{}");
        service.releaseKey("abc");

        verify(values).set(KEY, "{}", Duration.ofHours(24));
        verify(redisTemplate).delete(KEY);
    }
}
