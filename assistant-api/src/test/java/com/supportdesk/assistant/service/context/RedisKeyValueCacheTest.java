package com.supportdesk.assistant.service.context;

import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RedisKeyValueCacheTest {

    @SuppressWarnings("unchecked")
    private final ValueOperations<String, String> values = mock(ValueOperations.class);
    private final StringRedisTemplate redisTemplate = mock(StringRedisTemplate.class);
    private final RedisKeyValueCache cache = new RedisKeyValueCache(redisTemplate);

    @Test
    void setsWithExpiry() {
        when(redisTemplate.opsForValue()).thenReturn(values);

        cache.set("k", "v", Duration.ofSeconds(90));

        verify(values).set("k", "v", Duration.ofSeconds(90));
    }

    @Test
    void getReturnsStoredValue() {
        when(redisTemplate.opsForValue()).thenReturn(values);
        when(values.get("k")).thenReturn("v");

        assertThat(cache.get("k")).contains("v");
        assertThat(cache.get("other")).isEmpty();
    }

    @Test
    void redisFailuresAreWrapped() {
        when(redisTemplate.opsForValue()).thenReturn(values);
        when(values.get("k")).thenThrow(new RedisConnectionFailureException("refused"));

        assertThatThrownBy(() -> cache.get("k"))
                .isInstanceOf(KeyValueCacheException.class)
                .hasCauseInstanceOf(RedisConnectionFailureException.class);
    }

    @Test
    void deleteRemovesTheKey() {
        cache.delete("k");

        verify(redisTemplate).delete("k");
    }
}
