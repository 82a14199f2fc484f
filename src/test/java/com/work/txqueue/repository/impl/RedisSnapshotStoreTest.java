package com.work.txqueue.repository.impl;

import com.work.txqueue.exception.TxQueueException;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

public class RedisSnapshotStoreTest {

    @Test
    @SuppressWarnings("unchecked")
    public void save_load_delete_use_single_string_key() {
        StringRedisTemplate redis = mock(StringRedisTemplate.class);
        ValueOperations<String, String> ops = mock(ValueOperations.class);
        when(redis.opsForValue()).thenReturn(ops);
        when(ops.get("k")).thenReturn("{\"version\":1}");

        RedisSnapshotStore store = new RedisSnapshotStore(redis);
        store.save("k", "{}");
        Optional<String> loaded = store.load("k");
        store.delete("k");

        verify(ops, times(1)).set("k", "{}");
        assertEquals("{\"version\":1}", loaded.get());
        verify(redis, times(1)).delete("k");
    }

    @Test
    @SuppressWarnings("unchecked")
    public void missing_key_is_empty() {
        StringRedisTemplate redis = mock(StringRedisTemplate.class);
        ValueOperations<String, String> ops = mock(ValueOperations.class);
        when(redis.opsForValue()).thenReturn(ops);

        assertFalse(new RedisSnapshotStore(redis).load("k").isPresent());
    }

    @Test
    @SuppressWarnings("unchecked")
    public void redis_failure_is_wrapped() {
        StringRedisTemplate redis = mock(StringRedisTemplate.class);
        ValueOperations<String, String> ops = mock(ValueOperations.class);
        when(redis.opsForValue()).thenReturn(ops);
        doThrow(new RedisConnectionFailureException("down")).when(ops).set(anyString(), anyString());

        TxQueueException e = assertThrows(TxQueueException.class, () -> new RedisSnapshotStore(redis).save("k", "{}"));
        assertTrue(e.getCause() instanceof RedisConnectionFailureException);
    }
}
