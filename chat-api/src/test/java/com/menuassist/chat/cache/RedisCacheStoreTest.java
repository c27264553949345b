package com.menuassist.chat.cache;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RedisCacheStoreTest {

    private StringRedisTemplate redis;
    private ValueOperations<String, String> values;
    private RedisCacheStore store;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        redis = mock(StringRedisTemplate.class);
        values = mock(ValueOperations.class);
        when(redis.opsForValue()).thenReturn(values);
        store = new RedisCacheStore(redis);
    }

    @Test
    void writesWithExpiry() {
        store.set("knowledge:rest-1:price:item-og", "$4.49", Duration.ofHours(24));

        verify(values).set("knowledge:rest-1:price:item-og", "$4.49", Duration.ofHours(24));
    }

    @Test
    void readsMissingKeyAsEmpty() {
        when(values.get("instant:hello")).thenReturn(null);

        assertThat(store.get("instant:hello")).isEmpty();
    }

    @Test
    void connectionFailureBecomesCacheUnavailable() {
        when(values.get(any())).thenThrow(new RedisConnectionFailureException("refused"));

        assertThatThrownBy(() -> store.get("instant:hello"))
                .isInstanceOf(CacheUnavailableException.class)
                .hasCauseInstanceOf(RedisConnectionFailureException.class);
    }

    @Test
    @SuppressWarnings("unchecked")
    void prefixDeleteRemovesScannedKeys() {
        Cursor<String> cursor = mock(Cursor.class);
        when(cursor.hasNext()).thenReturn(true, true, false);
        when(cursor.next()).thenReturn("semantic:rest-1:aa", "semantic:rest-1:bb");
        when(redis.scan(any(ScanOptions.class))).thenReturn(cursor);
        when(redis.delete(anyList())).thenReturn(2L);

        long removed = store.deleteByPrefix("semantic:rest-1:");

        assertThat(removed).isEqualTo(2);
        verify(redis).delete(List.of("semantic:rest-1:aa", "semantic:rest-1:bb"));
        verify(cursor).close();
    }
}
