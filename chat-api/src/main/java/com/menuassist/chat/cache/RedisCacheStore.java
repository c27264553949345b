package com.menuassist.chat.cache;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Component
@ConditionalOnProperty(name = "chat.cache.backend", havingValue = "redis", matchIfMissing = true)
public class RedisCacheStore implements CacheStore {

    private static final int SCAN_BATCH = 500;

    private final StringRedisTemplate redis;

    public RedisCacheStore(StringRedisTemplate redis) {
        this.redis = redis;
    }

    @Override
    public Optional<String> get(String key) {
        try {
            return Optional.ofNullable(redis.opsForValue().get(key));
        } catch (DataAccessException ex) {
            throw new CacheUnavailableException("Redis read failed for " + key, ex);
        }
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        try {
            if (ttl == null || ttl.isZero() || ttl.isNegative()) {
                redis.opsForValue().set(key, value);
            } else {
                redis.opsForValue().set(key, value, ttl);
            }
        } catch (DataAccessException ex) {
            throw new CacheUnavailableException("Redis write failed for " + key, ex);
        }
    }

    @Override
    public void delete(String key) {
        try {
            redis.delete(key);
        } catch (DataAccessException ex) {
            throw new CacheUnavailableException("Redis delete failed for " + key, ex);
        }
    }

    @Override
    public long deleteByPrefix(String prefix) {
        ScanOptions options = ScanOptions.scanOptions()
                .match(prefix + "*")
                .count(SCAN_BATCH)
                .build();
        try (Cursor<String> cursor = redis.scan(options)) {
            List<String> batch = new ArrayList<>();
            long removed = 0;
            while (cursor.hasNext()) {
                batch.add(cursor.next());
                if (batch.size() >= SCAN_BATCH) {
                    removed += deleteBatch(batch);
                }
            }
            return removed + deleteBatch(batch);
        } catch (DataAccessException ex) {
            throw new CacheUnavailableException("Redis prefix delete failed for " + prefix, ex);
        }
    }

    private long deleteBatch(List<String> batch) {
        if (batch.isEmpty()) {
            return 0;
        }
        Long removed = redis.delete(List.copyOf(batch));
        batch.clear();
        return removed == null ? 0 : removed;
    }
}
