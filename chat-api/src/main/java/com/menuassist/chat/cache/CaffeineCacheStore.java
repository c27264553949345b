package com.menuassist.chat.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * In-process store with per-entry TTL. Used for single-node deployments and tests.
 */
@Component
@ConditionalOnProperty(name = "chat.cache.backend", havingValue = "caffeine")
public class CaffeineCacheStore implements CacheStore {

    private final Cache<String, CacheEntry> cache;
    private final Ticker ticker;

    @Autowired
    public CaffeineCacheStore(@Value("${chat.cache.caffeine.maximum-size:50000}") long maximumSize) {
        this(maximumSize, Ticker.systemTicker());
    }

    public CaffeineCacheStore(long maximumSize, Ticker ticker) {
        this.ticker = ticker;
        this.cache = Caffeine.newBuilder()
                .maximumSize(Math.max(1, maximumSize))
                .ticker(ticker)
                .expireAfter(new EntryExpiry())
                .build();
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(cache.getIfPresent(key)).map(CacheEntry::value);
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        cache.put(key, new CacheEntry(key, value, now(), ttl));
    }

    @Override
    public void delete(String key) {
        cache.invalidate(key);
    }

    @Override
    public long deleteByPrefix(String prefix) {
        List<String> keys = cache.asMap().keySet().stream()
                .filter(key -> key.startsWith(prefix))
                .toList();
        cache.invalidateAll(keys);
        return keys.size();
    }

    private Instant now() {
        return Instant.EPOCH.plusNanos(ticker.read());
    }

    private static final class EntryExpiry implements Expiry<String, CacheEntry> {

        @Override
        public long expireAfterCreate(String key, CacheEntry entry, long currentTime) {
            return entry.expires() ? entry.ttl().toNanos() : Long.MAX_VALUE;
        }

        @Override
        public long expireAfterUpdate(String key, CacheEntry entry, long currentTime, long currentDuration) {
            return expireAfterCreate(key, entry, currentTime);
        }

        @Override
        public long expireAfterRead(String key, CacheEntry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
