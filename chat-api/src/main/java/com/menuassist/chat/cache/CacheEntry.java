package com.menuassist.chat.cache;

import java.time.Duration;
import java.time.Instant;

public record CacheEntry(String key, String value, Instant createdAt, Duration ttl) {

    public boolean expires() {
        return ttl != null && !ttl.isZero() && !ttl.isNegative();
    }
}
