package com.menuassist.chat.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Key/value store backing the knowledge and semantic response caches.
 * Implementations throw {@link CacheUnavailableException} when the backend cannot be reached;
 * callers treat that as a miss.
 */
public interface CacheStore {

    Optional<String> get(String key);

    /**
     * Stores {@code value} under {@code key}. A null, zero or negative TTL stores without expiry.
     */
    void set(String key, String value, Duration ttl);

    void delete(String key);

    /**
     * Removes every key starting with {@code prefix} and returns how many were removed.
     */
    long deleteByPrefix(String prefix);
}
