package com.menuassist.chat.service.semantic;

import com.menuassist.chat.cache.CacheKeys;
import com.menuassist.chat.cache.CacheStore;
import com.menuassist.chat.cache.CacheUnavailableException;
import com.menuassist.chat.config.AssistantProperties;
import com.menuassist.chat.service.config.RestaurantAiConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Optional;

/**
 * Cache of complete generated answers keyed by restaurant and a hash of the customer message.
 * Two messages with the same hash share an answer.
 */
@Component
public class SemanticResponseCache {

    private static final Logger log = LoggerFactory.getLogger(SemanticResponseCache.class);

    private final CacheStore cacheStore;
    private final Duration ttl;

    @Autowired
    public SemanticResponseCache(CacheStore cacheStore, AssistantProperties properties) {
        this(cacheStore, properties.getCache().getSemanticTtl());
    }

    SemanticResponseCache(CacheStore cacheStore, Duration ttl) {
        this.cacheStore = cacheStore;
        this.ttl = ttl;
    }

    public Optional<String> get(String restaurantId, String message, RestaurantAiConfig config) {
        if (!config.performance().cacheResponses()) {
            return Optional.empty();
        }
        try {
            return cacheStore.get(CacheKeys.semantic(restaurantId, stableHash(message)));
        } catch (CacheUnavailableException ex) {
            log.warn("Response cache read failed for restaurant {}: {}", restaurantId, ex.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Stores a complete generated answer. Callers must never pass fallback or partial text.
     */
    public void put(String restaurantId, String message, String answer, RestaurantAiConfig config) {
        if (!config.performance().cacheResponses() || answer == null || answer.isBlank()) {
            return;
        }
        try {
            cacheStore.set(CacheKeys.semantic(restaurantId, stableHash(message)), answer, ttl);
        } catch (CacheUnavailableException ex) {
            log.warn("Response cache write skipped for restaurant {}: {}", restaurantId, ex.getMessage());
        }
    }

    public long invalidateRestaurant(String restaurantId) {
        long removed = cacheStore.deleteByPrefix(CacheKeys.semanticPrefix(restaurantId));
        log.debug("Invalidated {} cached responses for restaurant {}", removed, restaurantId);
        return removed;
    }

    /**
     * SHA-256 of the lower-cased, trimmed message as lowercase hex. Stable across processes.
     */
    public static String stableHash(String message) {
        String normalized = message == null ? "" : message.trim().toLowerCase(Locale.ROOT);
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(normalized.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
