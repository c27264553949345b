package com.menuassist.chat.service.knowledge;

import com.menuassist.chat.cache.CacheKeys;
import com.menuassist.chat.cache.CacheStore;
import com.menuassist.chat.cache.CacheUnavailableException;
import com.menuassist.chat.config.AssistantProperties;
import com.menuassist.chat.service.menu.MenuItemKnowledge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * TTL cache of templated, fact-exact answers keyed by restaurant, question type and item.
 */
@Component
public class DeterministicKnowledgeCache {

    private static final Logger log = LoggerFactory.getLogger(DeterministicKnowledgeCache.class);

    private final CacheStore cacheStore;
    private final ItemResolver itemResolver;
    private final Duration ttl;

    @Autowired
    public DeterministicKnowledgeCache(CacheStore cacheStore, ItemResolver itemResolver, AssistantProperties properties) {
        this(cacheStore, itemResolver, properties.getCache().getKnowledgeTtl());
    }

    DeterministicKnowledgeCache(CacheStore cacheStore, ItemResolver itemResolver, Duration ttl) {
        this.cacheStore = cacheStore;
        this.itemResolver = itemResolver;
        this.ttl = ttl;
    }

    /**
     * Answers a classified question when its candidate name resolves to one of {@code menu}, the
     * restaurant's available items. An unresolved name yields empty so the caller falls through to
     * the next tier.
     */
    public Optional<KnowledgeAnswer> lookup(String restaurantId, List<MenuItemKnowledge> menu, ClassifiedQuestion question) {
        return itemResolver.resolve(menu, question.candidateItemName())
                .map(item -> answer(restaurantId, question.type(), item));
    }

    public KnowledgeAnswer answer(String restaurantId, QuestionType type, MenuItemKnowledge item) {
        String key = CacheKeys.knowledge(restaurantId, type, item.id());
        Optional<String> cached = read(key);
        if (cached.isPresent()) {
            return new KnowledgeAnswer(type, item, cached.get(), true);
        }
        String rendered = KnowledgeTemplates.render(type, item);
        write(key, rendered);
        return new KnowledgeAnswer(type, item, rendered, false);
    }

    public void invalidateItem(String restaurantId, String itemId) {
        for (QuestionType type : QuestionType.values()) {
            cacheStore.delete(CacheKeys.knowledge(restaurantId, type, itemId));
        }
        log.debug("Invalidated knowledge answers for item {} of restaurant {}", itemId, restaurantId);
    }

    public long invalidateRestaurant(String restaurantId) {
        long removed = cacheStore.deleteByPrefix(CacheKeys.knowledgePrefix(restaurantId));
        log.debug("Invalidated {} knowledge answers for restaurant {}", removed, restaurantId);
        return removed;
    }

    private Optional<String> read(String key) {
        try {
            return cacheStore.get(key);
        } catch (CacheUnavailableException ex) {
            log.warn("Knowledge cache read failed, rendering from menu data: {}", ex.getMessage());
            return Optional.empty();
        }
    }

    private void write(String key, String value) {
        try {
            cacheStore.set(key, value, ttl);
        } catch (CacheUnavailableException ex) {
            log.warn("Knowledge cache write skipped: {}", ex.getMessage());
        }
    }
}
