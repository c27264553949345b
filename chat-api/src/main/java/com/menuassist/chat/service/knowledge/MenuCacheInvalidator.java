package com.menuassist.chat.service.knowledge;

import com.menuassist.chat.service.semantic.SemanticResponseCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for the menu service when items change. Cached generated answers may quote any
 * item, so the restaurant's response cache is purged together with the item's templated answers.
 */
@Service
public class MenuCacheInvalidator {

    private static final Logger log = LoggerFactory.getLogger(MenuCacheInvalidator.class);

    private final DeterministicKnowledgeCache knowledgeCache;
    private final SemanticResponseCache semanticCache;

    public MenuCacheInvalidator(DeterministicKnowledgeCache knowledgeCache, SemanticResponseCache semanticCache) {
        this.knowledgeCache = knowledgeCache;
        this.semanticCache = semanticCache;
    }

    public void invalidateItem(String restaurantId, String itemId) {
        knowledgeCache.invalidateItem(restaurantId, itemId);
        semanticCache.invalidateRestaurant(restaurantId);
        log.info("Invalidated cached answers for item {} of restaurant {}", itemId, restaurantId);
    }

    public void invalidateRestaurant(String restaurantId) {
        long knowledge = knowledgeCache.invalidateRestaurant(restaurantId);
        long responses = semanticCache.invalidateRestaurant(restaurantId);
        log.info("Invalidated {} templated and {} generated answers for restaurant {}", knowledge, responses, restaurantId);
    }
}
