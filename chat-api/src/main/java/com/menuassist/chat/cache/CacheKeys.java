package com.menuassist.chat.cache;

import com.menuassist.chat.service.knowledge.QuestionType;

import java.util.Locale;

public final class CacheKeys {

    public static final String INSTANT_NAMESPACE = "instant";
    public static final String KNOWLEDGE_NAMESPACE = "knowledge";
    public static final String SEMANTIC_NAMESPACE = "semantic";

    private CacheKeys() {
    }

    public static String instant(String phrase) {
        return INSTANT_NAMESPACE + ":" + phrase;
    }

    public static String knowledge(String restaurantId, QuestionType type, String itemId) {
        return knowledgePrefix(restaurantId) + type.name().toLowerCase(Locale.ROOT) + ":" + itemId;
    }

    public static String knowledgePrefix(String restaurantId) {
        return KNOWLEDGE_NAMESPACE + ":" + restaurantId + ":";
    }

    public static String semantic(String restaurantId, String messageHash) {
        return semanticPrefix(restaurantId) + messageHash;
    }

    public static String semanticPrefix(String restaurantId) {
        return SEMANTIC_NAMESPACE + ":" + restaurantId + ":";
    }
}
