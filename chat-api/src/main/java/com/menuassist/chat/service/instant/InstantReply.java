package com.menuassist.chat.service.instant;

import com.menuassist.chat.cache.CacheKeys;

public record InstantReply(String phrase, String text) {

    public String cacheKey() {
        return CacheKeys.instant(phrase);
    }
}
