package com.menuassist.chat.service.analytics;

import com.menuassist.chat.service.ResponseTier;
import com.menuassist.chat.service.context.CustomerIntent;
import com.menuassist.chat.service.knowledge.QuestionType;

public record AnalyticsEvent(
        String restaurantId,
        String conversationId,
        ResponseTier tier,
        boolean fromCache,
        String cacheKey,
        boolean streaming,
        QuestionType questionType,
        CustomerIntent intent,
        long latencyMillis
) {

    public static final String EVENT_TYPE = "chat_response";
}
