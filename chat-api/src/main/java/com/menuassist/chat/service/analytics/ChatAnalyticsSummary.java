package com.menuassist.chat.service.analytics;

import java.util.Map;

/**
 * Chat activity of one restaurant over the last {@code periodDays} days. Rates are fractions
 * between 0 and 1; {@code averageRating} and {@code helpfulRate} are null without feedback.
 */
public record ChatAnalyticsSummary(
        int periodDays,
        long totalConversations,
        long totalMessages,
        double averageConversationLength,
        long totalResponses,
        Map<String, Long> responsesByTier,
        double cacheHitRate,
        double averageLatencyMillis,
        long feedbackCount,
        Double averageRating,
        Double helpfulRate
) {

    public ChatAnalyticsSummary {
        responsesByTier = responsesByTier == null ? Map.of() : Map.copyOf(responsesByTier);
    }
}
