package com.menuassist.chat.service.analytics;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.menuassist.chat.model.ChatFeedback;
import com.menuassist.chat.persistence.entity.InteractionAnalyticsEntity;
import com.menuassist.chat.persistence.repository.ConversationRepository;
import com.menuassist.chat.persistence.repository.InteractionAnalyticsRepository;
import com.menuassist.chat.persistence.repository.MessageRepository;
import com.menuassist.chat.service.ConversationNotFoundException;
import com.menuassist.chat.service.RestaurantNotFoundException;
import com.menuassist.chat.service.menu.MenuCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Customer feedback on chat answers and per-restaurant chat statistics built from the
 * interaction analytics rows.
 */
@Service
public class ChatAnalyticsService {

    public static final String FEEDBACK_EVENT_TYPE = "chat_feedback";
    static final int MAX_PERIOD_DAYS = 365;

    private static final Logger log = LoggerFactory.getLogger(ChatAnalyticsService.class);

    private final InteractionAnalyticsRepository analyticsRepository;
    private final ConversationRepository conversationRepository;
    private final MessageRepository messageRepository;
    private final MenuCatalog menuCatalog;
    private final ObjectMapper objectMapper;

    public ChatAnalyticsService(InteractionAnalyticsRepository analyticsRepository,
                                ConversationRepository conversationRepository,
                                MessageRepository messageRepository,
                                MenuCatalog menuCatalog,
                                ObjectMapper objectMapper) {
        this.analyticsRepository = analyticsRepository;
        this.conversationRepository = conversationRepository;
        this.messageRepository = messageRepository;
        this.menuCatalog = menuCatalog;
        this.objectMapper = objectMapper;
    }

    @Transactional
    public void recordFeedback(String restaurantId, ChatFeedback feedback) {
        requireRestaurant(restaurantId);
        conversationRepository.findById(feedback.conversationId())
                .filter(conversation -> restaurantId.equals(conversation.getRestaurantId()))
                .orElseThrow(() -> new ConversationNotFoundException(restaurantId, feedback.conversationId()));

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("conversation_id", feedback.conversationId());
        if (feedback.messageId() != null) {
            data.put("message_id", feedback.messageId());
        }
        if (feedback.rating() != null) {
            data.put("rating", feedback.rating());
        }
        if (feedback.helpful() != null) {
            data.put("helpful", feedback.helpful());
        }
        if (feedback.comment() != null && !feedback.comment().isBlank()) {
            data.put("comment", feedback.comment().trim());
        }
        analyticsRepository.save(new InteractionAnalyticsEntity(restaurantId, feedback.conversationId(),
                FEEDBACK_EVENT_TYPE, toJson(data)));
        log.debug("Recorded feedback for conversation {} of restaurant {}", feedback.conversationId(), restaurantId);
    }

    /**
     * @param days requested period, clamped to 1..365
     */
    @Transactional(readOnly = true)
    public ChatAnalyticsSummary summarize(String restaurantId, int days) {
        requireRestaurant(restaurantId);
        int periodDays = Math.max(1, Math.min(MAX_PERIOD_DAYS, days));
        OffsetDateTime since = OffsetDateTime.now().minusDays(periodDays);

        long conversations = conversationRepository.countByRestaurantIdAndLastActivityGreaterThanEqual(restaurantId, since);
        long messages = messageRepository.countForRestaurantSince(restaurantId, since);

        Map<String, Long> byTier = new TreeMap<>();
        long responses = 0;
        long cacheHits = 0;
        long latencyTotal = 0;
        long feedbackCount = 0;
        long ratingCount = 0;
        long ratingTotal = 0;
        long helpfulVotes = 0;
        long helpfulYes = 0;
        for (InteractionAnalyticsEntity row : analyticsRepository.findByRestaurantIdAndTimestampGreaterThanEqual(restaurantId, since)) {
            JsonNode data = readData(row);
            if (data == null) {
                continue;
            }
            if (AnalyticsEvent.EVENT_TYPE.equals(row.getEventType())) {
                responses++;
                byTier.merge(data.path("tier").asText("unknown"), 1L, Long::sum);
                if (data.path("from_cache").asBoolean(false)) {
                    cacheHits++;
                }
                latencyTotal += data.path("latency_ms").asLong(0);
            } else if (FEEDBACK_EVENT_TYPE.equals(row.getEventType())) {
                feedbackCount++;
                if (data.hasNonNull("rating")) {
                    ratingCount++;
                    ratingTotal += data.get("rating").asInt();
                }
                if (data.hasNonNull("helpful")) {
                    helpfulVotes++;
                    if (data.get("helpful").asBoolean()) {
                        helpfulYes++;
                    }
                }
            }
        }

        return new ChatAnalyticsSummary(
                periodDays,
                conversations,
                messages,
                ratio(messages, conversations),
                responses,
                byTier,
                ratio(cacheHits, responses),
                ratio(latencyTotal, responses),
                feedbackCount,
                ratingCount == 0 ? null : ratio(ratingTotal, ratingCount),
                helpfulVotes == 0 ? null : ratio(helpfulYes, helpfulVotes)
        );
    }

    private void requireRestaurant(String restaurantId) {
        if (menuCatalog.findRestaurant(restaurantId).isEmpty()) {
            throw new RestaurantNotFoundException(restaurantId);
        }
    }

    private JsonNode readData(InteractionAnalyticsEntity row) {
        if (row.getEventDataJson() == null || row.getEventDataJson().isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(row.getEventDataJson());
        } catch (JsonProcessingException e) {
            log.warn("Skipping unreadable analytics row {}: {}", row.getId(), e.getOriginalMessage());
            return null;
        }
    }

    private String toJson(Map<String, Object> data) {
        try {
            return objectMapper.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize feedback", e);
        }
    }

    private static double ratio(long numerator, long denominator) {
        return denominator == 0 ? 0.0 : (double) numerator / denominator;
    }
}
