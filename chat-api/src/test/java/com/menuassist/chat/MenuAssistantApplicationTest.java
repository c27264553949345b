package com.menuassist.chat;

import com.menuassist.chat.model.ChatReply;
import com.menuassist.chat.model.ChatRequest;
import com.menuassist.chat.model.StreamEnvelope;
import com.menuassist.chat.model.StreamEnvelopeType;
import com.menuassist.chat.persistence.entity.InteractionAnalyticsEntity;
import com.menuassist.chat.persistence.entity.MenuCategoryEntity;
import com.menuassist.chat.persistence.entity.MenuItemEntity;
import com.menuassist.chat.persistence.entity.MessageEntity;
import com.menuassist.chat.persistence.entity.RestaurantEntity;
import com.menuassist.chat.persistence.repository.InteractionAnalyticsRepository;
import com.menuassist.chat.persistence.repository.MenuCategoryRepository;
import com.menuassist.chat.persistence.repository.MenuItemRepository;
import com.menuassist.chat.persistence.repository.MessageRepository;
import com.menuassist.chat.persistence.repository.RestaurantRepository;
import com.menuassist.chat.service.ChatService;
import com.menuassist.chat.service.knowledge.MenuCacheInvalidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Full pipeline against H2 and the in-process cache. No API key is configured, so open questions
 * are answered by the offline provider.
 */
@SpringBootTest
@ActiveProfiles("test")
class MenuAssistantApplicationTest {

    private static final String RESTAURANT_ID = "rest-app-1";

    @Autowired
    private ChatService chatService;

    @Autowired
    private MenuCacheInvalidator cacheInvalidator;

    @Autowired
    private RestaurantRepository restaurantRepository;

    @Autowired
    private MenuCategoryRepository categoryRepository;

    @Autowired
    private MenuItemRepository itemRepository;

    @Autowired
    private MessageRepository messageRepository;

    @Autowired
    private InteractionAnalyticsRepository analyticsRepository;

    @BeforeEach
    void seedMenu() {
        if (restaurantRepository.existsById(RESTAURANT_ID)) {
            return;
        }
        restaurantRepository.save(new RestaurantEntity(RESTAURANT_ID, "Crumbl Corner", "bakery", null,
                "{\"name\":\"Cookie\"}", true));
        MenuCategoryEntity cookies = categoryRepository.save(new MenuCategoryEntity("cat-app-cookies", RESTAURANT_ID, "Cookies", 1));
        itemRepository.save(new MenuItemEntity("app-boneless", RESTAURANT_ID, cookies, "Boneless",
                "Our original signature warm gourmet cookie with a perfectly balanced buttery flavor",
                new BigDecimal("3.99"), true, false, null, 1, List.of(), List.of()));
        itemRepository.save(new MenuItemEntity("app-og", RESTAURANT_ID, cookies, "OG", "Chocolate chunks",
                new BigDecimal("4.49"), true, true, 10, 2, List.of("flour", "chocolate"), List.of("wheat")));
    }

    @Test
    void answersFactQuestionAndRecordsTheTurn() {
        ChatReply reply = chatService.chat(new ChatRequest(RESTAURANT_ID, "app-session-1", "What is the Boneless?", null)).block();

        assertThat(reply).isNotNull();
        assertThat(reply.message()).isEqualTo("Boneless - Our original signature warm gourmet cookie with a perfectly "
                + "balanced buttery flavor. This delicious item is priced at $3.99.");

        List<MessageEntity> stored = messageRepository.findByConversationIdOrderBySequenceAsc(reply.conversationId());
        assertThat(stored).extracting(MessageEntity::getContent)
                .containsExactly("What is the Boneless?", reply.message());
        assertThat(stored.get(1).getMessageId()).isEqualTo(reply.messageId());
        assertThat(stored.get(1).getMetadataJson()).contains("\"tier\":\"knowledge\"");

        List<InteractionAnalyticsEntity> events = analyticsRepository.findByRestaurantIdOrderByIdAsc(RESTAURANT_ID);
        assertThat(events).isNotEmpty();
        assertThat(events.get(events.size() - 1).getEventType()).isEqualTo("chat_response");
    }

    @Test
    void streamsOfflineAnswerWhenNoProviderKeyIsSet() {
        List<StreamEnvelope> envelopes = chatService
                .streamChat(new ChatRequest(RESTAURANT_ID, "app-session-2", "Show me the menu please", null))
                .collectList()
                .block();

        assertThat(envelopes).isNotNull();
        assertThat(envelopes.get(envelopes.size() - 1).type()).isEqualTo(StreamEnvelopeType.DONE);
        String streamed = envelopes.stream()
                .filter(envelope -> envelope.type() == StreamEnvelopeType.TOKEN)
                .map(StreamEnvelope::content)
                .reduce("", String::concat);
        assertThat(streamed).contains("demo mode");
    }

    @Test
    void invalidationKeepsAnswersCorrect() {
        ChatRequest request = new ChatRequest(RESTAURANT_ID, "app-session-3", "how much is the OG", null);
        assertThat(chatService.chat(request).map(ChatReply::message).block()).isEqualTo("The OG costs $4.49.");

        cacheInvalidator.invalidateItem(RESTAURANT_ID, "app-og");

        assertThat(chatService.chat(request).map(ChatReply::message).block()).isEqualTo("The OG costs $4.49.");
    }
}
