package com.menuassist.chat.service.conversation;

import com.menuassist.chat.model.ChatMessage;
import com.menuassist.chat.model.MessageSender;
import com.menuassist.chat.persistence.entity.MessageEntity;
import com.menuassist.chat.persistence.repository.ConversationRepository;
import com.menuassist.chat.persistence.repository.MessageRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
class JpaConversationStoreTest {

    @Autowired
    private JpaConversationStore conversationStore;

    @Autowired
    private ConversationRepository conversationRepository;

    @Autowired
    private MessageRepository messageRepository;

    @Test
    void sessionIsCreatedOnceAndReused() {
        ConversationSession first = conversationStore.openSession("rest-conv-1", "session-a");
        ConversationSession again = conversationStore.openSession("rest-conv-1", "session-a");
        ConversationSession otherRestaurant = conversationStore.openSession("rest-conv-2", "session-a");

        assertThat(again.conversationId()).isEqualTo(first.conversationId());
        assertThat(otherRestaurant.conversationId()).isNotEqualTo(first.conversationId());
        assertThat(conversationRepository.findByRestaurantIdAndSessionId("rest-conv-1", "session-a")).isPresent();
    }

    @Test
    void turnsAreStoredInOrderWithMetadata() {
        ConversationSession session = conversationStore.openSession("rest-conv-3", "session-b");

        conversationStore.recordTurn(conversationStore.reserveTurn(session),
                ChatMessage.customer("hello"),
                ChatMessage.assistant("Hello! Welcome in.", Map.of("tier", "instant", "from_cache", true)));
        RecordedTurn second = conversationStore.recordTurn(conversationStore.reserveTurn(session),
                ChatMessage.customer("how much is the OG"),
                ChatMessage.assistant("The OG costs $4.49.", Map.of("tier", "knowledge", "question_type", "PRICE")));

        List<MessageEntity> stored = messageRepository.findByConversationIdOrderBySequenceAsc(session.conversationId());
        assertThat(stored).extracting(MessageEntity::getSequence).containsExactly(0, 1, 2, 3);
        assertThat(stored).extracting(MessageEntity::getSender).containsExactly(
                MessageSender.CUSTOMER, MessageSender.ASSISTANT, MessageSender.CUSTOMER, MessageSender.ASSISTANT);
        assertThat(stored.get(3).getMessageId()).isEqualTo(second.assistantMessageId());

        List<ChatMessage> recent = conversationStore.recentMessages(session.conversationId(), 3);
        assertThat(recent).extracting(ChatMessage::content)
                .containsExactly("The OG costs $4.49.", "how much is the OG", "Hello! Welcome in.");
        assertThat(recent.get(0).metadata()).containsEntry("question_type", "PRICE");
        assertThat(recent.get(2).metadata()).containsEntry("from_cache", true);
    }

    @Test
    void zeroLimitReturnsNoHistory() {
        ConversationSession session = conversationStore.openSession("rest-conv-4", "session-c");
        conversationStore.recordTurn(conversationStore.reserveTurn(session),
                ChatMessage.customer("hi"), ChatMessage.assistant("Hi there!", Map.of()));

        assertThat(conversationStore.recentMessages(session.conversationId(), 0)).isEmpty();
    }

    @Test
    void overlappingTurnsKeepArrivalOrder() {
        ConversationSession session = conversationStore.openSession("rest-conv-5", "session-d");

        TurnSlot slow = conversationStore.reserveTurn(session);
        TurnSlot quick = conversationStore.reserveTurn(session);
        conversationStore.recordTurn(quick, ChatMessage.customer("thanks"), ChatMessage.assistant("You're welcome!", Map.of()));
        conversationStore.recordTurn(slow, ChatMessage.customer("what do you recommend"), ChatMessage.assistant("Try the OG.", Map.of()));

        List<MessageEntity> stored = messageRepository.findByConversationIdOrderBySequenceAsc(session.conversationId());
        assertThat(stored).extracting(MessageEntity::getContent).containsExactly(
                "what do you recommend", "Try the OG.", "thanks", "You're welcome!");
        assertThat(stored).extracting(MessageEntity::getSequence).containsExactly(0, 1, 2, 3);
    }

    @Test
    void reservingForUnknownConversationFails() {
        ConversationSession ghost = new ConversationSession("missing-conversation", "rest-conv-6", "session-e", OffsetDateTime.now());

        assertThatThrownBy(() -> conversationStore.reserveTurn(ghost))
                .isInstanceOf(IllegalStateException.class);
    }
}
