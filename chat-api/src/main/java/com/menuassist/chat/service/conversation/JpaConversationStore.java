package com.menuassist.chat.service.conversation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.menuassist.chat.model.ChatMessage;
import com.menuassist.chat.persistence.entity.ConversationEntity;
import com.menuassist.chat.persistence.entity.MessageEntity;
import com.menuassist.chat.persistence.repository.ConversationRepository;
import com.menuassist.chat.persistence.repository.MessageRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Service
@Profile("!inmemory")
public class JpaConversationStore implements ConversationStore {

    private static final Logger log = LoggerFactory.getLogger(JpaConversationStore.class);
    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {
    };

    private final ConversationRepository conversationRepository;
    private final MessageRepository messageRepository;
    private final ObjectMapper objectMapper;

    public JpaConversationStore(ConversationRepository conversationRepository,
                                MessageRepository messageRepository,
                                ObjectMapper objectMapper) {
        this.conversationRepository = conversationRepository;
        this.messageRepository = messageRepository;
        this.objectMapper = objectMapper;
    }

    @Override
    public ConversationSession openSession(String restaurantId, String sessionId) {
        return conversationRepository.findByRestaurantIdAndSessionId(restaurantId, sessionId)
                .or(() -> {
                    try {
                        return Optional.of(conversationRepository.saveAndFlush(
                                new ConversationEntity(UUID.randomUUID().toString(), restaurantId, sessionId)));
                    } catch (DataIntegrityViolationException ex) {
                        log.debug("Conversation for session {} was created concurrently, reloading", sessionId);
                        return conversationRepository.findByRestaurantIdAndSessionId(restaurantId, sessionId);
                    }
                })
                .map(this::toSession)
                .orElseThrow(() -> new IllegalStateException("Conversation for session " + sessionId + " could not be opened"));
    }

    @Override
    @Transactional(readOnly = true)
    public List<ChatMessage> recentMessages(String conversationId, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return messageRepository.findByConversationIdOrderBySequenceDesc(conversationId, PageRequest.of(0, limit))
                .stream()
                .map(this::toMessage)
                .toList();
    }

    @Override
    @Transactional
    public TurnSlot reserveTurn(ConversationSession session) {
        ConversationEntity conversation = conversationRepository.findForUpdate(session.conversationId())
                .orElseThrow(() -> new IllegalStateException("Conversation " + session.conversationId() + " no longer exists"));
        return new TurnSlot(session, conversation.reserveSequences(2));
    }

    @Override
    @Transactional
    public RecordedTurn recordTurn(TurnSlot slot, ChatMessage customerMessage, ChatMessage assistantMessage) {
        ConversationSession session = slot.session();
        messageRepository.save(toEntity(session, customerMessage, slot.firstSequence()));
        messageRepository.save(toEntity(session, assistantMessage, slot.replySequence()));
        conversationRepository.findById(session.conversationId())
                .ifPresent(conversation -> conversation.touch(assistantMessage.createdAt()));
        return new RecordedTurn(session.conversationId(), customerMessage.id().toString(), assistantMessage.id().toString());
    }

    private MessageEntity toEntity(ConversationSession session, ChatMessage message, int sequence) {
        return new MessageEntity(
                message.id().toString(),
                session.conversationId(),
                message.sender(),
                message.content(),
                toJson(message.metadata()),
                sequence,
                message.createdAt()
        );
    }

    private ChatMessage toMessage(MessageEntity entity) {
        return new ChatMessage(
                UUID.fromString(entity.getMessageId()),
                entity.getSender(),
                entity.getContent(),
                fromJson(entity.getMetadataJson()),
                entity.getCreatedAt()
        );
    }

    private ConversationSession toSession(ConversationEntity entity) {
        return new ConversationSession(
                entity.getConversationId(),
                entity.getRestaurantId(),
                entity.getSessionId(),
                entity.getLastActivity() == null ? OffsetDateTime.now() : entity.getLastActivity()
        );
    }

    private String toJson(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize message metadata", e);
        }
    }

    private Map<String, Object> fromJson(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, METADATA_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable message metadata: {}", e.getOriginalMessage());
            return Map.of();
        }
    }
}
