package com.menuassist.chat.service.conversation;

import com.menuassist.chat.model.ChatMessage;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Process-local store for local runs. Each conversation keeps at most {@code maxMessages}
 * messages; the lowest sequence numbers are dropped first.
 */
@Component
@Profile("inmemory")
public class InMemoryConversationStore implements ConversationStore {

    private final Map<String, ConversationSession> sessions = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> sequences = new ConcurrentHashMap<>();
    private final Map<String, NavigableMap<Integer, ChatMessage>> messages = new ConcurrentHashMap<>();
    private final int maxMessages;

    public InMemoryConversationStore(@Value("${chat.conversation.in-memory.max-messages:200}") int maxMessages) {
        this.maxMessages = Math.max(2, maxMessages);
    }

    @Override
    public ConversationSession openSession(String restaurantId, String sessionId) {
        return sessions.computeIfAbsent(sessionKey(restaurantId, sessionId), key ->
                new ConversationSession(UUID.randomUUID().toString(), restaurantId, sessionId, OffsetDateTime.now()));
    }

    @Override
    public TurnSlot reserveTurn(ConversationSession session) {
        int first = sequences.computeIfAbsent(session.conversationId(), key -> new AtomicInteger()).getAndAdd(2);
        return new TurnSlot(session, first);
    }

    @Override
    public List<ChatMessage> recentMessages(String conversationId, int limit) {
        NavigableMap<Integer, ChatMessage> stored = messages.get(conversationId);
        List<ChatMessage> newestFirst = new ArrayList<>();
        if (stored == null) {
            return newestFirst;
        }
        for (ChatMessage message : stored.descendingMap().values()) {
            if (newestFirst.size() >= limit) {
                break;
            }
            newestFirst.add(message);
        }
        return newestFirst;
    }

    @Override
    public RecordedTurn recordTurn(TurnSlot slot, ChatMessage customerMessage, ChatMessage assistantMessage) {
        ConversationSession session = slot.session();
        NavigableMap<Integer, ChatMessage> log = messages.computeIfAbsent(session.conversationId(),
                key -> new ConcurrentSkipListMap<>());
        log.put(slot.firstSequence(), customerMessage);
        log.put(slot.replySequence(), assistantMessage);
        while (log.size() > maxMessages) {
            log.pollFirstEntry();
        }
        sessions.computeIfPresent(sessionKey(session.restaurantId(), session.sessionId()), (key, existing) ->
                new ConversationSession(existing.conversationId(), existing.restaurantId(), existing.sessionId(),
                        assistantMessage.createdAt()));
        return new RecordedTurn(session.conversationId(), customerMessage.id().toString(), assistantMessage.id().toString());
    }

    private static String sessionKey(String restaurantId, String sessionId) {
        return restaurantId + "\n" + sessionId;
    }
}
