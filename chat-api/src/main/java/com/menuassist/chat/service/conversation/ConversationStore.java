package com.menuassist.chat.service.conversation;

import com.menuassist.chat.model.ChatMessage;

import java.util.List;

/**
 * Conversation persistence. All methods block and must be called off the event loop.
 */
public interface ConversationStore {

    /**
     * Returns the conversation for {@code (restaurantId, sessionId)}, creating it on first use.
     */
    ConversationSession openSession(String restaurantId, String sessionId);

    /**
     * Holds the next two sequence positions of the conversation for a turn that just arrived.
     * Turns recorded later keep the order in which their slots were reserved. A slot that is
     * never recorded leaves a gap.
     */
    TurnSlot reserveTurn(ConversationSession session);

    /**
     * Up to {@code limit} most recent messages of the conversation, newest first.
     */
    List<ChatMessage> recentMessages(String conversationId, int limit);

    /**
     * Writes the customer message and the assistant reply into the reserved slot and records activity.
     */
    RecordedTurn recordTurn(TurnSlot slot, ChatMessage customerMessage, ChatMessage assistantMessage);
}
