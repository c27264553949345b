package com.menuassist.chat.service.conversation;

/**
 * Sequence positions held for one turn: the customer message goes at {@code firstSequence} and
 * the reply right after it.
 */
public record TurnSlot(ConversationSession session, int firstSequence) {

    public int replySequence() {
        return firstSequence + 1;
    }
}
