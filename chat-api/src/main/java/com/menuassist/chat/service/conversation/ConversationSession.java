package com.menuassist.chat.service.conversation;

import java.time.OffsetDateTime;

public record ConversationSession(
        String conversationId,
        String restaurantId,
        String sessionId,
        OffsetDateTime lastActivity
) {
}
