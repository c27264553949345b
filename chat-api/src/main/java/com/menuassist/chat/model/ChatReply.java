package com.menuassist.chat.model;

import java.util.List;

public record ChatReply(
        String message,
        List<String> suggestions,
        List<Recommendation> recommendations,
        String conversationId,
        String messageId
) {

    public ChatReply {
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }
}
