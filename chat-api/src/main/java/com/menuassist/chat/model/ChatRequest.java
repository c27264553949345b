package com.menuassist.chat.model;

import java.util.Map;

public record ChatRequest(
        String restaurantId,
        String sessionId,
        String message,
        Map<String, Object> context
) {

    public ChatRequest {
        context = context == null ? Map.of() : Map.copyOf(context);
    }
}
