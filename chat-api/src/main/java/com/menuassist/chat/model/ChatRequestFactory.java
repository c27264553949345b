package com.menuassist.chat.model;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

public final class ChatRequestFactory {

    private ChatRequestFactory() {
    }

    public static ChatRequest fromSubmission(String restaurantId, ChatSubmission submission) {
        Map<String, Object> context = new HashMap<>();
        if (submission.context() != null) {
            submission.context().forEach((key, value) -> {
                if (key != null && value != null) {
                    context.put(key, value);
                }
            });
        }
        return new ChatRequest(
                Objects.requireNonNull(restaurantId, "restaurantId"),
                submission.sessionId().trim(),
                submission.message().trim(),
                context
        );
    }
}
