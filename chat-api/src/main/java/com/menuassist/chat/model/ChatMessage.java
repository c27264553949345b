package com.menuassist.chat.model;

import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

public record ChatMessage(
        UUID id,
        MessageSender sender,
        String content,
        Map<String, Object> metadata,
        OffsetDateTime createdAt
) {

    public ChatMessage {
        metadata = metadata == null ? Map.of() : copyWithoutNulls(metadata);
    }

    public static ChatMessage customer(String content) {
        return new ChatMessage(UUID.randomUUID(), MessageSender.CUSTOMER, content, Map.of(), OffsetDateTime.now());
    }

    public static ChatMessage assistant(String content, Map<String, Object> metadata) {
        return new ChatMessage(UUID.randomUUID(), MessageSender.ASSISTANT, content, metadata, OffsetDateTime.now());
    }

    private static Map<String, Object> copyWithoutNulls(Map<String, Object> metadata) {
        Map<String, Object> copy = new LinkedHashMap<>();
        metadata.forEach((key, value) -> {
            if (key != null && value != null) {
                copy.put(key, value);
            }
        });
        return Collections.unmodifiableMap(copy);
    }

    public boolean fromCustomer() {
        return sender == MessageSender.CUSTOMER;
    }
}
