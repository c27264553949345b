package com.menuassist.chat.service.generation;

import java.util.Objects;

public record PromptMessage(String role, String content) {

    public static final String SYSTEM = "system";
    public static final String USER = "user";
    public static final String ASSISTANT = "assistant";

    public PromptMessage {
        Objects.requireNonNull(role, "role");
        content = content == null ? "" : content;
    }

    public static PromptMessage system(String content) {
        return new PromptMessage(SYSTEM, content);
    }

    public static PromptMessage user(String content) {
        return new PromptMessage(USER, content);
    }
}
