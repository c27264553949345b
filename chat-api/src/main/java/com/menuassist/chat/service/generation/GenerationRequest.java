package com.menuassist.chat.service.generation;

import java.util.List;
import java.util.Objects;

/**
 * Input to a single generation call. {@code fallbackMessage} is returned verbatim whenever the
 * provider cannot produce a usable answer.
 */
public record GenerationRequest(
        String restaurantId,
        List<PromptMessage> messages,
        GenerationParameters parameters,
        String fallbackMessage
) {

    public GenerationRequest {
        Objects.requireNonNull(parameters, "parameters");
        Objects.requireNonNull(fallbackMessage, "fallbackMessage");
        messages = messages == null ? List.of() : List.copyOf(messages);
    }
}
