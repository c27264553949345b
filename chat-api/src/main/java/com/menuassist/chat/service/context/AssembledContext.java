package com.menuassist.chat.service.context;

import com.menuassist.chat.service.generation.PromptMessage;

import java.util.List;

/**
 * Prompt for one turn: the system prompt, history oldest-first, then the annotated customer
 * message.
 */
public record AssembledContext(List<PromptMessage> messages, CustomerIntent intent) {

    public AssembledContext {
        messages = List.copyOf(messages);
    }
}
