package com.menuassist.chat.service.context;

import com.menuassist.chat.config.AssistantProperties;
import com.menuassist.chat.model.ChatMessage;
import com.menuassist.chat.service.config.RestaurantAiConfig;
import com.menuassist.chat.service.generation.PromptMessage;
import com.menuassist.chat.service.menu.MenuItemKnowledge;
import com.menuassist.chat.service.menu.RestaurantProfile;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class ContextAssembler {

    private final SystemPromptBuilder systemPromptBuilder;
    private final IntentDetector intentDetector;
    private final int fastStreamLimit;

    public ContextAssembler(SystemPromptBuilder systemPromptBuilder,
                            IntentDetector intentDetector,
                            AssistantProperties properties) {
        this.systemPromptBuilder = systemPromptBuilder;
        this.intentDetector = intentDetector;
        this.fastStreamLimit = Math.max(0, properties.getHistory().getFastStreamLimit());
    }

    /**
     * Number of history messages to load for a turn. The streaming path trades context for latency.
     */
    public int historyLimit(RestaurantAiConfig config, boolean streaming) {
        int configured = config.model().contextMessages();
        return streaming ? Math.min(configured, fastStreamLimit) : configured;
    }

    /**
     * @param historyNewestFirst previously persisted messages of the conversation, newest first,
     *                           already limited by {@link #historyLimit}
     */
    public AssembledContext assemble(RestaurantProfile restaurant,
                                     List<MenuItemKnowledge> menu,
                                     RestaurantAiConfig config,
                                     List<ChatMessage> historyNewestFirst,
                                     String customerMessage) {
        List<PromptMessage> messages = new ArrayList<>();
        messages.add(PromptMessage.system(
                systemPromptBuilder.build(restaurant, menu, config.model().systemPromptOverride())));

        for (int i = historyNewestFirst.size() - 1; i >= 0; i--) {
            ChatMessage previous = historyNewestFirst.get(i);
            messages.add(new PromptMessage(previous.sender().promptRole(), previous.content()));
        }

        CustomerIntent intent = intentDetector.detect(customerMessage, historyNewestFirst);
        messages.add(PromptMessage.user(customerMessage + "\n\n[" + intent.directive() + "]"));
        return new AssembledContext(messages, intent);
    }
}
