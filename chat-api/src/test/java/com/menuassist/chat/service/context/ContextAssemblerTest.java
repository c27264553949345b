package com.menuassist.chat.service.context;

import com.menuassist.chat.config.AssistantProperties;
import com.menuassist.chat.model.ChatMessage;
import com.menuassist.chat.service.config.RestaurantAiConfig;
import com.menuassist.chat.service.generation.PromptMessage;
import com.menuassist.chat.service.menu.AvatarProfile;
import com.menuassist.chat.service.menu.MenuItemKnowledge;
import com.menuassist.chat.service.menu.RestaurantProfile;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ContextAssemblerTest {

    private static final RestaurantProfile RESTAURANT = new RestaurantProfile(
            "rest-1",
            "Crumbl Corner",
            "bakery",
            "Warm cookies every day.",
            new AvatarProfile("Cookie", "friendly_knowledgeable", "warm", null, null)
    );

    private static final List<MenuItemKnowledge> MENU = List.of(
            new MenuItemKnowledge("i1", "OG", "Cookies", new BigDecimal("4.49"), "Chocolate chunks",
                    List.of("flour", "chocolate"), Set.of("wheat"), true, 10),
            new MenuItemKnowledge("i2", "Milk", null, new BigDecimal("1.5"), null,
                    List.of(), Set.of("dairy"), false, null)
    );

    private final AssistantProperties properties = new AssistantProperties();
    private final ContextAssembler assembler =
            new ContextAssembler(new SystemPromptBuilder(), new IntentDetector(), properties);

    @Test
    void streamingCapsHistoryWindow() {
        RestaurantAiConfig config = RestaurantAiConfig.defaults("openai", "gpt-4o-mini", 30);

        assertThat(assembler.historyLimit(config, false)).isEqualTo(10);
        assertThat(assembler.historyLimit(config, true)).isEqualTo(3);
    }

    @Test
    void assemblesSystemPromptHistoryOldestFirstAndAnnotatedMessage() {
        RestaurantAiConfig config = RestaurantAiConfig.defaults("openai", "gpt-4o-mini", 30);
        List<ChatMessage> newestFirst = List.of(
                ChatMessage.assistant("Hi! I'm Cookie.", Map.of()),
                ChatMessage.customer("hello")
        );

        AssembledContext context = assembler.assemble(RESTAURANT, MENU, config, newestFirst, "Can I get the OG?");

        List<PromptMessage> messages = context.messages();
        assertThat(messages).extracting(PromptMessage::role)
                .containsExactly(PromptMessage.SYSTEM, PromptMessage.USER, PromptMessage.ASSISTANT, PromptMessage.USER);
        assertThat(messages.get(1).content()).isEqualTo("hello");
        assertThat(messages.get(2).content()).isEqualTo("Hi! I'm Cookie.");
        assertThat(messages.get(3).content())
                .startsWith("Can I get the OG?\n\n[")
                .endsWith(CustomerIntent.ORDERING.directive() + "]");
        assertThat(context.intent()).isEqualTo(CustomerIntent.ORDERING);
    }

    @Test
    void systemPromptCarriesPersonaAndWholeMenu() {
        RestaurantAiConfig config = RestaurantAiConfig.defaults("openai", "gpt-4o-mini", 30);

        String prompt = assembler.assemble(RESTAURANT, MENU, config, List.of(), "hi").messages().get(0).content();

        assertThat(prompt)
                .startsWith("You are Cookie, and you work at Crumbl Corner, a bakery restaurant.")
                .contains("Personality: friendly knowledgeable")
                .contains("COOKIES:\n- OG ($4.49) [SIGNATURE]\n  Description: Chocolate chunks")
                .contains("  Allergens: wheat")
                .contains("OTHER:\n- Milk ($1.50)\n  Allergens: dairy")
                .contains("RULES:");
    }

    @Test
    void personaOverrideReplacesOnlyThePersona() {
        RestaurantAiConfig defaults = RestaurantAiConfig.defaults("openai", "gpt-4o-mini", 30);
        RestaurantAiConfig.ModelSettings model = defaults.model();
        RestaurantAiConfig config = new RestaurantAiConfig(defaults.mode(), defaults.provider(),
                new RestaurantAiConfig.ModelSettings(model.model(), model.maxTokens(), model.temperature(),
                        model.contextMessages(), "You are a pirate baker.", model.timeoutSeconds()),
                defaults.performance(), defaults.speech());

        String prompt = assembler.assemble(RESTAURANT, MENU, config, List.of(), "hi").messages().get(0).content();

        assertThat(prompt).startsWith("You are a pirate baker.\n\nMENU:")
                .doesNotContain("You are Cookie")
                .contains("- OG ($4.49)")
                .contains("RULES:");
    }
}
