package com.menuassist.chat.service.context;

import com.menuassist.chat.service.knowledge.KnowledgeTemplates;
import com.menuassist.chat.service.menu.AvatarProfile;
import com.menuassist.chat.service.menu.MenuItemKnowledge;
import com.menuassist.chat.service.menu.RestaurantProfile;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders the system prompt: persona, the complete menu and the grounding rules. A configured
 * override replaces the persona paragraph only.
 */
@Component
public class SystemPromptBuilder {

    static final String UNCATEGORIZED = "Other";

    private static final String RULES = """
            RULES:
            - Only state facts that appear in the menu above. Never invent items, prices, ingredients or allergens.
            - If the customer asks about something that is not on the menu, say it is not available.
            - If a detail is missing from the menu, say you don't know and suggest asking our staff.
            - For allergy questions, repeat only the listed allergens and recommend confirming with staff.
            - Keep replies short and conversational, one or two sentences, without emojis.""";

    public String build(RestaurantProfile restaurant, List<MenuItemKnowledge> menu, String personaOverride) {
        StringBuilder prompt = new StringBuilder();
        if (personaOverride != null && !personaOverride.isBlank()) {
            prompt.append(personaOverride.trim());
        } else {
            appendPersona(prompt, restaurant);
        }
        prompt.append("\n\nMENU:");
        if (menu.isEmpty()) {
            prompt.append("\n(no items are currently available)");
        }
        groupByCategory(menu).forEach((category, items) -> {
            prompt.append("\n").append(category.toUpperCase(Locale.ROOT)).append(':');
            items.forEach(item -> appendItem(prompt, item));
        });
        prompt.append("\n\n").append(RULES);
        return prompt.toString();
    }

    private void appendPersona(StringBuilder prompt, RestaurantProfile restaurant) {
        AvatarProfile avatar = restaurant.avatar();
        prompt.append("You are ").append(avatar.name()).append(", and you work at ").append(restaurant.name());
        if (hasText(restaurant.cuisineType())) {
            prompt.append(", a ").append(restaurant.cuisineType()).append(" restaurant");
        }
        prompt.append(". You help customers with menu questions, recommendations and ordering decisions.");
        if (hasText(restaurant.description())) {
            prompt.append("\nAbout us: ").append(restaurant.description().trim());
        }
        if (hasText(avatar.personality())) {
            prompt.append("\nPersonality: ").append(avatar.personality().replace('_', ' '));
        }
        if (hasText(avatar.tone())) {
            prompt.append("\nTone: ").append(avatar.tone());
        }
        if (hasText(avatar.greeting())) {
            prompt.append("\nGreeting: ").append(avatar.greeting().trim());
        }
        if (hasText(avatar.specialInstructions())) {
            prompt.append("\nSpecial instructions: ").append(avatar.specialInstructions().trim());
        }
    }

    private void appendItem(StringBuilder prompt, MenuItemKnowledge item) {
        prompt.append("\n- ").append(item.name());
        if (item.price() != null) {
            prompt.append(" (").append(KnowledgeTemplates.formatPrice(item.price())).append(')');
        }
        if (item.signature()) {
            prompt.append(" [SIGNATURE]");
        }
        if (hasText(item.description())) {
            prompt.append("\n  Description: ").append(item.description().trim());
        }
        if (!item.ingredients().isEmpty()) {
            prompt.append("\n  Ingredients: ").append(String.join(", ", item.ingredients()));
        }
        if (!item.allergens().isEmpty()) {
            prompt.append("\n  Allergens: ").append(String.join(", ", item.allergens()));
        }
        if (item.preparationMinutes() != null && item.preparationMinutes() > 0) {
            prompt.append("\n  Preparation: about ").append(item.preparationMinutes()).append(" minutes");
        }
    }

    private Map<String, List<MenuItemKnowledge>> groupByCategory(List<MenuItemKnowledge> menu) {
        Map<String, List<MenuItemKnowledge>> grouped = new LinkedHashMap<>();
        for (MenuItemKnowledge item : menu) {
            String category = hasText(item.category()) ? item.category() : UNCATEGORIZED;
            grouped.computeIfAbsent(category, key -> new ArrayList<>()).add(item);
        }
        return grouped;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
